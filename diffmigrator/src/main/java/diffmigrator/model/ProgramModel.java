package diffmigrator.model;

import diffmigrator.exceptions.MigrationException;
import diffmigrator.graph.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

/**
 * The set of translation units taking part in one migration run.
 *
 * <p>Besides lookup, the model derives dependency edges between units:
 * unit A depends on unit B if A includes a header whose stem is B's id, or if
 * A calls a function that B defines and A does not. System includes and
 * headers that match no unit produce no edge.
 */
public final class ProgramModel {

    private static final Logger log = LoggerFactory.getLogger(ProgramModel.class);

    private final Map<String, TranslationUnit> units;

    private ProgramModel(Map<String, TranslationUnit> units) {
        this.units = units;
    }

    /**
     * Builds a model from already parsed units.
     *
     * @param units the units; ids must be unique
     * @return the model
     * @throws MigrationException if two units share an id
     */
    public static ProgramModel of(Collection<TranslationUnit> units) throws MigrationException {
        Map<String, TranslationUnit> byId = new TreeMap<>();
        for (TranslationUnit unit : units) {
            if (byId.putIfAbsent(unit.id(), unit) != null) {
                throw new MigrationException("Duplicate translation unit id: " + unit.id());
            }
        }
        return new ProgramModel(Collections.unmodifiableMap(byId));
    }

    /**
     * Parses every file with the given parser and builds a model.
     *
     * <p>Files that fail to parse are logged and left out; they are not part
     * of the run.
     *
     * @param parser the source parser
     * @param files files to parse
     * @return the model
     * @throws MigrationException if two parsed units share an id
     */
    public static ProgramModel parse(SourceParser parser, Collection<Path> files) throws MigrationException {
        List<TranslationUnit> parsed = new ArrayList<>();
        for (Path file : files) {
            try {
                parsed.add(parser.parse(file));
            } catch (MigrationException e) {
                log.error("Failed to parse {}: {}", file, e.getMessage());
            }
        }
        log.info("Parsed {} of {} source files", parsed.size(), files.size());
        return of(parsed);
    }

    public Optional<TranslationUnit> unit(String id) {
        return Optional.ofNullable(units.get(id));
    }

    /** Returns all units ordered by id. */
    public Collection<TranslationUnit> units() {
        return units.values();
    }

    public Set<String> unitIds() {
        return units.keySet();
    }

    public int size() {
        return units.size();
    }

    /**
     * Computes the ids of the units {@code unitId} depends on, sorted.
     *
     * @param unitId the dependent unit
     * @return dependency ids, never containing {@code unitId} itself
     */
    public SortedSet<String> dependenciesOf(String unitId) {
        TranslationUnit unit = units.get(unitId);
        SortedSet<String> deps = new TreeSet<>();
        if (unit == null) return deps;

        for (IncludeDirective include : unit.includes()) {
            if (include.system()) continue;
            String stem = include.stem();
            if (units.containsKey(stem)) {
                deps.add(stem);
            }
        }

        Set<String> local = unit.definedFunctionNames();
        for (FunctionDecl fn : unit.functions()) {
            for (String callee : fn.calledFunctions()) {
                if (local.contains(callee)) continue;
                String owner = soleDefinerOf(callee);
                if (owner != null) {
                    deps.add(owner);
                }
            }
        }

        deps.remove(unitId);
        return deps;
    }

    private String soleDefinerOf(String functionName) {
        String owner = null;
        for (TranslationUnit unit : units.values()) {
            if (unit.definedFunctionNames().contains(functionName)) {
                if (owner != null) return null;
                owner = unit.id();
            }
        }
        return owner;
    }

    /**
     * Builds the dependency graph over all units of this model.
     *
     * @return a fresh graph
     */
    public DependencyGraph buildGraph() {
        DependencyGraph graph = new DependencyGraph();
        for (String id : units.keySet()) {
            graph.addUnit(id, dependenciesOf(id));
        }
        return graph;
    }
}
