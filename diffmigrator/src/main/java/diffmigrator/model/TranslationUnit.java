package diffmigrator.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Normalized representation of one source file, as produced by a {@link SourceParser}.
 *
 * <p>Instances are immutable; all collections are defensive copies.
 *
 * @param id unit identifier, conventionally the file name without extension
 * @param sourcePath path of the original file, for diagnostics
 * @param sourceText full source text, compiled as-is by the baseline backend
 * @param includes include directives in source order
 * @param functions functions defined in this unit
 * @param structs struct declarations
 * @param enums enum declarations
 * @param constants constants and object-like macros
 */
public record TranslationUnit(
        String id,
        String sourcePath,
        String sourceText,
        List<IncludeDirective> includes,
        List<FunctionDecl> functions,
        List<StructDecl> structs,
        List<EnumDecl> enums,
        List<ConstantDecl> constants
) {

    public TranslationUnit {
        Objects.requireNonNull(id, "id");
        sourceText = sourceText != null ? sourceText : "";
        includes = List.copyOf(includes);
        functions = List.copyOf(functions);
        structs = structs != null ? List.copyOf(structs) : List.of();
        enums = enums != null ? List.copyOf(enums) : List.of();
        constants = constants != null ? List.copyOf(constants) : List.of();
    }

    /** Creates a unit with only includes and functions, the common case in tests and tools. */
    public static TranslationUnit of(String id, String sourceText,
                                     List<IncludeDirective> includes,
                                     List<FunctionDecl> functions) {
        return new TranslationUnit(id, id + ".c", sourceText, includes, functions,
                List.of(), List.of(), List.of());
    }

    public Optional<FunctionDecl> function(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public Set<String> definedFunctionNames() {
        return functions.stream().map(FunctionDecl::name).collect(Collectors.toUnmodifiableSet());
    }

    /** Names of user (quoted) includes, in source order. */
    public List<String> userIncludes() {
        return includes.stream().filter(i -> !i.system()).map(IncludeDirective::name).toList();
    }

    public int linesOfCode() {
        return sourceText.isEmpty() ? 0 : (int) sourceText.lines().count();
    }
}
