package diffmigrator.executor;

import diffmigrator.model.FunctionDecl;
import diffmigrator.model.Parameter;
import diffmigrator.model.PrimitiveKind;

import java.util.ArrayList;
import java.util.List;

/**
 * The ordered outputs a harness prints for one function: the return value
 * (named {@code return}) when the function is not void, then every non-const
 * pointer or array parameter, by parameter name.
 *
 * @param functionName the function
 * @param slots outputs in print order
 */
public record OutputSignature(String functionName, List<Slot> slots) {

    public static final String RETURN = "return";

    /**
     * One printed output.
     *
     * @param name {@code return} or the parameter name
     * @param kind declared scalar kind (element kind for sequences)
     * @param sequence true if printed as an array
     */
    public record Slot(String name, PrimitiveKind kind, boolean sequence) {
    }

    public OutputSignature {
        slots = List.copyOf(slots);
    }

    public static OutputSignature of(FunctionDecl function) {
        List<Slot> slots = new ArrayList<>();
        if (!function.returnType().isVoid()) {
            slots.add(new Slot(RETURN, function.returnType().kind(), false));
        }
        for (Parameter p : function.parameters()) {
            if (p.isOutput()) {
                slots.add(new Slot(p.name(), p.type().kind(), true));
            }
        }
        return new OutputSignature(function.name(), slots);
    }

    public List<String> names() {
        return slots.stream().map(Slot::name).toList();
    }

    public int size() {
        return slots.size();
    }
}
