package diffmigrator.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A function declared in a translation unit.
 *
 * @param name function name
 * @param returnType declared return type
 * @param parameters ordered parameter list
 * @param calledFunctions names of functions invoked from the body
 * @param isStatic true for file-local functions
 * @param body the function body text, used for structural analysis
 */
public record FunctionDecl(
        String name,
        TypeRef returnType,
        List<Parameter> parameters,
        Set<String> calledFunctions,
        boolean isStatic,
        String body
) {

    public FunctionDecl {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
        parameters = List.copyOf(parameters);
        calledFunctions = calledFunctions != null ? Set.copyOf(calledFunctions) : Set.of();
        body = body != null ? body : "";
    }

    /** Convenience constructor for declarations without a body. */
    public static FunctionDecl of(String name, TypeRef returnType, Parameter... parameters) {
        return new FunctionDecl(name, returnType, List.of(parameters), Set.of(), false, "");
    }

    public Optional<Parameter> parameter(String parameterName) {
        return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
    }

    public boolean isEntryPoint() {
        return "main".equals(name);
    }

    /**
     * True if every parameter and the return type have a value domain the
     * oracle generator and harnesses can handle.
     */
    public boolean isTestable() {
        if (!returnType.isVoid() && !returnType.isSupported()) return false;
        if (!returnType.isVoid() && returnType.isPointer()) return false;
        return parameters.stream().allMatch(p -> p.type().isSupported());
    }
}
