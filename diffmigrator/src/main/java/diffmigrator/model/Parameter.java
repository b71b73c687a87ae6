package diffmigrator.model;

import java.util.Objects;

/**
 * A named, typed function parameter.
 *
 * @param name parameter name as declared
 * @param type declared type
 */
public record Parameter(String name, TypeRef type) {

    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    /**
     * A non-const pointer or array parameter is observable after the call,
     * so its final contents are captured as an output.
     */
    public boolean isOutput() {
        return type.isSequence() && !type.isConst() && type.kind() != PrimitiveKind.STRING;
    }
}
