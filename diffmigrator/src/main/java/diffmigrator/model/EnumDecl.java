package diffmigrator.model;

import java.util.Map;
import java.util.LinkedHashMap;
import java.util.Collections;

/**
 * An enum declaration with its constants in declaration order.
 *
 * @param name enum name
 * @param values constant name to value
 */
public record EnumDecl(String name, Map<String, Long> values) {

    public EnumDecl {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
