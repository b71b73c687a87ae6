package diffmigrator.model;

import java.util.Objects;

/**
 * An {@code #include} directive.
 *
 * @param name the included file name as written, e.g. {@code math_utils.h}
 * @param system true for angle-bracket includes
 */
public record IncludeDirective(String name, boolean system) {

    public IncludeDirective {
        Objects.requireNonNull(name, "name");
    }

    /** Returns the file name without directories and extension. */
    public String stem() {
        String base = name;
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) base = base.substring(slash + 1);
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }
}
