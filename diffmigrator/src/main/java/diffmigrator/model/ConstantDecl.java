package diffmigrator.model;

/**
 * A {@code #define} or file-level constant.
 *
 * @param name constant name
 * @param value the literal text of its value
 */
public record ConstantDecl(String name, String value) {
}
