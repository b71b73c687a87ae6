package diffmigrator.model;

import java.util.List;

/**
 * A struct declaration.
 *
 * @param name struct tag or typedef name
 * @param members ordered members
 * @param typedef true if declared through {@code typedef}
 */
public record StructDecl(String name, List<Parameter> members, boolean typedef) {

    public StructDecl {
        members = List.copyOf(members);
    }
}
