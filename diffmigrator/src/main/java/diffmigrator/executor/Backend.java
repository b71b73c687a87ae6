package diffmigrator.executor;

/**
 * The two sides of a differential run.
 */
public enum Backend {
    /** The original C sources. */
    C("c", "baseline"),
    /** The converted C# sources. */
    CSHARP("cs", "target");

    private final String extension;
    private final String role;

    Backend(String extension, String role) {
        this.extension = extension;
        this.role = role;
    }

    /** Source file extension without the dot. */
    public String extension() {
        return extension;
    }

    /** {@code baseline} or {@code target}, for logs and reports. */
    public String role() {
        return role;
    }
}
