package diffmigrator.oracle;

/**
 * Test generation strategy, also recorded as the category of each generated case.
 */
public enum TestCategory {
    /** Type extrema and near-extrema, one parameter at a time and combined. */
    BOUNDARY,
    /** Nulls, zero divisors, empty arrays, float specials and integer wrap points. */
    EDGE,
    /** Seeded random values within each parameter's type range. */
    RANDOM;

    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
