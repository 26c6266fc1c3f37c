package com.repograph.core.model;

/**
 * Groups of languages that share one reference syntax.
 *
 * <p>The family is the dispatch key for reference extraction and resolution: every
 * {@link Language} belongs to exactly one family, and each family other than {@link #NONE}
 * has exactly one extractor/resolver pair.
 */
public enum LanguageFamily {
    /** TypeScript, JavaScript and their JSX variants. */
    JAVASCRIPT("javascript"),

    PYTHON("python"),

    JAVA("java"),

    GO("go"),

    /** C and C++ sources and headers. */
    C_FAMILY("c-family"),

    RUST("rust"),

    /** Swift files, related by type usage rather than import statements. */
    SWIFT("swift"),

    /** Languages without reference extraction. */
    NONE("none");

    private final String id;

    LanguageFamily(String id) {
        this.id = id;
    }

    /**
     * Returns the kebab-case identifier used in configuration files and CLI options.
     *
     * @return family identifier
     */
    public String id() {
        return id;
    }

    /**
     * Looks up a family by its identifier or enum name, ignoring case.
     *
     * @param value identifier such as {@code c-family} or {@code C_FAMILY}
     * @return matching family
     * @throws IllegalArgumentException if no family matches
     */
    public static LanguageFamily fromId(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (LanguageFamily family : values()) {
                if (family.id.equalsIgnoreCase(normalized) || family.name().equalsIgnoreCase(normalized)) {
                    return family;
                }
            }
        }
        throw new IllegalArgumentException("Unknown language family: " + value);
    }
}
