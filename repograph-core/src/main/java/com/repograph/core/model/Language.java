package com.repograph.core.model;

import java.util.Locale;
import java.util.Set;

/**
 * Language tags assigned to files by the scanning collaborator.
 *
 * <p>Only the languages the resolver understands are enumerated; every other file is tagged
 * {@link #OTHER}. Each constant knows the display name the scanner uses for it, the file
 * extensions it is detected from and the {@link LanguageFamily} used for dispatch.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Language.detect("src/App.tsx");          // TYPESCRIPT_REACT
 * Language.fromDisplayName("C++ Header");  // CPP_HEADER
 * Language.CPP_HEADER.family();            // C_FAMILY
 * }</pre>
 */
public enum Language {
    TYPESCRIPT("TypeScript", LanguageFamily.JAVASCRIPT, "ts"),
    TYPESCRIPT_REACT("TypeScript React", LanguageFamily.JAVASCRIPT, "tsx"),
    JAVASCRIPT("JavaScript", LanguageFamily.JAVASCRIPT, "js"),
    JAVASCRIPT_REACT("JavaScript React", LanguageFamily.JAVASCRIPT, "jsx"),
    PYTHON("Python", LanguageFamily.PYTHON, "py"),
    JAVA("Java", LanguageFamily.JAVA, "java"),
    GO("Go", LanguageFamily.GO, "go"),
    C("C", LanguageFamily.C_FAMILY, "c"),
    C_HEADER("C Header", LanguageFamily.C_FAMILY, "h"),
    CPP("C++", LanguageFamily.C_FAMILY, "cpp", "cc", "cxx"),
    CPP_HEADER("C++ Header", LanguageFamily.C_FAMILY, "hpp"),
    RUST("Rust", LanguageFamily.RUST, "rs"),
    SWIFT("Swift", LanguageFamily.SWIFT, "swift"),
    OTHER("Other", LanguageFamily.NONE);

    private final String displayName;
    private final LanguageFamily family;
    private final Set<String> extensions;

    Language(String displayName, LanguageFamily family, String... extensions) {
        this.displayName = displayName;
        this.family = family;
        this.extensions = Set.of(extensions);
    }

    public String displayName() {
        return displayName;
    }

    public LanguageFamily family() {
        return family;
    }

    /**
     * Returns the lower-case file extensions (without dot) this language is detected from.
     *
     * @return extensions, empty for {@link #OTHER}
     */
    public Set<String> extensions() {
        return extensions;
    }

    /**
     * Detects the language of a file from its extension, ignoring case.
     *
     * @param fileName file name or path
     * @return detected language, {@link #OTHER} when the extension is unknown or missing
     */
    public static Language detect(String fileName) {
        if (fileName == null) {
            return OTHER;
        }
        int lastSlash = fileName.lastIndexOf('/');
        String name = fileName.substring(lastSlash + 1);
        int lastDot = name.lastIndexOf('.');
        if (lastDot < 0 || lastDot == name.length() - 1) {
            return OTHER;
        }
        String extension = name.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.extensions.contains(extension)) {
                return language;
            }
        }
        return OTHER;
    }

    /**
     * Maps a scanner display name to a language.
     *
     * <p>Accepts the display names listed on the constants, the enum names, and the short
     * {@code TSX}/{@code JSX} tags produced by older scanners.
     *
     * @param name display name such as {@code "TypeScript React"}
     * @return matching language, {@link #OTHER} when unrecognized
     */
    public static Language fromDisplayName(String name) {
        if (name == null || name.isBlank()) {
            return OTHER;
        }
        String trimmed = name.trim();
        if (trimmed.equalsIgnoreCase("TSX")) {
            return TYPESCRIPT_REACT;
        }
        if (trimmed.equalsIgnoreCase("JSX")) {
            return JAVASCRIPT_REACT;
        }
        for (Language language : values()) {
            if (language.displayName.equalsIgnoreCase(trimmed) || language.name().equalsIgnoreCase(trimmed)) {
                return language;
            }
        }
        return OTHER;
    }
}
