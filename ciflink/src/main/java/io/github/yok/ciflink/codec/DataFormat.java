package io.github.yok.ciflink.codec;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported document formats.
 *
 * <p>
 * Each format defines one or more file extensions that are recognized as belonging to that format.
 * For example, {@link #YAML} supports both {@code .yaml} and {@code .yml}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum DataFormat {

    // CIF text (data and dictionary files).
    CIF("cif", "mmcif", "dic"),

    // Comma-Separated Values, one file per category.
    CSV("csv"),

    // JavaScript Object Notation.
    JSON("json"),

    // YAML Ain't Markup Language (YAML/YML).
    YAML("yaml", "yml"),

    // Extensible Markup Language (hierarchical PDBML-style documents).
    XML("xml");

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    DataFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(String::toLowerCase).collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase());
    }

    /**
     * Resolves a format from a file extension.
     *
     * @param ext extension without dot
     * @return matching format, or {@code null} if none matches
     */
    public static DataFormat fromExtension(String ext) {
        for (DataFormat format : values()) {
            if (format.matches(ext)) {
                return format;
            }
        }
        return null;
    }
}
