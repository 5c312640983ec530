package io.github.yok.flexetl.source;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import org.apache.commons.io.FilenameUtils;

/**
 * Enumeration of supported data sources.
 *
 * <p>
 * File-based kinds define the file extensions recognized as belonging to them, so that callers do
 * not hardcode string comparisons when detecting the kind of a location.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum SourceKind {

    // Comma-Separated Values file (CSV).
    CSV("csv"),

    // JavaScript Object Notation file (JSON).
    JSON("json"),

    // JSON document returned by an HTTP GET.
    API();

    // Set of valid extensions for this kind (all lowercase)
    private final Set<String> extensions;

    SourceKind(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this kind.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this kind, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Resolves a kind from its name, ignoring case ({@code csv}, {@code json}, {@code api}).
     *
     * @param name kind name
     * @return the matching kind
     * @throws IllegalArgumentException if no kind matches
     */
    public static SourceKind parse(String name) {
        for (SourceKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name == null ? null : name.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source kind: " + name);
    }

    /**
     * Detects the kind of a location: HTTP(S) URLs are {@link #API}, files are recognized by
     * extension.
     *
     * @param location file path or URL
     * @return detected kind
     * @throws IllegalArgumentException if the location matches no kind
     */
    public static SourceKind detect(String location) {
        String lower = location.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return API;
        }
        String ext = FilenameUtils.getExtension(lower);
        for (SourceKind kind : values()) {
            if (kind.matches(ext)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Cannot detect source kind of: " + location);
    }
}
