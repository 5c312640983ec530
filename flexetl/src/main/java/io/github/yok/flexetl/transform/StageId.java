package io.github.yok.flexetl.transform;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Identifiers of the transform stages, declared in canonical execution order.
 *
 * <p>
 * The declaration order is the only order in which stages run. A caller enables or disables
 * stages but never reorders them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum StageId {

    NORMALIZE_COLUMNS("normalize-columns", "Clean column names & remove duplicates"),

    PARSE_DATES("parse-dates", "Parse date columns"),

    CONVERT_TYPES("convert-types", "Convert data types"),

    DROP_MISSING("drop-missing", "Drop missing data"),

    REMOVE_OUTLIERS("remove-outliers", "Remove outliers"),

    ENCODE_CATEGORICAL("encode-categorical", "Encode categorical columns (dummy variables)"),

    SCALE_FEATURES("scale-features", "Scale numeric features"),

    DERIVE_FEATURES("derive-features", "Apply feature engineering");

    // Key used on the command line and in application.yml
    private final String key;

    // Human-readable label for logs
    private final String label;

    /**
     * Resolves a stage from its key or enum name, ignoring case and surrounding whitespace.
     * Underscores and hyphens are interchangeable.
     *
     * @param text key such as {@code drop-missing} or name such as {@code DROP_MISSING}
     * @return the matching stage
     * @throws IllegalArgumentException if no stage matches
     */
    public static StageId parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Stage name must not be null");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (StageId id : values()) {
            if (id.key.equals(normalized)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + text);
    }

    /**
     * Resolves several stage names, skipping blank entries.
     *
     * @param texts keys or enum names
     * @return the matching stages
     * @throws IllegalArgumentException if a non-blank entry matches no stage
     */
    public static Set<StageId> parseAll(Collection<String> texts) {
        Set<StageId> ids = EnumSet.noneOf(StageId.class);
        for (String text : texts) {
            if (text != null && !text.isBlank()) {
                ids.add(parse(text));
            }
        }
        return ids;
    }
}
