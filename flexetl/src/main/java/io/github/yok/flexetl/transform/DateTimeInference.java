package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.ColumnType;
import io.github.yok.flexetl.model.Dataset;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Reinterprets date-like text columns as {@link ColumnType#DATETIME}.
 *
 * <p>
 * A column is a candidate when its name contains {@code date} or {@code time} (case-insensitive)
 * and its type is {@link ColumnType#TEXT}. Every non-missing value must parse with one of the
 * accepted formats; otherwise the column is left exactly as it was. This per-column skip is the
 * intended fallback, not an error: the stage itself never fails.
 * </p>
 *
 * <p>
 * Accepted formats, tried in order:
 * </p>
 * <ol>
 * <li>ISO date-time with offset ({@code 2024-01-31T10:15:30+09:00}), converted to UTC</li>
 * <li>ISO local date-time ({@code 2024-01-31T10:15:30})</li>
 * <li>{@code yyyy-MM-dd HH:mm[:ss[.fraction]]}</li>
 * <li>{@code yyyy/MM/dd HH:mm[:ss]}</li>
 * <li>{@code yyyy-MM-dd}, {@code yyyy/MM/dd}, {@code yyyyMMdd}, {@code yyyy.MM.dd},
 * {@code MM/dd/yyyy} (start of day)</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DateTimeInference implements TransformStage {

    private static final DateTimeFormatter SPACED_DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm").optionalStart().appendPattern(":ss")
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd().optionalEnd().toFormatter().withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter SLASHED_DATE_TIME =
            new DateTimeFormatterBuilder().appendPattern("uuuu/MM/dd HH:mm").optionalStart()
                    .appendPattern(":ss").optionalEnd().toFormatter()
                    .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter[] DATE_TIME_FORMATTERS =
            {DateTimeFormatter.ISO_LOCAL_DATE_TIME, SPACED_DATE_TIME, SLASHED_DATE_TIME};

    private static final DateTimeFormatter[] DATE_ONLY_FORMATTERS = {
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("uuuu/MM/dd").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.BASIC_ISO_DATE,
            DateTimeFormatter.ofPattern("uuuu.MM.dd").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT)};

    @Override
    public StageId id() {
        return StageId.PARSE_DATES;
    }

    @Override
    public Dataset apply(Dataset input) {
        List<Column> columns = new ArrayList<>(input.columnCount());
        for (Column column : input.columns()) {
            columns.add(isCandidate(column) ? tryConvert(column) : column);
        }
        return input.withColumns(columns);
    }

    /**
     * Parses a single text value.
     *
     * @param text value to parse
     * @return parsed date-time, or {@code null} if no accepted format matches
     */
    static LocalDateTime parse(String text) {
        String value = text.strip();
        if (value.isEmpty()) {
            return null;
        }
        OffsetDateTime offset =
                tryParse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME, OffsetDateTime::from);
        if (offset != null) {
            return offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        for (DateTimeFormatter formatter : DATE_TIME_FORMATTERS) {
            LocalDateTime dateTime = tryParse(value, formatter, LocalDateTime::from);
            if (dateTime != null) {
                return dateTime;
            }
        }
        for (DateTimeFormatter formatter : DATE_ONLY_FORMATTERS) {
            LocalDate date = tryParse(value, formatter, LocalDate::from);
            if (date != null) {
                return date.atStartOfDay();
            }
        }
        return null;
    }

    private static <T> T tryParse(String value, DateTimeFormatter formatter,
            TemporalQuery<T> query) {
        try {
            return formatter.parse(value, query);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private boolean isCandidate(Column column) {
        String name = column.getName().toLowerCase(Locale.ROOT);
        return column.getType() == ColumnType.TEXT
                && (name.contains("date") || name.contains("time"));
    }

    private Column tryConvert(Column column) {
        List<Object> parsed = new ArrayList<>(column.size());
        for (Object value : column.getValues()) {
            if (value == null) {
                parsed.add(null);
                continue;
            }
            LocalDateTime dateTime = parse((String) value);
            if (dateTime == null) {
                log.debug("Column '{}' left unchanged: '{}' is not a date-time",
                        column.getName(), value);
                return column;
            }
            parsed.add(dateTime);
        }
        log.debug("Column '{}' parsed as date-time", column.getName());
        return column.withValues(ColumnType.DATETIME, parsed);
    }
}
