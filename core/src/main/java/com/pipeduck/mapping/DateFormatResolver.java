package com.pipeduck.mapping;

import com.pipeduck.exception.UnsupportedTypeException;
import com.pipeduck.types.DataType;
import com.pipeduck.types.DateType;
import com.pipeduck.types.TimestampType;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies the {@code format} of an index {@code date} field as a date or a timestamp.
 *
 * <p>The format is a {@code ||} separated list. Epoch tokens ({@code epoch_millis},
 * {@code epoch_second}) are separated from named patterns and only the first token of
 * each group is considered. Accepted combinations:
 * <pre>
 *   date | strict_date                                   -> DateType
 *   strict_date_optional_time                            -> TimestampType
 *   strict_date_optional_time_nanos                      -> TimestampType
 *   epoch_millis                                         -> TimestampType
 *   strict_date_optional_time || epoch_millis            -> TimestampType
 * </pre>
 * Everything else fails.
 */
public final class DateFormatResolver {

    /** Format assumed when a date field declares none. */
    public static final String DEFAULT_DATE_FORMAT = "strict_date_optional_time || epoch_millis";

    /** Format written for {@link TimestampType} fields. */
    public static final String TIMESTAMP_FORMAT = "strict_date_optional_time_nanos";

    /** Format written for {@link DateType} fields. */
    public static final String DATE_FORMAT = "strict_date";

    private static final String EPOCH_MILLIS = "epoch_millis";
    private static final String EPOCH_SECOND = "epoch_second";

    private DateFormatResolver() {}

    /**
     * Resolves a date format string to a temporal type.
     *
     * @param fieldName the field declaring the format, for error reporting
     * @param format the format string
     * @return DateType or TimestampType
     * @throws UnsupportedTypeException if the combination is not supported
     */
    public static DataType resolve(String fieldName, String format) {
        List<String> patterns = new ArrayList<>();
        List<String> epochs = new ArrayList<>();
        for (String token : format.split("\\|\\|")) {
            String trimmed = token.trim();
            if (trimmed.equals(EPOCH_MILLIS) || trimmed.equals(EPOCH_SECOND)) {
                epochs.add(trimmed);
            } else {
                patterns.add(trimmed);
            }
        }

        String pattern = patterns.isEmpty() ? null : patterns.get(0);
        String epoch = epochs.isEmpty() ? null : epochs.get(0);

        if (epoch == null && ("date".equals(pattern) || "strict_date".equals(pattern))) {
            return DateType.get();
        }
        if (epoch == null && ("strict_date_optional_time".equals(pattern)
                || "strict_date_optional_time_nanos".equals(pattern))) {
            return TimestampType.get();
        }
        if (EPOCH_MILLIS.equals(epoch) && (pattern == null || "strict_date_optional_time".equals(pattern))) {
            return TimestampType.get();
        }
        throw new UnsupportedTypeException(fieldName, format,
            "unsupported date type format: " + format + (fieldName != null ? " (field " + fieldName + ")" : ""));
    }
}
