package io.github.yok.sheetsync.clean;

import io.github.yok.sheetsync.schema.ColumnType;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts raw spreadsheet cells into typed values.
 *
 * <p>
 * Every conversion is total: a value that cannot be converted yields {@code null} instead of an
 * exception. Whether a {@code null} is acceptable is decided by the caller from the table schema.
 * </p>
 *
 * <ul>
 * <li><strong>text</strong>: whitespace runs collapsed to one space, control characters removed,
 * trimmed; empty result is {@code null}.</li>
 * <li><strong>decimal</strong>: everything except digits, comma, dot and minus removed, comma read as
 * dot, all dots but the last treated as thousands separators; result is a {@link Double}.</li>
 * <li><strong>integer</strong>: everything except digits and minus removed; result is a
 * {@link Long}.</li>
 * <li><strong>date</strong>: {@code yyyy-MM-dd}, {@code dd/MM/yyyy}, {@code dd-MM-yyyy} or
 * {@code yyyy/MM/dd}; result is the ISO string {@code yyyy-MM-dd}.</li>
 * </ul>
 *
 * <p>
 * Decimal values outside the advisory range are logged, never rejected.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CellCleaner {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1F\\x7F-\\x9F]");
    private static final Pattern NON_DECIMAL_CHARS = Pattern.compile("[^0-9,.\\-]");
    private static final Pattern NON_INTEGER_CHARS = Pattern.compile("[^0-9\\-]");

    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})$");
    private static final Pattern SLASH_YMD = Pattern.compile("^(\\d{4})/(\\d{2})/(\\d{2})$");
    private static final Pattern SLASH_DMY = Pattern.compile("^(\\d{2})/(\\d{2})/(\\d{4})$");
    private static final Pattern DASH_DMY = Pattern.compile("^(\\d{2})-(\\d{2})-(\\d{4})$");

    // Advisory range for decimal values
    private final double decimalWarnMin;
    private final double decimalWarnMax;

    /**
     * Creates a cleaner with the default advisory decimal range {@code [0, 1000000]}.
     */
    public CellCleaner() {
        this(0, 1_000_000);
    }

    /**
     * Creates a cleaner with a custom advisory decimal range.
     *
     * @param decimalWarnMin lower bound; smaller values are logged
     * @param decimalWarnMax upper bound; larger values are logged
     */
    public CellCleaner(double decimalWarnMin, double decimalWarnMax) {
        this.decimalWarnMin = decimalWarnMin;
        this.decimalWarnMax = decimalWarnMax;
    }

    /**
     * Cleans a raw cell according to the declared column type.
     *
     * @param raw raw cell text; may be {@code null}
     * @param type declared type of the column
     * @return typed value ({@link String}, {@link Double} or {@link Long}), or {@code null}
     */
    public Object clean(String raw, ColumnType type) {
        switch (type) {
            case DECIMAL:
                return cleanDecimal(raw);
            case INTEGER:
                return cleanInteger(raw);
            case DATE:
                return cleanDate(raw);
            case TEXT:
            default:
                return cleanText(raw);
        }
    }

    /**
     * Normalizes free text.
     *
     * @param raw raw cell text
     * @return normalized text, or {@code null} if nothing remains
     */
    public String cleanText(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        // Whitespace controls (tab, newline) become spaces before the remaining controls go away.
        String text = StringUtils.normalizeSpace(raw);
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = StringUtils.normalizeSpace(text);
        return StringUtils.isEmpty(text) ? null : text;
    }

    /**
     * Parses a decimal written with either comma or dot separators.
     *
     * @param raw raw cell text (e.g. {@code "R$ 1.234,56"})
     * @return parsed value, or {@code null} if unparsable
     */
    public Double cleanDecimal(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        String text = NON_DECIMAL_CHARS.matcher(raw.trim()).replaceAll("").replace(',', '.');
        int lastDot = text.lastIndexOf('.');
        if (lastDot >= 0 && text.indexOf('.') != lastDot) {
            text = text.substring(0, lastDot).replace(".", "") + text.substring(lastDot);
        }
        if (text.isEmpty()) {
            return null;
        }
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            log.debug("Unparsable decimal '{}' (normalized '{}')", raw, text);
            return null;
        }
        if (!Double.isFinite(value)) {
            return null;
        }
        if (value < decimalWarnMin || value > decimalWarnMax) {
            log.warn("Decimal value out of expected range [{}, {}]: {}", decimalWarnMin,
                    decimalWarnMax, value);
        }
        return value;
    }

    /**
     * Parses a whole number, ignoring any character other than digits and minus.
     *
     * @param raw raw cell text
     * @return parsed value, or {@code null} if unparsable or empty
     */
    public Long cleanInteger(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        String text = NON_INTEGER_CHARS.matcher(raw.trim()).replaceAll("");
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            log.debug("Unparsable integer '{}' (normalized '{}')", raw, text);
            return null;
        }
    }

    /**
     * Normalizes a calendar date to {@code yyyy-MM-dd}.
     *
     * @param raw raw cell text
     * @return ISO date string, or {@code null} for unsupported formats and impossible dates
     */
    public String cleanDate(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        String text = raw.trim();
        Matcher m = ISO_DATE.matcher(text);
        if (m.matches()) {
            return toIsoDate(m.group(1), m.group(2), m.group(3));
        }
        m = SLASH_YMD.matcher(text);
        if (m.matches()) {
            return toIsoDate(m.group(1), m.group(2), m.group(3));
        }
        m = SLASH_DMY.matcher(text);
        if (m.matches()) {
            return toIsoDate(m.group(3), m.group(2), m.group(1));
        }
        m = DASH_DMY.matcher(text);
        if (m.matches()) {
            return toIsoDate(m.group(3), m.group(2), m.group(1));
        }
        return null;
    }

    /**
     * Renders a cleaned value in its canonical textual form, so that cleaning the result again
     * yields the same value.
     *
     * @param value cleaned value; may be {@code null}
     * @return canonical text, or {@code null}
     */
    public static String canonical(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double) {
            return BigDecimal.valueOf((Double) value).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    private static String toIsoDate(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month),
                    Integer.parseInt(day)).toString();
        } catch (DateTimeException e) {
            return null;
        }
    }
}
