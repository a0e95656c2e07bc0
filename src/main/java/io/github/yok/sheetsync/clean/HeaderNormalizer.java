package io.github.yok.sheetsync.clean;

import java.util.Locale;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Normalizes column names so that header variations match schema columns exactly.
 *
 * <p>
 * The same function is applied once to schema column names and once to observed source headers;
 * matching is then a plain equality check. Case, underscores and whitespace are not significant,
 * so {@code "ID Cliente"}, {@code "id_cliente"} and {@code "IDCLIENTE"} are the same column.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class HeaderNormalizer {

    private static final Pattern IGNORED = Pattern.compile("[\\s_\\x00-\\x1F\\x7F-\\x9F\\uFEFF]+");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private HeaderNormalizer() {}

    /**
     * Returns the matching key of a column name.
     *
     * @param name header or column name; may be {@code null}
     * @return normalized key; empty string for {@code null}
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return IGNORED.matcher(name).replaceAll("").toLowerCase(Locale.ROOT);
    }
}
