package io.github.yok.sheetsync.source;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported spreadsheet source formats.
 *
 * <p>
 * Each format defines the file extensions recognized as belonging to it. For {@link #CSV} the
 * source path is a directory holding one export per sheet; for {@link #XLSX} it is the workbook
 * itself.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum SourceFormat {

    // Directory of Comma-Separated Values exports, one file per sheet.
    CSV("csv"),

    // Office Open XML workbook.
    XLSX("xlsx", "xlsm");

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    SourceFormat(String... exts) {
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
}
