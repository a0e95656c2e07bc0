/**
 * Spreadsheet source package.
 *
 * <p>
 * Reads raw sheets (header plus rows, blank rows included) from a directory of CSV exports or an
 * Excel workbook. No cleaning happens here.
 * </p>
 */
package io.github.yok.sheetsync.source;
