/**
 * Cell cleaning package.
 *
 * <p>
 * Pure conversions from raw spreadsheet text to typed values, and the header normalization used to
 * match source headers to schema columns.
 * </p>
 */
package io.github.yok.sheetsync.clean;
