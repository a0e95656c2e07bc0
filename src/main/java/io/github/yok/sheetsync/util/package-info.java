/**
 * Utility package.
 */
package io.github.yok.sheetsync.util;
