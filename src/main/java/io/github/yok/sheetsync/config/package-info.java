/**
 * Configuration package for SheetSyncLink.
 *
 * <p>
 * Binds the {@code connection}, {@code source}, {@code sync} and {@code schemas} sections of
 * {@code application.yml} via Spring Boot configuration properties.
 * </p>
 */
package io.github.yok.sheetsync.config;
