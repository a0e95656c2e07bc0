/**
 * Relational store package.
 *
 * <p>
 * Defines the store boundary used by the pipeline and its JDBC implementation, which writes
 * through DBUnit {@code DELETE_ALL} and {@code INSERT}.
 * </p>
 */
package io.github.yok.sheetsync.store;
