/**
 * Table schema package.
 *
 * <p>
 * Holds the immutable table schemas (expected columns, required columns, column types, primary key
 * and foreign keys), the registry that validates them at start-up, and the resolver that orders
 * tables parent-first.
 * </p>
 */
package io.github.yok.sheetsync.schema;
