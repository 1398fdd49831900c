/**
 * Catalog identifiers, queries, and the read-only tabular responses consumed by the normalizers.
 *
 * @since 0.1.0
 */
package org.sedfuse.application.catalog;
