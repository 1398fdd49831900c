/**
 * Catalog gateway adapters: JSON snapshot storage and request throttling.
 *
 * @since 0.1.0
 */
package org.sedfuse.infrastructure.catalog;
