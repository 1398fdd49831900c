/**
 * Infrastructure adapters implementing the application ports.
 *
 * @since 0.1.0
 */
package org.sedfuse.infrastructure;
