/**
 * Clock adapters.
 *
 * @since 0.1.0
 */
package org.sedfuse.infrastructure.time;
