/**
 * File-based result sink.
 *
 * @since 0.1.0
 */
package org.sedfuse.infrastructure.persistence;
