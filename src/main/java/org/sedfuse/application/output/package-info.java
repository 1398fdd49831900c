/**
 * Result line templates, plot tables and the UV power-law fit.
 *
 * @since 0.1.0
 */
package org.sedfuse.application.output;
