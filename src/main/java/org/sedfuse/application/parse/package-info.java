/**
 * Input line grammar, parser, and source construction.
 *
 * @since 0.1.0
 */
package org.sedfuse.application.parse;
