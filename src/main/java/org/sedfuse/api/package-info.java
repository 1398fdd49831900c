/**
 * Command-line entry points: the {@code sedfuse} dispatcher and its {@code fuse} and {@code template} commands.
 */
package org.sedfuse.api;
