/**
 * Configuration loading and wiring: embedded defaults, YAML files, CLI merging, and the composition root.
 */
package org.sedfuse.config;
