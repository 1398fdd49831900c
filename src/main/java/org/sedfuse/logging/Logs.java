package org.sedfuse.logging;

/**
 * Logging hygiene helpers for catalog free text.
 *
 * <p>Catalog comment and reference fields can be long; DEBUG logs about rejected rows echo them through
 * {@link #truncate(String, int)} so one noisy row cannot flood the console.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to at most {@code maxChars} characters, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of characters to retain; must be positive
   * @return truncated string when the input exceeds {@code maxChars}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    return value.substring(0, maxChars) + "... (truncated, " + maxChars + " of " + value.length() + ")";
  }
}
