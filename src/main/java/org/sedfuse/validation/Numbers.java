package org.sedfuse.validation;

/**
 * Numeric checks for run settings (request delay, match tolerance) and lenient parsing of input-line numbers.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name setting name for the error message
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating-point value is finite and strictly positive.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value (e.g., a tolerance in arcseconds)
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite, zero, or negative
   */
  public static double requirePositiveFinite(String name, double value) {
    if (!Double.isFinite(value) || value <= 0) {
      throw new IllegalArgumentException(label(name) + " must be a positive finite number (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal string leniently, returning {@link Double#NaN} for blank or malformed input.
   *
   * @param raw candidate text; may be {@code null}
   * @return parsed value or NaN
   */
  public static double parseOrNaN(String raw) {
    if (raw == null) {
      return Double.NaN;
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      return Double.NaN;
    }
    try {
      return Double.parseDouble(trimmed);
    } catch (NumberFormatException ex) {
      return Double.NaN;
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
