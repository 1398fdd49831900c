package org.sedfuse.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String checks for settings, field names and file keys.
 *
 * <p>Object names from catalogs such as {@code [HB89] 0241+622} end up in snapshot and plot file names, so
 * {@link #toFileToken(String)} maps them to a safe token. Other helpers reject blank values and control characters
 * with an {@link IllegalArgumentException} naming the offending setting.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a field identifier such as an input grammar field or template placeholder.
   *
   * @param name logical parameter name included in exception messages
   * @param identifier candidate identifier; must be non-null
   * @return trimmed identifier matching {@code [A-Za-z][A-Za-z0-9_]*}
   * @throws IllegalArgumentException if the identifier is blank or contains unsupported characters
   */
  public static String requireIdentifier(String name, String identifier) {
    String sanitized = requireNonBlank(name, identifier);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must start with a letter and only contain letters, digits, or underscore (was '"
              + sanitized + "')"));
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value exceeds {@code maxLength} or contains
   *         non-printable ASCII characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Replaces characters that are unsafe in file names with underscores.
   *
   * @param value raw identity such as a catalog object name; must be non-null
   * @return file-name-safe token; never empty
   */
  public static String toFileToken(String value) {
    Objects.requireNonNull(value, "value");
    StringBuilder sb = new StringBuilder(Math.max(16, value.length()));
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.' || c == '+') {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    if (sb.length() == 0) {
      sb.append('x');
    }
    return sb.toString();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
