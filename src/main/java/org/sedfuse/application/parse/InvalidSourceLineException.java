package org.sedfuse.application.parse;

/**
 * Raised when a line matches the input grammar but its values cannot form a source.
 *
 * @since 0.1.0
 */
public class InvalidSourceLineException extends Exception {
  private static final long serialVersionUID = 1L;

  public InvalidSourceLineException(String message) {
    super(message);
  }
}
