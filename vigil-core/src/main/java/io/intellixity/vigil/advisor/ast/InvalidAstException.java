package io.intellixity.vigil.advisor.ast;

/**
 * Raised when a rule AST does not have the shape the advisor expects.
 * <p>
 * Not retryable: the rule definition itself is wrong and publication must stop.
 */
public final class InvalidAstException extends RuntimeException {
  public InvalidAstException(String message) {
    super(message);
  }

  public InvalidAstException(String message, Throwable cause) {
    super(message, cause);
  }
}
