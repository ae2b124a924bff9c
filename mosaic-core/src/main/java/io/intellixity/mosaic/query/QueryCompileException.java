package io.intellixity.mosaic.query;

/** Raised when query text fails to parse or is semantically invalid. */
public final class QueryCompileException extends RuntimeException {
  public QueryCompileException(String message) {
    super(message);
  }

  public QueryCompileException(String message, Throwable cause) {
    super(message, cause);
  }
}
