package io.intellixity.mosaic.spi;

/** Raised by {@link BackendKind#open(java.util.Map)} when a connection cannot be established. */
public final class BackendConnectException extends RuntimeException {
  public BackendConnectException(String message) {
    super(message);
  }

  public BackendConnectException(String message, Throwable cause) {
    super(message, cause);
  }
}
