package io.intellixity.mosaic.fs;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Outcome of a multi-record write or append.
 * <p>
 * Writes are not all-or-nothing: {@code written} records succeeded, and each failed record contributed one error.
 */
public record WriteResult(long written, List<FileSystemException> errors) {
  public WriteResult {
    if (written < 0) throw new IllegalArgumentException("written must be >= 0");
    errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
  }

  public static WriteResult ok(long written) {
    return new WriteResult(written, List.of());
  }

  public boolean isComplete() {
    return errors.isEmpty();
  }

  public WriteResult mapErrors(UnaryOperator<FileSystemException> f) {
    if (errors.isEmpty()) return this;
    return new WriteResult(written, errors.stream().map(f).toList());
  }
}
