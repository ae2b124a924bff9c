package io.intellixity.mosaic.fs;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Pull-based, possibly lazy sequence of rows.
 * <p>
 * A cursor is owned by a single caller. {@link #next(int)} returns an empty chunk once the cursor is exhausted;
 * {@link #close()} releases backend-side resources and is idempotent.
 */
public interface RowCursor extends AutoCloseable {

  /** Up to {@code max} further rows; an empty list means the cursor is exhausted. */
  List<Row> next(int max);

  @Override
  void close();

  /** Read everything that is left and close the cursor. */
  default List<Row> drain() {
    List<Row> out = new ArrayList<>();
    try {
      while (true) {
        List<Row> chunk = next(256);
        if (chunk.isEmpty()) return out;
        out.addAll(chunk);
      }
    } finally {
      close();
    }
  }

  static RowCursor of(List<Row> rows) {
    return fromIterator(List.copyOf(rows).iterator(), () -> {});
  }

  static RowCursor empty() {
    return of(List.of());
  }

  /** Adapt an iterator; {@code onClose} runs once on the first {@link #close()}. */
  static RowCursor fromIterator(Iterator<Row> it, Runnable onClose) {
    Objects.requireNonNull(it, "it");
    Objects.requireNonNull(onClose, "onClose");
    return new RowCursor() {
      private boolean closed;

      @Override
      public List<Row> next(int max) {
        if (max <= 0) throw new IllegalArgumentException("max must be > 0");
        if (closed) return List.of();
        List<Row> out = new ArrayList<>(Math.min(max, 64));
        while (out.size() < max && it.hasNext()) out.add(it.next());
        return out;
      }

      @Override
      public void close() {
        if (closed) return;
        closed = true;
        onClose.run();
      }
    };
  }
}
