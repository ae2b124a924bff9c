package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.fs.FileSystemException;
import io.intellixity.mosaic.path.FilePath;

import java.util.ArrayList;
import java.util.List;

/** Views currently being expanded on one read, outermost first. */
record ViewStack(List<FilePath> chain) {
  static final ViewStack EMPTY = new ViewStack(List.of());

  ViewStack {
    chain = List.copyOf(chain);
  }

  /** @throws FileSystemException {@code VIEW_CYCLE} if {@code view} is already being expanded */
  ViewStack enter(FilePath view) {
    List<FilePath> next = new ArrayList<>(chain);
    next.add(view);
    if (chain.contains(view)) throw FileSystemException.viewCycle(next);
    return new ViewStack(next);
  }
}
