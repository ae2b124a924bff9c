package io.intellixity.mosaic.query;

import io.intellixity.mosaic.fs.RowCursor;
import io.intellixity.mosaic.path.FilePath;

/** Path-resolution context a plan reads its sources through. */
@FunctionalInterface
public interface SourceReader {
  RowCursor read(FilePath source);
}
