package io.intellixity.mosaic.query;

import io.intellixity.mosaic.fs.RowCursor;
import io.intellixity.mosaic.path.FilePath;

import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Executable plan produced by a {@link QueryCompiler}.
 * <p>
 * The core treats plans as opaque: it only inspects {@link #sources()} to decide where a plan runs, rewrites
 * source paths into a backend's namespace with {@link #relocate(UnaryOperator)}, and runs it.
 */
public interface QueryPlan {

  /** Absolute files this plan reads. */
  Set<FilePath> sources();

  /** Same plan with every source path mapped through {@code f}. */
  QueryPlan relocate(UnaryOperator<FilePath> f);

  /** Run the plan, reading every source through {@code reader}. Results may be produced lazily. */
  RowCursor execute(Variables vars, SourceReader reader);
}
