package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.config.ViewConfig;
import io.intellixity.mosaic.fs.FileSystemException;
import io.intellixity.mosaic.fs.Node;
import io.intellixity.mosaic.fs.RowCursor;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.query.QueryCompileException;
import io.intellixity.mosaic.query.QueryCompiler;
import io.intellixity.mosaic.query.QueryPlan;
import io.intellixity.mosaic.query.Variables;

import java.util.Objects;
import java.util.Set;

/**
 * Presents view mounts as read-only files whose contents are their saved query's results.
 */
final class ViewOverlay {
  private final QueryCompiler compiler;

  ViewOverlay(QueryCompiler compiler) {
    this.compiler = Objects.requireNonNull(compiler, "compiler");
  }

  /** Compile a view's query relative to the directory the view lives in. */
  QueryPlan compile(FilePath at, ViewConfig config) {
    try {
      QueryPlan plan = compiler.compile(config.query(), at.dir());
      if (plan == null) throw new IllegalStateException("QueryCompiler returned null plan for " + at);
      return plan;
    } catch (QueryCompileException e) {
      throw FileSystemException.queryError(at, e);
    }
  }

  /** Run the view at {@code view}; caller bindings win over the view's defaults. */
  RowCursor read(MountEntry view, Variables vars, ViewStack stack, Evaluator evaluator) {
    FilePath at = (FilePath) view.path();
    ViewStack inner = stack.enter(at);
    ViewConfig config = (ViewConfig) view.config();
    return evaluator.run(at, compile(at, config), vars.overlay(config.defaults()), inner);
  }

  Set<Node> list(MountEntry view) {
    return Set.of(Node.mount(view.path().name(), Node.Kind.FILE, view.config().typeName()));
  }
}
