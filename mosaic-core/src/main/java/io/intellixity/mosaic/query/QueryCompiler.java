package io.intellixity.mosaic.query;

import io.intellixity.mosaic.path.DirPath;

/**
 * Compiles query text into a {@link QueryPlan}. Implemented outside the core.
 * <p>
 * Relative source references in {@code query} resolve against {@code baseDir}.
 */
@FunctionalInterface
public interface QueryCompiler {

  /** @throws QueryCompileException if the text does not parse or is semantically invalid */
  QueryPlan compile(String query, DirPath baseDir);

  /** Compiler for deployments without query support: every compile fails. */
  static QueryCompiler unsupported() {
    return (query, baseDir) -> {
      throw new QueryCompileException("No query compiler configured");
    };
  }
}
