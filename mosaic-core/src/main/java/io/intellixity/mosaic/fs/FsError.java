package io.intellixity.mosaic.fs;

/** Failure taxonomy of the mount and dispatch core. Every kind is recoverable. */
public enum FsError {
  /** No mount covers the resolved path, or the backend has nothing there. */
  PATH_NOT_FOUND,

  /** A mount already exists at exactly the requested path. */
  MOUNT_EXISTS,

  /** No mount exists at the requested path. */
  MOUNT_NOT_FOUND,

  /** Backends mount at directories and views at files. */
  PATH_TYPE_MISMATCH,

  /** No backend kind registered under the requested id. */
  UNKNOWN_BACKEND_KIND,

  /** The backend kind failed to open a connection. */
  BACKEND_CONNECT_ERROR,

  /** Mutating operation against a view. */
  READ_ONLY_MOUNT,

  /** The operation would have to span two distinct mounts. */
  CROSS_MOUNT_OPERATION,

  /** A view's query (transitively) reads itself. */
  VIEW_CYCLE,

  /** Operation against a result handle that is not open. */
  UNKNOWN_HANDLE,

  /** Backend invoked after its owning mount was removed. */
  BACKEND_UNAVAILABLE,

  /** A query failed to compile or is semantically invalid. */
  QUERY_ERROR,

  /** Backend-reported runtime error, tagged with the originating mount. */
  BACKEND_ERROR
}
