package io.intellixity.mosaic.fs;

import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.Path;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Typed failure raised by the namespace and by backends.
 * <p>
 * Backends raise these with paths in their own root-anchored namespace; the core re-anchors them with
 * {@link #relocateUnder(DirPath)} before they reach a caller.
 */
public final class FileSystemException extends RuntimeException {
  private final FsError error;
  private final Path path;
  private final DirPath mount;

  public FileSystemException(FsError error, String message, Path path, DirPath mount, Throwable cause) {
    super(message, cause);
    this.error = Objects.requireNonNull(error, "error");
    this.path = path;
    this.mount = mount;
  }

  public FileSystemException(FsError error, String message, Path path) {
    this(error, message, path, null, null);
  }

  public FsError error() {
    return error;
  }

  /** Path the failure refers to, or null. */
  public Path path() {
    return path;
  }

  /** Mount that reported the failure, or null if the core raised it. */
  public DirPath mount() {
    return mount;
  }

  public boolean is(FsError e) {
    return error == e;
  }

  /** Same failure with its path re-anchored under {@code base} and tagged with {@code base} as the mount. */
  public FileSystemException relocateUnder(DirPath base) {
    Objects.requireNonNull(base, "base");
    Path p = (path == null) ? null : path.under(base);
    String msg = (path == null || getMessage() == null) ? getMessage() : reanchor(getMessage(), path, p);
    return new FileSystemException(error, msg, p, base, getCause());
  }

  /** Rewrites {@code from} to {@code to} where it stands as a whole word, so {@code /} leaves other paths alone. */
  private static String reanchor(String message, Path from, Path to) {
    Pattern word = Pattern.compile("(?<=^|\\s)" + Pattern.quote(from.toString()) + "(?=$|\\s|[:,;])");
    return word.matcher(message).replaceAll(Matcher.quoteReplacement(to.toString()));
  }

  public static FileSystemException pathNotFound(Path p) {
    return new FileSystemException(FsError.PATH_NOT_FOUND, "Path not found: " + p, p);
  }

  public static FileSystemException mountExists(Path p) {
    return new FileSystemException(FsError.MOUNT_EXISTS, "Mount already exists at " + p, p);
  }

  public static FileSystemException mountNotFound(Path p) {
    return new FileSystemException(FsError.MOUNT_NOT_FOUND, "No mount at " + p, p);
  }

  public static FileSystemException pathTypeMismatch(Path p, String expected) {
    return new FileSystemException(FsError.PATH_TYPE_MISMATCH, "Expected a " + expected + " path: " + p, p);
  }

  public static FileSystemException unknownBackendKind(String kind) {
    return new FileSystemException(FsError.UNKNOWN_BACKEND_KIND, "Unknown backend kind: " + kind, null);
  }

  public static FileSystemException backendConnect(String kind, Throwable cause) {
    String detail = (cause == null || cause.getMessage() == null) ? "" : ": " + cause.getMessage();
    return new FileSystemException(FsError.BACKEND_CONNECT_ERROR, "Failed to connect " + kind + " backend" + detail,
        null, null, cause);
  }

  public static FileSystemException readOnlyMount(Path p) {
    return new FileSystemException(FsError.READ_ONLY_MOUNT, "View is read-only: " + p, p);
  }

  public static FileSystemException crossMount(Path src, Path dst) {
    return new FileSystemException(FsError.CROSS_MOUNT_OPERATION,
        "Operation spans mounts: " + src + " -> " + dst, src);
  }

  public static FileSystemException viewCycle(List<? extends Path> chain) {
    String c = chain.stream().map(String::valueOf).collect(Collectors.joining(" -> "));
    return new FileSystemException(FsError.VIEW_CYCLE, "View cycle: " + c, chain.isEmpty() ? null : chain.get(0));
  }

  public static FileSystemException unknownHandle(long id) {
    return new FileSystemException(FsError.UNKNOWN_HANDLE, "Unknown result handle: " + id, null);
  }

  public static FileSystemException backendUnavailable(DirPath mount) {
    return new FileSystemException(FsError.BACKEND_UNAVAILABLE, "Backend at " + mount + " is no longer mounted",
        mount, mount, null);
  }

  public static FileSystemException queryError(Path p, Throwable cause) {
    return queryError(p, null, cause);
  }

  /** Query failure reported while the plan ran on the backend mounted at {@code mount}. */
  public static FileSystemException queryError(Path p, DirPath mount, Throwable cause) {
    return new FileSystemException(FsError.QUERY_ERROR, "Query error at " + p + ": " + cause.getMessage(),
        p, mount, cause);
  }

  public static FileSystemException backendError(DirPath mount, Throwable cause) {
    return new FileSystemException(FsError.BACKEND_ERROR,
        "Backend at " + mount + " failed: " + (cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage()),
        null, mount, cause);
  }
}
