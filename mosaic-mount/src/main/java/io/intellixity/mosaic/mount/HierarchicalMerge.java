package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.fs.Node;
import io.intellixity.mosaic.path.DirPath;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Folds mounts nested below a directory into that directory's listing.
 * <p>
 * A mount directly inside the directory shows as a mount-point node and hides a native entry of the same name.
 * A mount deeper down contributes its first path segment as a plain directory, unless something of that name is
 * already listed.
 */
final class HierarchicalMerge {
  private HierarchicalMerge() {}

  /** Synthetic nodes for the mounts below {@code dir}, keyed by name. */
  static Map<String, Node> mountNodes(MountTable table, DirPath dir) {
    Map<String, Node> out = new TreeMap<>();
    for (MountEntry e : table.childMounts(dir)) {
      String first = e.path().segments().get(dir.depth());
      if (e.path().depth() == dir.depth() + 1) {
        Node.Kind kind = e.path().isFile() ? Node.Kind.FILE : Node.Kind.DIRECTORY;
        out.put(first, Node.mount(first, kind, e.config().typeName()));
      } else {
        out.put(first, Node.dir(first));
      }
    }
    return out;
  }

  static Set<Node> merge(Set<Node> nativeNodes, Map<String, Node> mountNodes) {
    Map<String, Node> byName = new TreeMap<>();
    for (Node n : nativeNodes) byName.put(n.name(), n);
    for (Node m : mountNodes.values()) {
      if (m.isMount()) byName.put(m.name(), m);
      else byName.putIfAbsent(m.name(), m);
    }
    return Collections.unmodifiableSet(new LinkedHashSet<>(byName.values()));
  }
}
