package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.fs.Row;
import io.intellixity.mosaic.fs.RowCursor;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.query.*;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tiny query language for tests:
 * {@code select *|f1,f2 from src1[, src2] [where field op literal|:var]}.
 * Sources are concatenated in order; relative sources resolve against the base directory.
 */
final class SelectQueryCompiler implements QueryCompiler {
  private static final Pattern SELECT = Pattern.compile(
      "(?i)\\s*select\\s+(.+?)\\s+from\\s+(.+?)(?:\\s+where\\s+(\\w+)\\s*(>=|<=|!=|=|>|<)\\s*(\\S+))?\\s*");

  /** Number of compiles, to check that mounting a view validates its query. */
  final AtomicInteger compiles = new AtomicInteger();

  @Override
  public QueryPlan compile(String query, DirPath baseDir) {
    compiles.incrementAndGet();
    Matcher m = SELECT.matcher(query);
    if (!m.matches()) throw new QueryCompileException("cannot parse: " + query);

    List<String> fields = m.group(1).trim().equals("*") ? List.of() : split(m.group(1));
    List<FilePath> sources = new ArrayList<>();
    for (String s : split(m.group(2))) {
      try {
        sources.add(FilePath.parse(s.startsWith("/") ? s : baseDir + s));
      } catch (IllegalArgumentException e) {
        throw new QueryCompileException("bad source " + s, e);
      }
    }
    Where where = m.group(3) == null ? null : new Where(m.group(3), m.group(4), m.group(5));
    return new Plan(sources, fields, where);
  }

  private static List<String> split(String csv) {
    List<String> out = new ArrayList<>();
    for (String p : csv.split(",")) out.add(p.trim());
    return out;
  }

  record Where(String field, String op, String operand) {
    boolean test(Row r, Variables vars) {
      Object left = r.get(field);
      String raw = operand.startsWith(":")
          ? vars.get(operand.substring(1)).orElseThrow(() -> new QueryCompileException("unbound variable " + operand))
          : operand;
      if (left == null) return false;
      int cmp;
      if (left instanceof Number n) {
        cmp = Double.compare(n.doubleValue(), Double.parseDouble(raw));
      } else {
        cmp = left.toString().compareTo(raw.replace("'", ""));
      }
      switch (op) {
        case "=": return cmp == 0;
        case "!=": return cmp != 0;
        case ">": return cmp > 0;
        case "<": return cmp < 0;
        case ">=": return cmp >= 0;
        default: return cmp <= 0;
      }
    }
  }

  record Plan(List<FilePath> order, List<String> fields, Where where) implements QueryPlan {
    @Override
    public Set<FilePath> sources() {
      return new LinkedHashSet<>(order);
    }

    @Override
    public QueryPlan relocate(UnaryOperator<FilePath> f) {
      return new Plan(order.stream().map(f).toList(), fields, where);
    }

    @Override
    public RowCursor execute(Variables vars, SourceReader reader) {
      List<Row> out = new ArrayList<>();
      for (FilePath src : order) {
        for (Row r : reader.read(src).drain()) {
          if (where != null && !where.test(r, vars)) continue;
          out.add(project(r));
        }
      }
      return RowCursor.of(out);
    }

    private Row project(Row r) {
      if (fields.isEmpty()) return r;
      Map<String, Object> m = new LinkedHashMap<>();
      for (String f : fields) if (r.has(f)) m.put(f, r.get(f));
      return Row.of(m);
    }
  }
}
