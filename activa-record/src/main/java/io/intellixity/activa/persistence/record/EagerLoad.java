package io.intellixity.activa.persistence.record;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A relation path to load with the parent query, e.g. {@code "posts.comments"}.
 *
 * <p>The modifier and alias apply to the last segment only. Leading segments always resolve to the
 * plain relation of that name, so {@code "posts"} and {@code "posts.comments"} share one batch for
 * {@code posts}.</p>
 */
public record EagerLoad(String path, UnaryOperator<ActiveQuery> modifier, String alias) {
  public EagerLoad {
    Objects.requireNonNull(path, "path");
    for (String s : path.split("\\.", -1)) {
      if (s.isBlank()) throw new IllegalArgumentException("Invalid relation path: '" + path + "'");
    }
    alias = (alias == null || alias.isBlank()) ? leafOf(path) : alias;
  }

  public static EagerLoad of(String path) {
    return new EagerLoad(path, null, null);
  }

  public static EagerLoad of(String path, UnaryOperator<ActiveQuery> modifier) {
    return new EagerLoad(path, modifier, null);
  }

  /** Attaches the last segment under {@code alias} instead of the relation name. */
  public EagerLoad as(String alias) {
    return new EagerLoad(path, modifier, alias);
  }

  public List<String> segments() {
    return List.of(path.split("\\."));
  }

  public String leaf() {
    return leafOf(path);
  }

  /** True when the leaf cannot share a batch with the plain relation. */
  public boolean customized() {
    return modifier != null || !alias.equals(leaf());
  }

  private static String leafOf(String path) {
    int i = path.lastIndexOf('.');
    return i < 0 ? path : path.substring(i + 1);
  }
}
