package io.intellixity.activa.persistence.mapping;

import io.intellixity.activa.persistence.types.TypeAdapterRegistry;

import java.util.*;

/**
 * One result row, detached from the driver: column labels in select order plus raw driver values.
 * Label lookup is exact first, then case-insensitive (Oracle reports unquoted labels upper-case).
 */
public final class Row {
  private final List<String> labels;
  private final Object[] values;
  private final Map<String, Integer> index;

  public Row(List<String> labels, List<Object> values) {
    if (labels.size() != values.size()) {
      throw new IllegalArgumentException("labels/values size mismatch: " + labels.size() + " vs " + values.size());
    }
    this.labels = List.copyOf(labels);
    this.values = values.toArray();
    Map<String, Integer> idx = new HashMap<>();
    for (int i = 0; i < this.labels.size(); i++) {
      idx.putIfAbsent(this.labels.get(i), i);
      idx.putIfAbsent(this.labels.get(i).toLowerCase(Locale.ROOT), i);
    }
    this.index = idx;
  }

  public static Row of(Map<String, ?> values) {
    return new Row(new ArrayList<>(values.keySet()), new ArrayList<>(values.values()));
  }

  public List<String> labels() { return labels; }
  public int size() { return values.length; }

  public boolean has(String label) {
    return indexOf(label) >= 0;
  }

  public Object raw(String label) {
    int i = indexOf(label);
    if (i < 0) throw new IllegalArgumentException("Unknown column label: " + label + " (have " + labels + ")");
    return values[i];
  }

  public Object raw(int position0Based) {
    return values[position0Based];
  }

  public boolean isNull(String label) {
    return raw(label) == null;
  }

  /** Converts the raw value through the registry's adapter for {@code type}. */
  public <T> T get(String label, Class<T> type, TypeAdapterRegistry types) {
    return types.fromDatabase(raw(label), type);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i < values.length; i++) out.put(labels.get(i), values[i]);
    return out;
  }

  private int indexOf(String label) {
    if (label == null) return -1;
    Integer i = index.get(label);
    if (i == null) i = index.get(label.toLowerCase(Locale.ROOT));
    return i == null ? -1 : i;
  }

  @Override
  public String toString() {
    return "Row" + toMap();
  }
}
