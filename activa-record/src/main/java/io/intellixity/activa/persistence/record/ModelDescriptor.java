package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.relation.RelationDescriptor;
import io.intellixity.activa.persistence.relation.UnknownRelationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Static description of a model: its table, primary key, fields and relations.
 *
 * <p>{@code backendId} null means the context's default backend.</p>
 */
public record ModelDescriptor(
    String name,
    String table,
    String primaryKey,
    List<FieldDef> fields,
    Map<String, RelationDescriptor> relations,
    String backendId
) {
  public ModelDescriptor {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(table, "table");
    primaryKey = (primaryKey == null || primaryKey.isBlank()) ? RelationDescriptor.DEFAULT_KEY : primaryKey;
    fields = fields == null ? List.of() : List.copyOf(fields);
    relations = relations == null ? Map.of() : Map.copyOf(relations);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public Optional<FieldDef> field(String name) {
    for (FieldDef f : fields) {
      if (f.name().equals(name)) return Optional.of(f);
    }
    return Optional.empty();
  }

  /** Field mapped to {@code column}, compared case-insensitively. */
  public Optional<FieldDef> fieldForColumn(String column) {
    if (column == null) return Optional.empty();
    for (FieldDef f : fields) {
      if (f.column().equalsIgnoreCase(column)) return Optional.of(f);
    }
    return Optional.empty();
  }

  public boolean hasRelation(String name) {
    return relations.containsKey(name);
  }

  public RelationDescriptor relation(String name) {
    RelationDescriptor r = relations.get(name);
    if (r == null) throw new UnknownRelationException(this.name, name);
    return r;
  }

  public static final class Builder {
    private final String name;
    private String table;
    private String primaryKey;
    private final List<FieldDef> fields = new ArrayList<>();
    private final Map<String, RelationDescriptor> relations = new LinkedHashMap<>();
    private String backendId;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder table(String table) { this.table = table; return this; }
    public Builder primaryKey(String primaryKey) { this.primaryKey = primaryKey; return this; }
    public Builder backend(String backendId) { this.backendId = backendId; return this; }
    public Builder field(FieldDef field) { fields.add(Objects.requireNonNull(field, "field")); return this; }
    public Builder field(String name, Class<?> javaType) { return field(FieldDef.of(name, javaType)); }

    public Builder relation(RelationDescriptor relation) {
      Objects.requireNonNull(relation, "relation");
      if (relations.putIfAbsent(relation.name(), relation) != null) {
        throw new IllegalArgumentException("Duplicate relation '" + relation.name() + "' on model '" + name + "'");
      }
      return this;
    }

    public ModelDescriptor build() {
      String t = (table == null || table.isBlank()) ? name.toLowerCase(Locale.ROOT) : table;
      for (FieldDef f : fields) {
        if (relations.containsKey(f.name())) {
          throw new IllegalArgumentException("Field '" + f.name() + "' clashes with a relation on model '" + name + "'");
        }
      }
      return new ModelDescriptor(name, t, primaryKey, fields, relations, backendId);
    }
  }
}
