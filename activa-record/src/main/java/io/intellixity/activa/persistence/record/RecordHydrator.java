package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.mapping.Row;
import io.intellixity.activa.persistence.relation.RelationCacheConfig;
import io.intellixity.activa.persistence.types.TypeAdapterRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rows to {@link ActiveRecord}s. Mapped columns are decoded through the backend's adapters
 * (field override first); other columns are kept raw under their label.
 */
final class RecordHydrator {
  private final ModelDescriptor model;
  private final TypeAdapterRegistry types;
  private final RelationCacheConfig cacheConfig;

  RecordHydrator(ModelDescriptor model, TypeAdapterRegistry types, RelationCacheConfig cacheConfig) {
    this.model = model;
    this.types = types;
    this.cacheConfig = cacheConfig;
  }

  ActiveRecord hydrate(Row row) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (String label : row.labels()) {
      Object raw = row.raw(label);
      Optional<FieldDef> field = model.fieldForColumn(label);
      if (field.isPresent()) {
        FieldDef f = field.get();
        values.put(f.name(), types.fromDatabase(raw, f.javaType(), f.adapter()));
      } else {
        values.put(label, raw);
      }
    }
    return new ActiveRecord(model, values, cacheConfig);
  }

  List<ActiveRecord> hydrateAll(List<Row> rows) {
    List<ActiveRecord> out = new ArrayList<>(rows.size());
    for (Row r : rows) out.add(hydrate(r));
    return out;
  }
}
