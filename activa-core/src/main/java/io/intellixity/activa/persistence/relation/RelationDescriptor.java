package io.intellixity.activa.persistence.relation;

import java.time.Duration;
import java.util.Objects;

/**
 * Declared once per model at registration time and shared read-only by every instance.
 *
 * <p>Key semantics depend on the kind. For HAS_ONE, HAS_MANY and POLYMORPHIC the parent's
 * {@code localKey} is matched against the child's {@code foreignKey}. For BELONGS_TO the parent's
 * {@code foreignKey} is matched against the target's {@code localKey} (its owner key).</p>
 */
public record RelationDescriptor(
    String name,
    RelationKind kind,
    String targetModel,
    String localKey,
    String foreignKey,
    String inverseOf,
    String polymorphicTypeColumn,
    String polymorphicTypeValue,
    Duration cacheTtl
) {
  public static final String DEFAULT_KEY = "id";

  public RelationDescriptor {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(targetModel, "targetModel");
    Objects.requireNonNull(foreignKey, "foreignKey");
    localKey = (localKey == null || localKey.isBlank()) ? DEFAULT_KEY : localKey;
    if (kind == RelationKind.POLYMORPHIC && (polymorphicTypeColumn == null || polymorphicTypeValue == null)) {
      throw new IllegalArgumentException("Polymorphic relation '" + name + "' requires a type column and type value");
    }
    if (cacheTtl != null && cacheTtl.isNegative()) throw new IllegalArgumentException("cacheTtl must be >= 0");
  }

  public static RelationDescriptor hasMany(String name, String targetModel, String foreignKey) {
    return new RelationDescriptor(name, RelationKind.HAS_MANY, targetModel, null, foreignKey, null, null, null, null);
  }

  public static RelationDescriptor hasOne(String name, String targetModel, String foreignKey) {
    return new RelationDescriptor(name, RelationKind.HAS_ONE, targetModel, null, foreignKey, null, null, null, null);
  }

  public static RelationDescriptor belongsTo(String name, String targetModel, String foreignKey) {
    return new RelationDescriptor(name, RelationKind.BELONGS_TO, targetModel, null, foreignKey, null, null, null, null);
  }

  /** {@code owner hasMany targetModel} through {@code (typeColumn, foreignKey)} with {@code typeColumn = typeValue}. */
  public static RelationDescriptor polymorphic(String name, String targetModel, String foreignKey,
                                               String typeColumn, String typeValue) {
    return new RelationDescriptor(name, RelationKind.POLYMORPHIC, targetModel, null, foreignKey, null,
        typeColumn, typeValue, null);
  }

  public RelationDescriptor withLocalKey(String localKey) {
    return new RelationDescriptor(name, kind, targetModel, localKey, foreignKey, inverseOf,
        polymorphicTypeColumn, polymorphicTypeValue, cacheTtl);
  }

  public RelationDescriptor withInverseOf(String inverseOf) {
    return new RelationDescriptor(name, kind, targetModel, localKey, foreignKey, inverseOf,
        polymorphicTypeColumn, polymorphicTypeValue, cacheTtl);
  }

  public RelationDescriptor withCacheTtl(Duration cacheTtl) {
    return new RelationDescriptor(name, kind, targetModel, localKey, foreignKey, inverseOf,
        polymorphicTypeColumn, polymorphicTypeValue, cacheTtl);
  }

  /** Column read from each parent to build the batch key set. */
  public String parentKey() {
    return kind == RelationKind.BELONGS_TO ? foreignKey : localKey;
  }

  /** Column of the target filtered with {@code IN (keys)} and used to group children. */
  public String childKey() {
    return kind == RelationKind.BELONGS_TO ? localKey : foreignKey;
  }

  public boolean many() { return kind.many(); }
}
