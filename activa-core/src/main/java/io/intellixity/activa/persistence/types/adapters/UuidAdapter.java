package io.intellixity.activa.persistence.types.adapters;

import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapter;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.UUID;

/** UUID adapter: canonical text by default, native UUID where the driver supports it. */
public final class UuidAdapter implements TypeAdapter<UUID> {
  private final boolean nativeUuid;

  public UuidAdapter() {
    this(false);
  }

  public UuidAdapter(boolean nativeUuid) {
    this.nativeUuid = nativeUuid;
  }

  @Override public Class<UUID> javaType() { return UUID.class; }
  @Override public ColumnType columnType() { return nativeUuid ? ColumnType.UUID : ColumnType.TEXT; }

  @Override
  public Object toDatabase(UUID value, Map<String, Object> options) {
    if (value == null) return null;
    return nativeUuid ? value : value.toString();
  }

  @Override
  public UUID fromDatabase(Object raw, Class<? extends UUID> target, Map<String, Object> options) {
    if (raw == null) return null;
    if (raw instanceof UUID u) return u;
    if (raw instanceof byte[] b) {
      if (b.length != 16) throw new IllegalArgumentException("UUID bytes must be 16 long, got " + b.length);
      ByteBuffer bb = ByteBuffer.wrap(b);
      return new UUID(bb.getLong(), bb.getLong());
    }
    return UUID.fromString(String.valueOf(raw).trim());
  }
}
