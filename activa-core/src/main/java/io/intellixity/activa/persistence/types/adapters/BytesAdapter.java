package io.intellixity.activa.persistence.types.adapters;

import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapter;

import java.sql.Blob;
import java.sql.SQLException;
import java.util.Map;

/** Binary columns. Arrays are copied both ways, so bound and hydrated values never alias caller arrays. */
public final class BytesAdapter implements TypeAdapter<byte[]> {
  @Override public Class<byte[]> javaType() { return byte[].class; }
  @Override public ColumnType columnType() { return ColumnType.BLOB; }

  @Override
  public Object toDatabase(byte[] value, Map<String, Object> options) {
    return value == null ? null : value.clone();
  }

  @Override
  public byte[] fromDatabase(Object raw, Class<? extends byte[]> target, Map<String, Object> options) {
    if (raw == null) return null;
    if (raw instanceof byte[] b) return b.clone();
    if (raw instanceof Blob blob) {
      try {
        return blob.getBytes(1, (int) blob.length());
      } catch (SQLException e) {
        throw new IllegalStateException("Failed to read BLOB column", e);
      }
    }
    throw new IllegalArgumentException("Not binary data: " + raw.getClass().getName());
  }
}
