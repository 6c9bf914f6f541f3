package io.intellixity.activa.persistence.plan;

/** LIMIT/OFFSET window. {@code limit} may be null (offset only). */
public record OffsetPage(long offset, Long limit) {
  public OffsetPage {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0");
  }

  public static OffsetPage limit(long limit) {
    return new OffsetPage(0, limit);
  }

  public OffsetPage withOffset(long offset) { return new OffsetPage(offset, limit); }
  public OffsetPage withLimit(Long limit) { return new OffsetPage(offset, limit); }

  public boolean hasLimit() { return limit != null; }
  public boolean hasOffset() { return offset > 0; }
}
