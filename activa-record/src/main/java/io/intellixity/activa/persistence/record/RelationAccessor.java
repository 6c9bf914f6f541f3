package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.relation.RelationDescriptor;
import io.intellixity.activa.persistence.relation.RelationKind;
import io.intellixity.activa.persistence.relation.RelationSlot;

import java.util.List;
import java.util.Objects;

import static io.intellixity.activa.persistence.expr.Expressions.col;

/** Lazy, per-record relation access on top of the eager loader. */
public final class RelationAccessor {
  private final ActivaContext ctx;

  RelationAccessor(ActivaContext ctx) {
    this.ctx = ctx;
  }

  /**
   * Cached value of {@code relation}, loading it with a single batch when the slot is NOT_LOADED
   * or expired.
   */
  public Object get(ActiveRecord record, String relation) {
    Objects.requireNonNull(record, "record");
    RelationSlot slot = record.relationCache().get(relation);
    if (slot.loaded()) return slot.value();
    ctx.eagerLoader().load(record.model(), List.of(record), List.of(EagerLoad.of(relation)));
    return record.relationCache().get(relation).value();
  }

  @SuppressWarnings("unchecked")
  public List<ActiveRecord> many(ActiveRecord record, String relation) {
    requireKind(record, relation, true);
    return (List<ActiveRecord>) get(record, relation);
  }

  public ActiveRecord one(ActiveRecord record, String relation) {
    requireKind(record, relation, false);
    return (ActiveRecord) get(record, relation);
  }

  /** Builder over the related model scoped to {@code record}; nothing is cached. */
  public ActiveQuery relationQuery(ActiveRecord record, String relation) {
    RelationDescriptor r = record.model().relation(relation);
    ModelDescriptor target = ctx.models().target(r);
    Object key = EagerLoader.keyValue(record, r.parentKey());
    ActiveQuery q = ctx.query(target).where(EagerLoader.columnOf(target, r.childKey()), key);
    if (r.kind() == RelationKind.POLYMORPHIC) {
      q = q.where(col(EagerLoader.columnOf(target, r.polymorphicTypeColumn())).eq(r.polymorphicTypeValue()));
    }
    return q;
  }

  private static void requireKind(ActiveRecord record, String relation, boolean many) {
    RelationDescriptor r = record.model().relation(relation);
    if (r.many() != many) {
      throw new IllegalArgumentException("Relation '" + relation + "' on " + record.model().name()
          + (many ? " is single-valued" : " is multi-valued"));
    }
  }
}
