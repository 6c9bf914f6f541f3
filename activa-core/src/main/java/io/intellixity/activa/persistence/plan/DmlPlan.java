package io.intellixity.activa.persistence.plan;

import java.util.List;

/** INSERT / UPDATE / DELETE plans. */
public interface DmlPlan {
  String table();

  /** Columns to return from the affected rows; empty for none. Gated by the RETURNING capability. */
  List<String> returning();
}
