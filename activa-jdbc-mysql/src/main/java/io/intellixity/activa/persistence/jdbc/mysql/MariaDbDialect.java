package io.intellixity.activa.persistence.jdbc.mysql;

import io.intellixity.activa.persistence.capability.*;

/** MariaDB: MySQL syntax with its own version table, including RETURNING on INSERT and DELETE. */
public final class MariaDbDialect extends MysqlDialect {
  public static final String ID = "mariadb";

  public MariaDbDialect(ServerVersion version) {
    super(ID, capabilitiesFor(version));
  }

  /**
   * CTEs 10.2.1 (recursive 10.2.2), window functions 10.2, JSON 10.2.3, INTERSECT/EXCEPT 10.3 (ALL
   * variants 10.5), DELETE RETURNING 10.0.5, INSERT RETURNING 10.5.
   */
  public static CapabilityDescriptor capabilitiesFor(ServerVersion v) {
    return CapabilityDescriptor.builder(ID, v)
        .add(SetOperationCapability.UNION, SetOperationCapability.UNION_ALL)
        .addIf(v.atLeast(10, 3), SetOperationCapability.INTERSECT, SetOperationCapability.EXCEPT)
        .addIf(v.atLeast(10, 5), SetOperationCapability.INTERSECT_ALL, SetOperationCapability.EXCEPT_ALL)
        .addIf(v.atLeast(10, 2, 1), CteCapability.BASIC_CTE)
        .addIf(v.atLeast(10, 2, 2), CteCapability.RECURSIVE_CTE)
        .addIf(v.atLeast(10, 2), WindowFunctionCapability.values())
        .add(JoinCapability.INNER_JOIN, JoinCapability.LEFT_JOIN, JoinCapability.RIGHT_JOIN, JoinCapability.CROSS_JOIN)
        .addIf(v.atLeast(10, 2, 3), JsonCapability.JSON_EXTRACT)
        .addIf(v.atLeast(10, 0, 5), ReturningCapability.RETURNING_DELETE)
        .addIf(v.atLeast(10, 5), ReturningCapability.RETURNING_INSERT)
        .add(PaginationCapability.LIMIT_OFFSET)
        .add(ExplainCapability.EXPLAIN)
        .build();
  }

  @Override public String productName() { return "MariaDB"; }
}
