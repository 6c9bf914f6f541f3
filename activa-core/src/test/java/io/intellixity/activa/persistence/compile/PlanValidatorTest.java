package io.intellixity.activa.persistence.compile;

import io.intellixity.activa.persistence.plan.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.activa.persistence.expr.Expressions.*;
import static io.intellixity.activa.persistence.expr.Functions.count;
import static org.junit.jupiter.api.Assertions.*;

final class PlanValidatorTest {
  @Test
  void havingRequiresGroupBy() {
    QueryPlan p = QueryPlan.from("orders").having(col("total").gt(10)).build();
    InvalidPlanException ex = assertThrows(InvalidPlanException.class, () -> PlanValidator.validate(p));
    assertTrue(ex.getMessage().contains("HAVING"));
  }

  @Test
  void crossJoinMustNotHaveCondition() {
    QueryPlan p = QueryPlan.from("a").join(JoinKind.CROSS, TableSource.of("b"), col("a", "id").eq(col("b", "id"))).build();
    assertThrows(InvalidPlanException.class, () -> PlanValidator.validate(p));
  }

  @Test
  void innerJoinRequiresCondition() {
    QueryPlan p = QueryPlan.from("a").join(JoinKind.INNER, TableSource.of("b"), null).build();
    assertThrows(InvalidPlanException.class, () -> PlanValidator.validate(p));
  }

  @Test
  void selfJoinRequiresDistinctAlias() {
    QueryPlan ambiguous = QueryPlan.from("users")
        .join(JoinKind.LEFT, TableSource.of("users"), col("users", "id").eq(col("users", "manager_id")))
        .build();
    assertThrows(InvalidPlanException.class, () -> PlanValidator.validate(ambiguous));

    QueryPlan aliased = QueryPlan.builder(TableSource.of("users").as("u"))
        .join(JoinKind.LEFT, TableSource.of("users").as("m"), col("m", "id").eq(col("u", "manager_id")))
        .build();
    assertDoesNotThrow(() -> PlanValidator.validate(aliased));
  }

  @Test
  void setOperationArityMustMatch() {
    QueryPlan two = QueryPlan.from("a").select(col("x"), col("y")).build();
    QueryPlan one = QueryPlan.from("b").select(col("x")).build();
    ArityMismatchException ex = assertThrows(ArityMismatchException.class,
        () -> PlanValidator.validate(SetOperation.of(SetOperator.UNION, false, two, one)));
    assertEquals(2, ex.leftArity());
    assertEquals(1, ex.rightArity());

    QueryPlan star = QueryPlan.from("b").build();
    assertDoesNotThrow(() -> PlanValidator.validate(SetOperation.of(SetOperator.UNION, false, two, star)));
  }

  @Test
  void setOperationOperandsCannotBePaged() {
    QueryPlan paged = QueryPlan.from("a").select(col("x")).limit(5).build();
    QueryPlan plain = QueryPlan.from("b").select(col("x")).build();
    assertThrows(InvalidPlanException.class,
        () -> PlanValidator.validate(SetOperation.of(SetOperator.EXCEPT, false, paged, plain)));
  }

  @Test
  void selfReferencingCteMustBeRecursiveUnion() {
    QueryPlan anchor = QueryPlan.from("nodes").select(col("id")).where(col("parent_id").isNull()).build();
    QueryPlan member = QueryPlan.builder(TableSource.of("nodes").as("n"))
        .select(col("n", "id"))
        .join(JoinKind.INNER, TableSource.of("tree").as("t"), col("n", "parent_id").eq(col("t", "id")))
        .build();
    SetOperation body = SetOperation.of(SetOperator.UNION, true, anchor, member);

    QueryPlan notRecursive = QueryPlan.from("tree").with(CommonTableExpression.of("tree", body)).build();
    assertThrows(InvalidPlanException.class, () -> PlanValidator.validate(notRecursive));

    QueryPlan intersect = QueryPlan.from("tree").recursive(true)
        .with(CommonTableExpression.of("tree", SetOperation.of(SetOperator.INTERSECT, false, anchor, member)))
        .build();
    assertThrows(InvalidPlanException.class, () -> PlanValidator.validate(intersect));

    QueryPlan ok = QueryPlan.from("tree").recursive(true).with(CommonTableExpression.of("tree", body)).build();
    assertDoesNotThrow(() -> PlanValidator.validate(ok));
  }

  @Test
  void duplicateCteNamesAreRejected() {
    QueryPlan inner = QueryPlan.from("a").build();
    QueryPlan p = QueryPlan.from("x")
        .with(CommonTableExpression.of("x", inner))
        .with(CommonTableExpression.of("X", inner))
        .build();
    assertThrows(InvalidPlanException.class, () -> PlanValidator.validate(p));
  }

  @Test
  void nestedSetOperationArityIsChecked() {
    QueryPlan two = QueryPlan.from("a").select(col("x"), col("y")).build();
    QueryPlan one = QueryPlan.from("b").select(col("x")).build();
    QueryPlan other = QueryPlan.from("c").select(col("x"), col("y")).build();

    SetOperation nested = SetOperation.of(SetOperator.INTERSECT, false,
        SetOperation.of(SetOperator.UNION, false, two, one), other);
    ArityMismatchException ex = assertThrows(ArityMismatchException.class, () -> PlanValidator.validate(nested));
    assertEquals(2, ex.leftArity());
    assertEquals(1, ex.rightArity());
  }

  @Test
  void operandsAreValidatedLikeTopLevelPlans() {
    QueryPlan two = QueryPlan.from("a").select(col("x")).build();
    QueryPlan havingOnly = QueryPlan.from("b").select(col("x")).having(count().gt(1)).build();
    QueryPlan joinWithoutOn = QueryPlan.from("b").select(col("x")).join(JoinKind.INNER, TableSource.of("z"), null).build();

    assertThrows(InvalidPlanException.class,
        () -> PlanValidator.validate(SetOperation.of(SetOperator.UNION, false, two, havingOnly)));
    assertThrows(InvalidPlanException.class,
        () -> PlanValidator.validate(SetOperation.of(SetOperator.UNION, false, two,
            SetOperation.of(SetOperator.EXCEPT, false, two, joinWithoutOn))));
  }

  @Test
  void nestedSetOperationsCannotBeOrdered() {
    QueryPlan b = QueryPlan.from("b").select(col("x")).build();
    SetOperation ordered = SetOperation.of(SetOperator.UNION, false, b, b).orderBy(List.of(col("x").asc()));
    SetOperation paged = SetOperation.of(SetOperator.UNION, false, b, b).page(OffsetPage.limit(5));

    assertThrows(InvalidPlanException.class,
        () -> PlanValidator.validate(SetOperation.of(SetOperator.UNION, false, ordered, b)));
    assertThrows(InvalidPlanException.class,
        () -> PlanValidator.validate(SetOperation.of(SetOperator.UNION, false, b, paged)));
    assertDoesNotThrow(() -> PlanValidator.validate(ordered));
  }

  @Test
  void cteBodiesAreValidated() {
    QueryPlan two = QueryPlan.from("a").select(col("x"), col("y")).build();
    QueryPlan one = QueryPlan.from("b").select(col("x")).build();

    QueryPlan arity = QueryPlan.from("cte")
        .with(CommonTableExpression.of("cte", SetOperation.of(SetOperator.UNION, false, two, one)))
        .build();
    assertThrows(ArityMismatchException.class, () -> PlanValidator.validate(arity));

    QueryPlan having = QueryPlan.from("cte")
        .with(CommonTableExpression.of("cte", QueryPlan.from("b").having(count().gt(1)).build()))
        .build();
    assertThrows(InvalidPlanException.class, () -> PlanValidator.validate(having));

    QueryPlan columns = QueryPlan.from("cte")
        .with(new CommonTableExpression("cte", List.of("a", "b", "c"), two, Materialization.DEFAULT))
        .build();
    assertThrows(InvalidPlanException.class, () -> PlanValidator.validate(columns));
  }

  @Test
  void derivedTablesAreValidated() {
    QueryPlan bad = QueryPlan.from("b").having(count().gt(1)).build();
    QueryPlan outer = QueryPlan.builder(new SubquerySource(bad, "d")).build();
    assertThrows(InvalidPlanException.class, () -> PlanValidator.validate(outer));
  }

  @Test
  void derivedTableRequiresAlias() {
    assertThrows(InvalidPlanException.class, () -> new SubquerySource(QueryPlan.from("a").build(), " "));
  }
}
