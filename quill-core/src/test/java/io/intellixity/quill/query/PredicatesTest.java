package io.intellixity.quill.query;

import io.intellixity.quill.errors.QueryConstructionException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static io.intellixity.quill.TestTables.PETS;
import static io.intellixity.quill.TestTables.USERS;
import static io.intellixity.quill.query.Predicates.*;
import static org.junit.jupiter.api.Assertions.*;

final class PredicatesTest {

  @Test
  void eqWithNullBecomesIsNull() {
    assertEquals(new NullCheck(USERS.col("age"), true), eq(USERS.col("age"), null));
    assertEquals(new NullCheck(USERS.col("age"), false), ne(USERS.col("age"), null));
  }

  @Test
  void orderingComparisonsRejectNull() {
    assertThrows(QueryConstructionException.class, () -> gt(USERS.col("age"), null));
    assertThrows(QueryConstructionException.class, () -> le(USERS.col("age"), null));
  }

  @Test
  void columnValuesStayColumnReferences() {
    Comparison c = (Comparison) eq(PETS.col("owner_id"), USERS.col("id").as("uid"));
    assertEquals(USERS.col("id"), c.right());
    assertEquals(ComparisonOperator.EQ, c.operator());
  }

  @Test
  void literalsAreClassifiedAtTheBoundary() {
    assertEquals(LiteralType.INTEGER, Literal.of(42L).type());
    assertEquals(LiteralType.FLOAT, Literal.of(new BigDecimal("1.5")).type());
    assertEquals(LiteralType.TEXT, Literal.of("x").type());
    assertEquals(LiteralType.BOOLEAN, Literal.of(true).type());
    assertEquals(LiteralType.STRUCTURED, Literal.of(Map.of("a", 1)).type());
    assertEquals(LiteralType.STRUCTURED, Literal.of(List.of(1, 2)).type());
    assertSame(Literal.NULL, Literal.of(null));
    assertThrows(QueryConstructionException.class, () -> Literal.of(new Object()));
  }

  @Test
  void membershipAllowsEmptyLists() {
    Membership m = in(USERS.col("status"), List.of());
    assertTrue(m.isEmpty());
    assertFalse(m.negated());
    assertTrue(notIn(USERS.col("status"), List.of("a")).negated());
  }

  @Test
  void betweenKeepsBoundsAsGiven() {
    Range r = between(USERS.col("age"), 30, 10);
    assertEquals(Literal.of(30), r.low());
    assertEquals(Literal.of(10), r.high());
    assertThrows(QueryConstructionException.class, () -> between(USERS.col("age"), null, 10));
  }

  @Test
  void groupsMustBeNonEmpty() {
    assertThrows(QueryConstructionException.class, () -> and());
    assertThrows(QueryConstructionException.class, () -> or());
    assertThrows(QueryConstructionException.class, () -> and(eq(USERS.col("id"), 1), null));

    LogicalGroup g = or(eq(USERS.col("id"), 1), isNull(USERS.col("age")));
    assertEquals(Clause.OR, g.clause());
    assertEquals(2, g.elements().size());
  }

  @Test
  void columnReferenceIdentityIgnoresQualification() {
    ColumnRef id = USERS.col("id");
    assertEquals(id, id.qualified());
    assertNotEquals(id, id.as("user_id"));
    assertEquals("user_id", alias(id, "user_id").alias());
    assertEquals(SortField.Direction.DESC, desc(id).direction());
    assertEquals(SortField.Direction.ASC, asc(id).direction());
  }
}
