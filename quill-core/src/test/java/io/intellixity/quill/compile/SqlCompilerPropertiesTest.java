package io.intellixity.quill.compile;

import io.intellixity.quill.dialect.Dialect;
import io.intellixity.quill.dialect.Dialects;
import io.intellixity.quill.Quill;
import io.intellixity.quill.query.*;
import io.intellixity.quill.stmt.SelectBuilder;
import io.intellixity.quill.stmt.StatementState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.intellixity.quill.TestTables.PETS;
import static io.intellixity.quill.TestTables.USERS;
import static io.intellixity.quill.query.Predicates.*;
import static org.junit.jupiter.api.Assertions.*;

final class SqlCompilerPropertiesTest {
  private static final Pattern NUMBERED = Pattern.compile("\\$(\\d+)");

  @Test
  void compilingTwiceIsByteIdentical() {
    Random rnd = new Random(7);
    for (Dialect d : Dialects.builtIns()) {
      for (int i = 0; i < 25; i++) {
        SelectBuilder q = Quill.builder().dialect(d).build().select("id", "name").from(USERS)
            .where(randomTree(rnd, 3)).orderBy(desc(USERS.col("id"))).limit(i);
        CompiledStatement first = q.compile();
        CompiledStatement second = q.compile();
        assertEquals(first.sql(), second.sql());
        assertEquals(first.params(), second.params());
        assertFalse(q.isExecuted());
      }
    }
  }

  @Test
  void compilationDoesNotTouchState() {
    SelectBuilder q = Quill.builder().dialect(Dialects.POSTGRES).build().select().from(USERS)
        .where(eq(USERS.col("id"), 1), isNull(USERS.col("age")));
    StatementState s = q.state();
    q.compile();
    assertEquals(2, s.where().size());
    assertTrue(s.projection().isEmpty());
    assertNull(s.returning());
  }

  @Test
  void placeholdersMatchParametersInTraversalOrder() {
    Random rnd = new Random(42);
    SqlCompiler compiler = new SqlCompiler();
    for (int i = 0; i < 200; i++) {
      Predicate join = and(eq(PETS.col("owner_id"), USERS.col("id")), randomTree(rnd, 2));
      Predicate where = randomTree(rnd, 4);
      SelectBuilder q = Quill.builder().dialect(Dialects.POSTGRES).build()
          .select().from(USERS).innerJoin(PETS, join).where(where);
      CompiledStatement c = compiler.compile(q.state(), Dialects.POSTGRES);

      List<Literal> expected = new ArrayList<>();
      collectLiterals(join, expected);
      collectLiterals(where, expected);
      assertEquals(expected, c.params());

      Matcher m = NUMBERED.matcher(c.sql());
      int n = 0;
      while (m.find()) assertEquals(++n, Integer.parseInt(m.group(1)), c.sql());
      assertEquals(c.params().size(), n);

      CompiledStatement sqlite = compiler.compile(q.state(), Dialects.SQLITE);
      assertEquals(c.params(), sqlite.params());
      assertEquals(n, sqlite.sql().chars().filter(ch -> ch == '?').count());
    }
  }

  private static Predicate randomTree(Random rnd, int depth) {
    int pick = depth <= 0 ? rnd.nextInt(6) : rnd.nextInt(8);
    return switch (pick) {
      case 0 -> eq(USERS.col("age"), rnd.nextInt(100));
      case 1 -> like(USERS.col("name"), "n" + rnd.nextInt(10) + "%");
      case 2 -> isNotNull(USERS.col("status"));
      case 3 -> in(USERS.col("id"), rnd.nextBoolean() ? List.of() : List.of(rnd.nextInt(9), rnd.nextInt(9)));
      case 4 -> between(USERS.col("score"), rnd.nextDouble(), rnd.nextDouble());
      case 5 -> notIn(USERS.col("status"), List.of("s" + rnd.nextInt(3)));
      case 6 -> and(randomTree(rnd, depth - 1), randomTree(rnd, depth - 1));
      default -> or(randomTree(rnd, depth - 1), randomTree(rnd, depth - 1), randomTree(rnd, depth - 1));
    };
  }

  private static void collectLiterals(Predicate p, List<Literal> out) {
    p.accept(new PredicateVisitor<Void>() {
      @Override
      public Void visit(Comparison c) {
        if (c.left() instanceof Literal l) out.add(l);
        if (c.right() instanceof Literal l) out.add(l);
        return null;
      }

      @Override
      public Void visit(PatternMatch pm) {
        out.add(pm.pattern());
        return null;
      }

      @Override public Void visit(NullCheck nc) { return null; }

      @Override
      public Void visit(Membership m) {
        out.addAll(m.values());
        return null;
      }

      @Override
      public Void visit(Range r) {
        out.add(r.low());
        out.add(r.high());
        return null;
      }

      @Override
      public Void visit(LogicalGroup g) {
        for (Predicate child : g.elements()) child.accept(this);
        return null;
      }
    });
  }
}
