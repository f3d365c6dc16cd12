package io.github.suppierk.test;

import io.github.suppierk.allocation.jooq.DriverManagerConnectionProvider;
import io.github.suppierk.allocation.jooq.Schema;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;

/** In-memory H2 database emulating PostgreSQL, shared by every test of the JVM. */
public final class TestDatabase {
  public static final String URL =
      "jdbc:h2:mem:allocation;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;"
          + "DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1";

  private static final DSLContext DSL_CONTEXT =
      DSL.using(new DriverManagerConnectionProvider(URL, "sa", ""), SQLDialect.POSTGRES);

  static {
    Schema.install(DSL_CONTEXT);
  }

  private TestDatabase() {
    // No instance
  }

  public static DSLContext dsl() {
    return DSL_CONTEXT;
  }

  /** Empties every table. */
  public static void reset() {
    Schema.tables().forEach(table -> DSL_CONTEXT.truncate(table).execute());
  }
}
