package com.marketdw.etl.store;

import com.marketdw.etl.model.UnitRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlStatementTest {
    private static final String CORE = "SELECT * FROM ods_daily {filter} ORDER BY ts_code";

    @Test
    void singleUnitShouldUseEquality() {
        SqlStatement statement = SqlStatement.builder(CORE).whereUnits("trade_date", UnitRange.single(20240105)).build();

        assertEquals("SELECT * FROM ods_daily WHERE trade_date = ? ORDER BY ts_code", statement.sql());
        assertEquals(List.of(20240105), statement.params());
    }

    @Test
    void rangeShouldUseBetween() {
        SqlStatement statement = SqlStatement.builder(CORE).whereUnits("trade_date", UnitRange.of(20240101, 20240110)).build();

        assertEquals("SELECT * FROM ods_daily WHERE trade_date BETWEEN ? AND ? ORDER BY ts_code", statement.sql());
        assertEquals(List.of(20240101, 20240110), statement.params());
    }

    @Test
    void nullRangeShouldDropThePredicate() {
        SqlStatement statement = SqlStatement.builder(CORE).whereUnits("trade_date", null).build();

        assertEquals("SELECT * FROM ods_daily  ORDER BY ts_code", statement.sql());
        assertTrue(statement.params().isEmpty());
    }

    @Test
    void paramsBoundBeforePredicateShouldKeepOrder() {
        SqlStatement statement = SqlStatement.builder("SELECT LEAST(x, ?) FROM t {filter}")
                .bind(5)
                .whereUnits("d", UnitRange.of(1, 2))
                .build();

        assertEquals(List.of(5, 1, 2), statement.params());
    }

    @Test
    void unsafeIdentifiersShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> SqlStatement.builder(CORE).whereUnits("trade_date; DROP TABLE x", UnitRange.single(1)));
        assertThrows(IllegalArgumentException.class,
                () -> SqlStatement.upsertSql("t", List.of("a", "b c"), List.of("a")));
        assertEquals("marketdw.ods_daily", SqlStatement.requireIdentifier("marketdw.ods_daily"));
    }

    @Test
    void predicateShouldOnlyBeSetOnceAndNeedsMarker() {
        SqlStatement.Builder builder = SqlStatement.builder(CORE).whereUnits("trade_date", UnitRange.single(1));

        assertThrows(IllegalStateException.class, () -> builder.where("WHERE 1=1"));
        assertThrows(IllegalStateException.class,
                () -> SqlStatement.builder("SELECT 1").whereUnits("trade_date", UnitRange.single(1)));
    }

    @Test
    void upsertShouldUpdateNonKeyColumns() {
        String sql = SqlStatement.upsertSql("ods_adj_factor", List.of("trade_date", "ts_code", "adj_factor"),
                List.of("trade_date", "ts_code"));

        assertEquals("INSERT INTO ods_adj_factor (trade_date,ts_code,adj_factor) VALUES (?,?,?) "
                + "ON CONFLICT (trade_date,ts_code) DO UPDATE SET adj_factor=EXCLUDED.adj_factor", sql);
    }

    @Test
    void upsertOfKeyOnlyTableShouldDoNothingOnConflict() {
        String sql = SqlStatement.upsertSql("t", List.of("k"), List.of("k"));

        assertTrue(sql.endsWith("ON CONFLICT (k) DO NOTHING"));
        assertThrows(IllegalArgumentException.class, () -> SqlStatement.upsertSql("t", List.of("a"), List.of("b")));
    }
}
