package com.di.pgproof.apply;

import com.di.pgproof.recommendation.Recommendation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RollbackDeriver Tests")
class RollbackDeriverTest {

    @Test
    @DisplayName("Should turn a concurrent index build into a concurrent drop")
    void testDerive_CreateIndex() {
        assertEquals(Optional.of("DROP INDEX CONCURRENTLY idx_foo;"),
                RollbackDeriver.deriveFrom("CREATE INDEX CONCURRENTLY idx_foo ON bar(baz)"));
        assertEquals(Optional.of("DROP INDEX CONCURRENTLY idx_foo;"),
                RollbackDeriver.deriveFrom("create index concurrently if not exists idx_foo on bar (baz)"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "SET work_mem = '64MB'|SET work_mem = '4MB';",
            "SET random_page_cost TO 1.1|SET random_page_cost = '4.0';",
            "set SHARED_BUFFERS = '1GB'|SET shared_buffers = '128MB';",
            "SET statement_timeout = '30s'|SET statement_timeout = DEFAULT;"
    })
    @DisplayName("Should reset SET parameters to stock values or DEFAULT")
    void testDerive_SetParameter(String sqlFix, String expected) {
        assertEquals(Optional.of(expected), RollbackDeriver.deriveFrom(sqlFix));
    }

    @Test
    @DisplayName("Should return empty for shapes it cannot undo")
    void testDerive_Unknown() {
        assertTrue(RollbackDeriver.deriveFrom("ALTER SYSTEM SET work_mem = '64MB'").isEmpty());
        assertTrue(RollbackDeriver.deriveFrom("DROP INDEX CONCURRENTLY idx_foo").isEmpty());
        assertTrue(RollbackDeriver.deriveFrom("  ").isEmpty());
        assertTrue(RollbackDeriver.deriveFrom(null).isEmpty());
    }

    @Test
    @DisplayName("A supplied rollback wins over derivation")
    void testDerive_SuppliedRollbackWins() {
        Recommendation rec = Recommendation.builder()
                .id("rec-1")
                .sqlFix("CREATE INDEX CONCURRENTLY idx_foo ON bar(baz)")
                .rollbackSql("  DROP INDEX CONCURRENTLY IF EXISTS idx_foo  ")
                .build();
        assertEquals(Optional.of("DROP INDEX CONCURRENTLY IF EXISTS idx_foo"), RollbackDeriver.derive(rec));

        Recommendation withoutRollback = rec.toBuilder().rollbackSql(" ").build();
        assertEquals(Optional.of("DROP INDEX CONCURRENTLY idx_foo;"), RollbackDeriver.derive(withoutRollback));
    }
}
