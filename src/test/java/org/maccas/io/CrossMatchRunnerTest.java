package org.maccas.io;

import org.maccas.catalog.Catalog;
import org.maccas.core.CrossMatchException;
import org.maccas.core.CrossMatchResult;
import org.maccas.core.MatchingConfig;
import org.maccas.core.MatchingEngine;
import org.maccas.schema.ColumnTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.maccas.testutil.CatalogFixtureFactory.grid;
import static org.maccas.testutil.CatalogFixtureFactory.shifted;
import static org.maccas.testutil.CatalogFixtureFactory.table;

@DisplayName("Cross Match Runner Tests")
class CrossMatchRunnerTest {

    /**
     * Stages tables in memory and publishes them to {@code written} on commit.
     */
    private static class CollectingWriter implements CatalogTableWriter {
        final Map<OutputTable, ColumnTable> staged = new EnumMap<>(OutputTable.class);
        final Map<OutputTable, ColumnTable> written = new EnumMap<>(OutputTable.class);
        int rollbacks;

        @Override
        public void write(OutputTable table, ColumnTable contents) throws IOException {
            staged.put(table, contents);
        }

        @Override
        public void commit() {
            written.putAll(staged);
            staged.clear();
        }

        @Override
        public void rollback() {
            staged.clear();
            rollbacks++;
        }
    }

    private static MatchingEngine engine() {
        return MatchingEngine.builder().config(MatchingConfig.defaults()).build();
    }

    @Test
    @DisplayName("Successful run writes every table")
    void testWritesAllTables() {
        Catalog target = grid("t", 40.0, 10.0, 3, 0.5, 1.0);
        Catalog reference = shifted(target, "r", 0.0, 0.0);
        CollectingWriter writer = new CollectingWriter();
        CrossMatchRunner runner = CrossMatchRunner.builder().engine(engine()).writer(writer).build();

        CrossMatchResult result = runner.run(table(target), table(reference));

        assertEquals(9, result.matchedTargetCount());
        assertEquals(OutputTable.values().length, writer.written.size());
        assertEquals(9, writer.written.get(OutputTable.CROSS_MATCHED).rowCount());
        assertTrue(writer.staged.isEmpty());
        assertEquals(0, writer.rollbacks);
    }

    @Test
    @DisplayName("Fatal engine error: nothing is written")
    void testNothingWrittenOnFailure() {
        Catalog target = grid("t", 40.0, 10.0, 2, 0.5, 1.0);
        Catalog reference = shifted(target, "r", 30.0, 0.0);
        CollectingWriter writer = new CollectingWriter();
        CrossMatchRunner runner = CrossMatchRunner.builder().engine(engine()).writer(writer).build();

        CrossMatchException ex = assertThrows(CrossMatchException.class,
                () -> runner.run(table(target), table(reference)));

        assertEquals(CrossMatchException.REASON_INSUFFICIENT_INITIAL_MATCHES, ex.reasonCode());
        assertTrue(writer.written.isEmpty());
        assertTrue(writer.staged.isEmpty());
    }

    @Test
    @DisplayName("Exception Path: a failure on a later table rolls back the tables already written")
    void testLaterTableFailureRollsBack() {
        Catalog target = grid("t", 40.0, 10.0, 3, 0.5, 1.0);
        Catalog reference = shifted(target, "r", 0.0, 0.0);
        CollectingWriter writer = new CollectingWriter() {
            @Override
            public void write(OutputTable table, ColumnTable contents) throws IOException {
                if (table == OutputTable.LEFTOVER_TARGET) {
                    throw new IOException("disk full");
                }
                super.write(table, contents);
            }
        };
        CrossMatchRunner runner = CrossMatchRunner.builder().engine(engine()).writer(writer).build();

        CrossMatchException ex = assertThrows(CrossMatchException.class,
                () -> runner.run(table(target), table(reference)));

        assertEquals(CrossMatchException.REASON_TABLE_WRITE_FAILED, ex.reasonCode());
        assertTrue(ex.getMessage().contains(OutputTable.LEFTOVER_TARGET.baseName()));
        assertTrue(writer.written.isEmpty());
        assertTrue(writer.staged.isEmpty());
        assertEquals(1, writer.rollbacks);
    }

    @Test
    @DisplayName("Exception Path: a failed commit is rolled back, and a failed rollback is kept as suppressed")
    void testCommitFailure() {
        Catalog target = grid("t", 40.0, 10.0, 2, 0.5, 1.0);
        Catalog reference = shifted(target, "r", 0.0, 0.0);
        CatalogTableWriter writer = new CatalogTableWriter() {
            @Override
            public void write(OutputTable table, ColumnTable contents) {
            }

            @Override
            public void commit() throws IOException {
                throw new IOException("rename failed");
            }

            @Override
            public void rollback() throws IOException {
                throw new IOException("cleanup failed");
            }
        };
        CrossMatchRunner runner = CrossMatchRunner.builder().engine(engine()).writer(writer).build();

        CrossMatchException ex = assertThrows(CrossMatchException.class,
                () -> runner.run(table(target), table(reference)));

        assertEquals(CrossMatchException.REASON_TABLE_WRITE_FAILED, ex.reasonCode());
        assertEquals("rename failed", ex.getCause().getMessage());
        assertEquals(1, ex.getSuppressed().length);
        assertEquals("cleanup failed", ex.getSuppressed()[0].getMessage());
    }

    @Test
    @DisplayName("Exception Path: writer failure surfaces as a table write error")
    void testWriterFailure() {
        Catalog target = grid("t", 40.0, 10.0, 2, 0.5, 1.0);
        Catalog reference = shifted(target, "r", 0.0, 0.0);
        CrossMatchRunner runner = CrossMatchRunner.builder()
                .engine(engine())
                .writer((table, contents) -> {
                    throw new IOException("disk full");
                })
                .build();

        CrossMatchException ex = assertThrows(CrossMatchException.class,
                () -> runner.run(table(target), table(reference)));

        assertEquals(CrossMatchException.REASON_TABLE_WRITE_FAILED, ex.reasonCode());
        assertInstanceOf(IOException.class, ex.getCause());
    }
}
