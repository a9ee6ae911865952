package org.maccas.io;

import org.maccas.schema.ColumnTable;

import java.io.IOException;

/**
 * Persistence seam for output tables. Format and location belong to the implementation.
 *
 * <p>One run writes every table, then calls {@link #commit()} once. If any write or the commit
 * fails, {@link #rollback()} is called instead and nothing from the run may remain visible.
 * Implementations that persist directly in {@link #write} must undo those writes in
 * {@link #rollback()}.</p>
 */
@FunctionalInterface
public interface CatalogTableWriter {

    /**
     * Stages one output table.
     *
     * @throws IOException when the table cannot be written.
     */
    void write(OutputTable table, ColumnTable contents) throws IOException;

    /**
     * Publishes every table staged since the run started.
     *
     * @throws IOException when the staged tables cannot be published.
     */
    default void commit() throws IOException {
    }

    /**
     * Discards every table staged since the run started.
     *
     * @throws IOException when staged output cannot be removed.
     */
    default void rollback() throws IOException {
    }
}
