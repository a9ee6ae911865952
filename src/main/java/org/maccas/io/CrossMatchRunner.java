package org.maccas.io;

import lombok.Builder;
import org.maccas.catalog.Catalog;
import org.maccas.core.CrossMatchException;
import org.maccas.core.CrossMatchResult;
import org.maccas.core.MatchingEngine;
import org.maccas.schema.CatalogAssembler;
import org.maccas.schema.CatalogFormat;
import org.maccas.schema.ColumnResolver;
import org.maccas.schema.ColumnTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * End-to-end pipeline: raw tables in, output tables out.
 *
 * <p>Tables are written only after the engine has converged, and all of them are committed together
 * or rolled back together, so a fatal error anywhere leaves nothing behind.</p>
 */
public final class CrossMatchRunner {
    private static final Logger logger = LoggerFactory.getLogger(CrossMatchRunner.class);

    private final MatchingEngine engine;
    private final CatalogTableWriter writer;
    private final CatalogFormat targetFormat;
    private final CatalogFormat referenceFormat;
    private final ColumnResolver targetResolver;
    private final ColumnResolver referenceResolver;

    @Builder
    public CrossMatchRunner(
            MatchingEngine engine,
            CatalogTableWriter writer,
            CatalogFormat targetFormat,
            CatalogFormat referenceFormat,
            ColumnResolver targetResolver,
            ColumnResolver referenceResolver
    ) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.targetFormat = targetFormat == null ? CatalogFormat.defaults() : targetFormat;
        this.referenceFormat = referenceFormat == null ? CatalogFormat.defaults() : referenceFormat;
        this.targetResolver = targetResolver == null ? ColumnResolver.plain() : targetResolver;
        this.referenceResolver = referenceResolver == null ? ColumnResolver.plain() : referenceResolver;
    }

    /**
     * Assembles both catalogues, runs the engine and writes every output table.
     *
     * @throws CrossMatchException on any fatal condition, including writer failures.
     */
    public CrossMatchResult run(ColumnTable targetTable, ColumnTable referenceTable) {
        Catalog target = CatalogAssembler.assemble(targetTable, targetFormat, targetResolver);
        Catalog reference = CatalogAssembler.assemble(referenceTable, referenceFormat, referenceResolver);
        logger.info("Loaded {} target and {} reference sources", target.size(), reference.size());

        CrossMatchResult result = engine.run(target, reference);

        writeAll(OutputTables.render(result));
        return result;
    }

    private void writeAll(Map<OutputTable, ColumnTable> tables) {
        OutputTable current = null;
        try {
            for (Map.Entry<OutputTable, ColumnTable> entry : tables.entrySet()) {
                current = entry.getKey();
                writer.write(current, entry.getValue());
            }
            current = null;
            writer.commit();
        } catch (IOException e) {
            String failed = current == null ? "Failed to commit output tables" : "Failed to write " + current.baseName();
            CrossMatchException error = new CrossMatchException(CrossMatchException.REASON_TABLE_WRITE_FAILED, failed, e);
            try {
                writer.rollback();
            } catch (IOException rollbackFailure) {
                error.addSuppressed(rollbackFailure);
            }
            logger.error("{}; staged output tables were rolled back", failed);
            throw error;
        }
        logger.info("Wrote {} output tables", tables.size());
    }
}
