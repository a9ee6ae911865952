package org.maccas.io;

import org.maccas.catalog.Catalog;
import org.maccas.catalog.TargetCatalog;
import org.maccas.core.ConfirmedMatch;
import org.maccas.core.CrossMatchResult;
import org.maccas.outlier.RejectionReason;
import org.maccas.schema.ColumnTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.maccas.testutil.CatalogFixtureFactory.match;
import static org.maccas.testutil.CatalogFixtureFactory.source;

class OutputTablesTest {

    private static CrossMatchResult result() {
        Catalog leftover = Catalog.of(source("lost", 5.0, 5.0, 1.0));
        return CrossMatchResult.builder()
                .confirmedMatch(match("1", 10.0, 0.0, 0.01, 0.0))
                .confirmedMatch(match("2", 11.0, 0.0, 0.01, 0.0))
                .rejectedMatch(match("3", 12.0, 0.0, 0.0, 0.02).rejected(RejectionReason.MAGNITUDE_EXCEEDS))
                .leftoverTarget(TargetCatalog.unwarped(leftover).withAdjustedPositions(new double[]{5.1}, new double[]{5.0}))
                .leftoverReference(Catalog.empty())
                .targetSourceCount(4)
                .filteredReferenceCount(3)
                .build();
    }

    @Test
    @DisplayName("Every output table is rendered")
    void testAllTables() {
        Map<OutputTable, ColumnTable> tables = OutputTables.render(result());

        assertEquals(List.of(OutputTable.values()), List.copyOf(tables.keySet()));
        assertEquals(2, tables.get(OutputTable.CROSS_MATCHED).rowCount());
        assertEquals(1, tables.get(OutputTable.REJECTED_MATCHES).rowCount());
        assertEquals(0, tables.get(OutputTable.LEFTOVER_REFERENCE).rowCount());
        assertEquals("cross_matched_table", OutputTable.CROSS_MATCHED.baseName());
    }

    @Test
    @DisplayName("Match rows carry both sources and the match scores")
    void testMatchColumns() {
        ColumnTable matched = OutputTables.render(result()).get(OutputTable.CROSS_MATCHED);

        for (String column : List.of("tar_ra", "tar_dec", "tar_a", "tar_b", "tar_pa", "tar_flux",
                "ref_ra", "ref_dec", "ref_a", "ref_b", "ref_pa", "ref_flux", "tar_uuid", "ref_name",
                "position_prob", "flux_prob", "raw_prob", "norm_prob", "num_of_candidates", "round")) {
            assertTrue(matched.hasColumn(column), column);
        }
        assertFalse(matched.hasColumn("rejection_reason"));
        assertArrayEquals(new String[]{"t1", "t2"}, matched.text("tar_uuid"));
        assertEquals(10.0 - 0.01, matched.numeric("ref_ra")[0], 1e-12);
        assertTrue(Double.isNaN(matched.numeric("norm_prob")[0]));
    }

    @Test
    @DisplayName("Rejected rows name their rule")
    void testRejectedColumns() {
        ColumnTable rejected = OutputTables.render(result()).get(OutputTable.REJECTED_MATCHES);
        assertArrayEquals(new String[]{"MAGNITUDE_EXCEEDS"}, rejected.text("rejection_reason"));
    }

    @Test
    @DisplayName("Leftover targets come out at original and at corrected positions")
    void testLeftoverViews() {
        Map<OutputTable, ColumnTable> tables = OutputTables.render(result());

        assertEquals(5.0, tables.get(OutputTable.LEFTOVER_TARGET).numeric("ra")[0]);
        assertEquals(5.1, tables.get(OutputTable.LEFTOVER_UNWARPED_TARGET).numeric("ra")[0]);
        assertArrayEquals(new String[]{"lost"}, tables.get(OutputTable.LEFTOVER_TARGET).text("uuid"));
    }
}
