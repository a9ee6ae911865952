package org.maccas.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.maccas.testutil.CatalogFixtureFactory.source;

class TargetCatalogTest {

    private static Catalog threeSources() {
        return Catalog.of(
                source("a", 10.0, -30.0, 1.0),
                source("b", 11.0, -30.0, 2.0),
                source("c", 12.0, -30.0, 3.0));
    }

    @Test
    @DisplayName("Adjusted positions never touch the original view")
    void testAdjustedPositions() {
        TargetCatalog target = TargetCatalog.unwarped(threeSources());

        TargetCatalog moved = target.withAdjustedPositions(
                new double[]{10.1, 11.1, 12.1},
                new double[]{-30.1, -30.1, -30.1});

        assertEquals(10.0, moved.original().get(0).ra());
        assertEquals(10.1, moved.adjusted().get(0).ra());
        assertEquals(-30.1, moved.adjusted().byId("c").dec());
        assertEquals(3.0, moved.adjusted().byId("c").peakFlux());
        assertEquals(10.0, target.adjusted().get(0).ra());
    }

    @Test
    @DisplayName("Row removal keeps both views aligned")
    void testWithoutKeepsAlignment() {
        TargetCatalog moved = TargetCatalog.unwarped(threeSources()).withAdjustedPositions(
                new double[]{1.0, 2.0, 3.0},
                new double[]{0.0, 0.0, 0.0});

        TargetCatalog reduced = moved.without(Set.of("a"));

        assertEquals(2, reduced.size());
        assertEquals("b", reduced.original().idAt(0));
        assertEquals("b", reduced.adjusted().idAt(0));
        assertEquals(2.0, reduced.adjusted().get(0).ra());
    }

    @Test
    @DisplayName("Filtering on original records applies to both views")
    void testFilterByOriginal() {
        TargetCatalog target = TargetCatalog.unwarped(threeSources());

        TargetCatalog bright = target.filterByOriginal(source -> source.peakFlux() >= 2.0);

        assertEquals(2, bright.size());
        assertFalse(bright.adjusted().contains("a"));
        assertSame(target, target.filterByOriginal(source -> true));
    }

    @Test
    @DisplayName("Exception Path: misaligned views")
    void testMisalignedViews() {
        Catalog original = threeSources();
        Catalog reordered = Catalog.of(original.get(1), original.get(0), original.get(2));

        assertThrows(IllegalArgumentException.class, () -> TargetCatalog.of(original, reordered));
        assertThrows(IllegalArgumentException.class,
                () -> TargetCatalog.of(original, original.without(Set.of("a"))));
        assertThrows(IllegalArgumentException.class,
                () -> TargetCatalog.unwarped(original).withAdjustedPositions(new double[2], new double[2]));
    }
}
