package org.maccas.model;

import org.maccas.catalog.Catalog;
import org.maccas.catalog.TargetCatalog;
import org.maccas.core.CrossMatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;
import static org.maccas.testutil.CatalogFixtureFactory.source;

class OffsetModelerTest {

    @Test
    @DisplayName("Offsets are image minus reference")
    void testOffsetSign() {
        OffsetSample sample = new OffsetSample(10.01, -5.0, 10.0, -4.98);
        assertEquals(0.01, sample.offset().dRa(), 1e-12);
        assertEquals(-0.02, sample.offset().dDec(), 1e-12);
    }

    @Test
    @DisplayName("Applying a field moves node targets onto their references")
    void testApplyRecoversReferences() {
        List<OffsetSample> samples = List.of(
                new OffsetSample(10.0, 0.0, 9.99, 0.005),
                new OffsetSample(11.0, 0.5, 10.99, 0.505),
                new OffsetSample(10.5, 1.0, 10.49, 1.005));
        OffsetField field = OffsetModeler.fit(samples, 0.0);
        TargetCatalog target = TargetCatalog.unwarped(Catalog.of(
                source("a", 10.0, 0.0, 1.0),
                source("b", 11.0, 0.5, 1.0),
                source("c", 10.5, 1.0, 1.0)));

        TargetCatalog adjusted = OffsetModeler.apply(field, target);

        assertEquals(3, field.sampleCount());
        assertEquals(9.99, adjusted.adjusted().byId("a").ra(), 1e-9);
        assertEquals(0.505, adjusted.adjusted().byId("b").dec(), 1e-9);
        assertEquals(10.0, adjusted.original().byId("a").ra());
    }

    @Test
    @DisplayName("Corrections always start from the original positions")
    void testApplyIsNotCumulative() {
        List<OffsetSample> samples = List.of(
                new OffsetSample(10.0, 0.0, 9.99, 0.0),
                new OffsetSample(12.0, 0.0, 11.99, 0.0));
        OffsetField field = OffsetModeler.fit(samples, 0.0);
        TargetCatalog target = TargetCatalog.unwarped(Catalog.of(source("a", 10.0, 0.0, 1.0)));

        TargetCatalog once = OffsetModeler.apply(field, target);
        TargetCatalog twice = OffsetModeler.apply(field, once);

        assertEquals(once.adjusted().get(0).ra(), twice.adjusted().get(0).ra());
    }

    @Test
    @DisplayName("Angles between offset directions are unsigned and wrap at 180")
    void testAngleBetween() {
        OffsetVector east = new OffsetVector(1.0, 0.0);
        assertEquals(90.0, east.angleBetweenDegrees(new OffsetVector(0.0, -1.0)), 1e-12);
        assertEquals(180.0, east.angleBetweenDegrees(new OffsetVector(-1.0, 0.0)), 1e-12);
        assertEquals(20.0, new OffsetVector(Math.cos(Math.toRadians(170)), Math.sin(Math.toRadians(170)))
                .angleBetweenDegrees(new OffsetVector(Math.cos(Math.toRadians(-170)), Math.sin(Math.toRadians(-170)))),
                1e-9);
        assertEquals(5.0, new OffsetVector(3.0, 4.0).magnitude(), 1e-15);
    }

    @Test
    @DisplayName("Exception Path: a single sample cannot define a field")
    void testTooFewSamples() {
        CrossMatchException ex = assertThrows(CrossMatchException.class,
                () -> OffsetModeler.fit(List.of(new OffsetSample(1.0, 1.0, 1.0, 1.0)), 0.0));
        assertEquals(CrossMatchException.REASON_INSUFFICIENT_MODEL_POINTS, ex.reasonCode());
    }

    // =====================================================================
    // RA WRAP
    // =====================================================================

    @Test
    @DisplayName("RA wrap: a pair straddling RA 0 has a small offset")
    void testOffsetAcrossRaZero() {
        assertEquals(0.002, new OffsetSample(0.001, -19.0, 359.999, -19.0).offset().dRa(), 1e-9);
        assertEquals(-0.002, new OffsetSample(359.999, -19.0, 0.001, -19.0).offset().dRa(), 1e-9);
    }

    @Test
    @DisplayName("RA wrap: adjusted positions are brought back into [0, 360)")
    void testApplyWrapsAdjustedRa() {
        List<OffsetSample> samples = List.of(
                new OffsetSample(0.001, 0.0, 359.999, 0.0),
                new OffsetSample(359.5, 0.0, 359.498, 0.0),
                new OffsetSample(0.25, 0.5, 0.248, 0.5));
        OffsetField field = OffsetModeler.fit(samples, 0.0);
        TargetCatalog target = TargetCatalog.unwarped(Catalog.of(
                source("a", 0.001, 0.0, 1.0),
                source("b", 359.5, 0.0, 1.0)));

        TargetCatalog adjusted = OffsetModeler.apply(field, target);

        assertEquals(359.999, adjusted.adjusted().byId("a").ra(), 1e-9);
        assertEquals(359.498, adjusted.adjusted().byId("b").ra(), 1e-9);
        assertEquals(0.001, adjusted.original().byId("a").ra());
    }

    // =====================================================================
    // LEAVE-ONE-OUT
    // =====================================================================

    @Test
    @DisplayName("Leave-one-out predictions equal a refit without each sample")
    void testLeaveOneOutMatchesRefit() {
        SplittableRandom random = new SplittableRandom(7L);
        List<OffsetSample> samples = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            double ra = 359.0 + 2.0 * random.nextDouble();
            double dec = -20.0 + random.nextDouble();
            double dRa = 0.002 + 0.001 * random.nextDouble();
            double dDec = -0.001 + 0.002 * random.nextDouble();
            samples.add(new OffsetSample(ra % 360.0, dec, (ra - dRa) % 360.0, dec - dDec));
        }
        double smoothing = 1.0e-4;

        List<OffsetVector> heldOut = OffsetModeler.leaveOneOut(samples, smoothing);

        assertEquals(samples.size(), heldOut.size());
        for (int i = 0; i < samples.size(); i++) {
            List<OffsetSample> others = new ArrayList<>(samples);
            OffsetSample left = others.remove(i);
            OffsetVector refit = OffsetModeler.fit(others, smoothing).predict(left.targetRa(), left.targetDec());
            assertEquals(refit.dRa(), heldOut.get(i).dRa(), 1e-10, "dRa at sample " + i);
            assertEquals(refit.dDec(), heldOut.get(i).dDec(), 1e-10, "dDec at sample " + i);
        }
    }

    @Test
    @DisplayName("Exception Path: leave-one-out needs two samples left after holding one out")
    void testLeaveOneOutTooFewSamples() {
        List<OffsetSample> samples = List.of(
                new OffsetSample(1.0, 1.0, 1.0, 1.0),
                new OffsetSample(2.0, 1.0, 2.0, 1.0));

        CrossMatchException ex = assertThrows(CrossMatchException.class,
                () -> OffsetModeler.leaveOneOut(samples, 0.0));
        assertEquals(CrossMatchException.REASON_INSUFFICIENT_MODEL_POINTS, ex.reasonCode());
    }
}
