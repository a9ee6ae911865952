package org.maccas.schema;

import lombok.Builder;
import lombok.Value;

/**
 * Catalogue column names for each logical source field, before frequency tagging.
 */
@Value
@Builder
public class CatalogFormat {
    @Builder.Default
    String id = "uuid";
    @Builder.Default
    String ra = "ra";
    @Builder.Default
    String dec = "dec";
    @Builder.Default
    String errRa = "err_ra";
    @Builder.Default
    String errDec = "err_dec";
    @Builder.Default
    String a = "a";
    @Builder.Default
    String b = "b";
    @Builder.Default
    String pa = "pa";
    @Builder.Default
    String localRms = "local_rms";
    @Builder.Default
    String peakFlux = "peak_flux";
    @Builder.Default
    String errPeakFlux = "err_peak_flux";
    @Builder.Default
    String psfA = "psf_a";
    @Builder.Default
    String psfB = "psf_b";

    /**
     * Format with the default column names.
     */
    public static CatalogFormat defaults() {
        return CatalogFormat.builder().build();
    }
}
