package org.maccas.schema;

import lombok.experimental.UtilityClass;
import org.maccas.catalog.Catalog;
import org.maccas.catalog.SourceRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link Catalog} from a raw {@link ColumnTable}.
 *
 * <p>Id, position and peak flux are required. Every other field is optional and reads as zero when
 * absent, which narrows the error budgets used for scoring.</p>
 */
@UtilityClass
public class CatalogAssembler {

    /**
     * @throws org.maccas.core.CrossMatchException when a required column is missing.
     */
    public static Catalog assemble(ColumnTable table, CatalogFormat format, ColumnResolver resolver) {
        String[] ids = resolver.resolveText(table, format.getId());
        double[] ra = required(table, resolver, format.getRa());
        double[] dec = required(table, resolver, format.getDec());
        double[] peakFlux = required(table, resolver, format.getPeakFlux());
        double[] errRa = optional(table, resolver, format.getErrRa(), true);
        double[] errDec = optional(table, resolver, format.getErrDec(), true);
        double[] a = optional(table, resolver, format.getA(), false);
        double[] b = optional(table, resolver, format.getB(), false);
        double[] pa = optional(table, resolver, format.getPa(), false);
        double[] localRms = optional(table, resolver, format.getLocalRms(), false);
        double[] errPeakFlux = optional(table, resolver, format.getErrPeakFlux(), true);
        double[] psfA = optional(table, resolver, format.getPsfA(), false);
        double[] psfB = optional(table, resolver, format.getPsfB(), false);

        List<SourceRecord> records = new ArrayList<>(table.rowCount());
        for (int row = 0; row < table.rowCount(); row++) {
            records.add(SourceRecord.builder()
                    .id(ids[row])
                    .ra(ra[row])
                    .dec(dec[row])
                    .errRa(errRa[row])
                    .errDec(errDec[row])
                    .a(a[row])
                    .b(b[row])
                    .pa(pa[row])
                    .localRms(localRms[row])
                    .peakFlux(peakFlux[row])
                    .errPeakFlux(errPeakFlux[row])
                    .psfA(psfA[row])
                    .psfB(psfB[row])
                    .build());
        }
        return Catalog.of(records);
    }

    private static double[] required(ColumnTable table, ColumnResolver resolver, String column) {
        return resolver.resolve(table, column, ColumnRequirement.REQUIRED, false).values();
    }

    private static double[] optional(ColumnTable table, ColumnResolver resolver, String column, boolean errorColumn) {
        return resolver.resolve(table, column, ColumnRequirement.OPTIONAL, errorColumn).values();
    }
}
