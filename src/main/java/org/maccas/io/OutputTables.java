package org.maccas.io;

import lombok.experimental.UtilityClass;
import org.maccas.catalog.Catalog;
import org.maccas.catalog.SourceRecord;
import org.maccas.core.ConfirmedMatch;
import org.maccas.core.CrossMatchResult;
import org.maccas.schema.CatalogFormat;
import org.maccas.schema.ColumnTable;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link CrossMatchResult} as column tables.
 */
@UtilityClass
public class OutputTables {

    /**
     * All output tables, keyed in {@link OutputTable} order.
     */
    public static Map<OutputTable, ColumnTable> render(CrossMatchResult result) {
        Map<OutputTable, ColumnTable> tables = new EnumMap<>(OutputTable.class);
        tables.put(OutputTable.CROSS_MATCHED, matches(result.confirmedMatches(), false));
        tables.put(OutputTable.LEFTOVER_REFERENCE, catalog(result.leftoverReference()));
        tables.put(OutputTable.LEFTOVER_TARGET, catalog(result.leftoverTarget().original()));
        tables.put(OutputTable.LEFTOVER_UNWARPED_TARGET, catalog(result.leftoverTarget().adjusted()));
        tables.put(OutputTable.REJECTED_MATCHES, matches(result.rejectedMatches(), true));
        return tables;
    }

    /**
     * Match rows: target and reference shape and flux side by side with the match scores.
     */
    public static ColumnTable matches(List<ConfirmedMatch> matches, boolean withRejectionReason) {
        int n = matches.size();
        double[] tarRa = new double[n];
        double[] tarDec = new double[n];
        double[] tarA = new double[n];
        double[] tarB = new double[n];
        double[] tarPa = new double[n];
        double[] tarFlux = new double[n];
        double[] refRa = new double[n];
        double[] refDec = new double[n];
        double[] refA = new double[n];
        double[] refB = new double[n];
        double[] refPa = new double[n];
        double[] refFlux = new double[n];
        String[] tarUuid = new String[n];
        String[] refName = new String[n];
        double[] positionProb = new double[n];
        double[] fluxProb = new double[n];
        double[] rawProb = new double[n];
        double[] normProb = new double[n];
        double[] candidates = new double[n];
        double[] round = new double[n];
        String[] reason = new String[n];

        for (int i = 0; i < n; i++) {
            ConfirmedMatch match = matches.get(i);
            SourceRecord target = match.target();
            SourceRecord reference = match.reference();
            tarRa[i] = target.ra();
            tarDec[i] = target.dec();
            tarA[i] = target.a();
            tarB[i] = target.b();
            tarPa[i] = target.pa();
            tarFlux[i] = target.peakFlux();
            refRa[i] = reference.ra();
            refDec[i] = reference.dec();
            refA[i] = reference.a();
            refB[i] = reference.b();
            refPa[i] = reference.pa();
            refFlux[i] = reference.peakFlux();
            tarUuid[i] = target.id();
            refName[i] = reference.id();
            positionProb[i] = match.positionProbability();
            fluxProb[i] = match.fluxProbability();
            rawProb[i] = match.combinedProbability();
            normProb[i] = match.normalizedProbability();
            candidates[i] = match.candidateCount();
            round[i] = match.round();
            reason[i] = match.rejectionReason() == null ? "" : match.rejectionReason().name();
        }

        ColumnTable.Builder builder = ColumnTable.builder(n)
                .numeric("tar_ra", tarRa)
                .numeric("tar_dec", tarDec)
                .numeric("tar_a", tarA)
                .numeric("tar_b", tarB)
                .numeric("tar_pa", tarPa)
                .numeric("tar_flux", tarFlux)
                .numeric("ref_ra", refRa)
                .numeric("ref_dec", refDec)
                .numeric("ref_a", refA)
                .numeric("ref_b", refB)
                .numeric("ref_pa", refPa)
                .numeric("ref_flux", refFlux)
                .numeric("position_prob", positionProb)
                .numeric("flux_prob", fluxProb)
                .numeric("raw_prob", rawProb)
                .numeric("norm_prob", normProb)
                .numeric("num_of_candidates", candidates)
                .numeric("round", round)
                .text("tar_uuid", tarUuid)
                .text("ref_name", refName);
        if (withRejectionReason) {
            builder.text("rejection_reason", reason);
        }
        return builder.build();
    }

    /**
     * Catalogue rows under the default {@link CatalogFormat} column names.
     */
    public static ColumnTable catalog(Catalog catalog) {
        CatalogFormat format = CatalogFormat.defaults();
        int n = catalog.size();
        String[] ids = new String[n];
        double[][] columns = new double[12][n];
        for (int row = 0; row < n; row++) {
            SourceRecord source = catalog.get(row);
            ids[row] = source.id();
            columns[0][row] = source.ra();
            columns[1][row] = source.dec();
            columns[2][row] = source.errRa();
            columns[3][row] = source.errDec();
            columns[4][row] = source.a();
            columns[5][row] = source.b();
            columns[6][row] = source.pa();
            columns[7][row] = source.localRms();
            columns[8][row] = source.peakFlux();
            columns[9][row] = source.errPeakFlux();
            columns[10][row] = source.psfA();
            columns[11][row] = source.psfB();
        }
        return ColumnTable.builder(n)
                .numeric(format.getRa(), columns[0])
                .numeric(format.getDec(), columns[1])
                .numeric(format.getErrRa(), columns[2])
                .numeric(format.getErrDec(), columns[3])
                .numeric(format.getA(), columns[4])
                .numeric(format.getB(), columns[5])
                .numeric(format.getPa(), columns[6])
                .numeric(format.getLocalRms(), columns[7])
                .numeric(format.getPeakFlux(), columns[8])
                .numeric(format.getErrPeakFlux(), columns[9])
                .numeric(format.getPsfA(), columns[10])
                .numeric(format.getPsfB(), columns[11])
                .text(format.getId(), ids)
                .build();
    }
}
