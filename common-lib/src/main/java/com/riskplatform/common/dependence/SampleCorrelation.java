package com.riskplatform.common.dependence;

import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.ReturnPanel;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

/**
 * Equal-weighted Pearson correlation of the full panel, the alternative to the EWMA
 * correlation for the GARCH-t aggregator.
 */
public final class SampleCorrelation {

    private SampleCorrelation() {}

    public static double[][] of(ReturnPanel panel) {
        if (panel.observationCount() < 2) {
            throw new InvalidInputException("SampleCorrelation", "need at least 2 observations for a correlation");
        }
        if (panel.assetCount() == 1) {
            return new double[][] {{1.0}};
        }
        double[][] corr = new PearsonsCorrelation(panel.rows()).getCorrelationMatrix().getData();
        for (int i = 0; i < corr.length; i++) {
            for (int j = 0; j < corr.length; j++) {
                if (Double.isNaN(corr[i][j])) corr[i][j] = i == j ? 1.0 : 0.0;
            }
        }
        return corr;
    }
}
