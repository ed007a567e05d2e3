package com.diseaseforecast.timeseries;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Everything a fitted {@link SeasonalArimaModel} needs to forecast again without a re-fit.
 */
@Value
@Builder
@Jacksonized
public class SarimaState {
    int p;
    int seasonalD;
    int seasonalQ;
    int period;
    /** Seasonal differencing actually applied; 0 when the series was too short. */
    int appliedSeasonalD;
    double mean;
    double[] arCoefficients;
    double[] seasonalMaCoefficients;
    double sigma2;
    double[] observations;
    double[] transformed;
    double[] residuals;
}
