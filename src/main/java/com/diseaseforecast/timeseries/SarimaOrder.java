package com.diseaseforecast.timeseries;

/**
 * SARIMA(p,0,0)(0,D,Q)s order.
 *
 * @param p          non-seasonal autoregressive order
 * @param seasonalD  seasonal differencing, 0 or 1
 * @param seasonalQ  seasonal moving-average order
 * @param period     season length in observations
 */
public record SarimaOrder(int p, int seasonalD, int seasonalQ, int period) {

    public SarimaOrder {
        if (p < 0 || seasonalQ < 0) {
            throw new IllegalArgumentException("orders must be >= 0");
        }
        if (seasonalD < 0 || seasonalD > 1) {
            throw new IllegalArgumentException("seasonal differencing must be 0 or 1");
        }
        if (period < 1) {
            throw new IllegalArgumentException("seasonal period must be >= 1");
        }
    }

    public int parameterCount() {
        return p + seasonalQ;
    }
}
