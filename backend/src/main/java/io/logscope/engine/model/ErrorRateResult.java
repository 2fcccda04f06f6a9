package io.logscope.engine.model;

/**
 * Severity totals for a window. {@code rate} is (errors + fatals) / total, or 0 when empty.
 */
public record ErrorRateResult(long total, long errors, long warnings, long fatals, double rate) {

    public static ErrorRateResult of(long total, long errors, long warnings, long fatals) {
        double rate = total > 0 ? (double) (errors + fatals) / total : 0.0;
        return new ErrorRateResult(total, errors, warnings, fatals, rate);
    }
}
