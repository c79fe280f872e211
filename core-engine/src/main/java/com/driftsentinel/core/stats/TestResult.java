package com.driftsentinel.core.stats;

/**
 * Statistic and p-value of a two-sample test.
 *
 * @since 1.0.0
 */
public final class TestResult {

    private final double statistic;
    private final double pValue;

    public TestResult(double statistic, double pValue) {
        this.statistic = statistic;
        this.pValue = pValue;
    }

    /**
     * @return distance between the two samples, in [0, 1]
     */
    public double getStatistic() {
        return statistic;
    }

    /**
     * @return probability of a distance at least this large if both samples
     *         came from the same distribution
     */
    public double getPValue() {
        return pValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TestResult that))
            return false;
        return Double.compare(statistic, that.statistic) == 0
                && Double.compare(pValue, that.pValue) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(statistic) + Double.hashCode(pValue);
    }

    @Override
    public String toString() {
        return "TestResult{statistic=" + statistic + ", pValue=" + pValue + '}';
    }
}
