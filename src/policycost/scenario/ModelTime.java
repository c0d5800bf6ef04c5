package policycost.scenario;

import java.util.Arrays;

/**
 * Period index to year mapping of a scenario.
 */
public final class ModelTime {

    private final int[] periodYears;
    private final int endYear;

    public ModelTime(int[] periodYears, int endYear) {
        if (periodYears == null || periodYears.length == 0) {
            throw new IllegalArgumentException("At least one period required");
        }
        for (int i = 1; i < periodYears.length; i++) {
            if (periodYears[i] <= periodYears[i - 1]) {
                throw new IllegalArgumentException("Period years must increase: " + Arrays.toString(periodYears));
            }
        }
        if (endYear < periodYears[periodYears.length - 1]) {
            throw new IllegalArgumentException("endYear " + endYear + " before last period year");
        }
        this.periodYears = periodYears.clone();
        this.endYear = endYear;
    }

    /**
     * Evenly spaced periods, end year is the last period year.
     */
    public static ModelTime evenlySpaced(int startYear, int step, int periods) {
        if (step <= 0 || periods <= 0) {
            throw new IllegalArgumentException("step and periods must be > 0");
        }
        int[] years = new int[periods];
        for (int p = 0; p < periods; p++) {
            years[p] = startYear + p * step;
        }
        return new ModelTime(years, years[periods - 1]);
    }

    public int getMaxPeriod() {
        return periodYears.length;
    }

    public int getPeriodToYear(int period) {
        if (period < 0 || period >= periodYears.length) {
            throw new IndexOutOfBoundsException("period " + period + " of " + periodYears.length);
        }
        return periodYears[period];
    }

    public int getStartYear() {
        return periodYears[0];
    }

    public int getEndYear() {
        return endYear;
    }

    @Override
    public String toString() {
        return "ModelTime" + Arrays.toString(periodYears) + " end=" + endYear;
    }
}
