package policycost.engine;

import policycost.curve.RegionCurves;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Abatement cost curves (reduction to tax) by period and region.
 */
public final class PeriodCostCurves {

    private final int[] years;
    private final List<RegionCurves> byPeriod;

    PeriodCostCurves(int[] years, List<RegionCurves> byPeriod) {
        if (years.length != byPeriod.size()) {
            throw new IllegalArgumentException("years.length != periods");
        }
        this.years = years.clone();
        this.byPeriod = Collections.unmodifiableList(new ArrayList<>(byPeriod));
    }

    public int periodCount() {
        return byPeriod.size();
    }

    public int getYear(int period) {
        return years[period];
    }

    public RegionCurves get(int period) {
        return byPeriod.get(period);
    }
}
