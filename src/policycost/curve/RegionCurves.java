package policycost.curve;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Region name to curve mapping. Iteration is in region-name order.
 */
public final class RegionCurves {

    private final TreeMap<String, Curve> curves = new TreeMap<>();

    public RegionCurves() {
    }

    public RegionCurves(Map<String, Curve> source) {
        curves.putAll(source);
    }

    public void put(String region, Curve curve) {
        if (region == null || curve == null) {
            throw new IllegalArgumentException("region and curve must be non-null");
        }
        curves.put(region, curve);
    }

    /**
     * @throws IllegalStateException if the region has no curve
     */
    public Curve require(String region) {
        Curve c = curves.get(region);
        if (c == null) {
            throw new IllegalStateException("No curve for region '" + region + "', known: " + curves.keySet());
        }
        return c;
    }

    public boolean contains(String region) {
        return curves.containsKey(region);
    }

    public Set<String> regions() {
        return Collections.unmodifiableSet(curves.keySet());
    }

    public Map<String, Curve> asMap() {
        return Collections.unmodifiableMap(curves);
    }

    public int size() {
        return curves.size();
    }

    public boolean isEmpty() {
        return curves.isEmpty();
    }

    @Override
    public String toString() {
        return "RegionCurves" + curves.keySet();
    }
}
