package policycost.scenario;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One region of the stylized economy: an activity driver, an emissions
 * intensity and an exponential abatement response to the tax.
 */
public final class RegionEconomy {

    private final String name;
    private final EmissionsDriver driver;
    private final Map<String, double[]> inputs;
    private final double[] output;

    /** Emissions per unit of driver activity at zero tax. */
    private final double emissionsIntensity;

    /** Largest abatable share of emissions (0..1). */
    private final double abatementPotential;

    /** Tax at which 1 - 1/e of the potential is abated. */
    private final double abatementCostScale;

    public RegionEconomy(String name,
                         EmissionsDriver driver,
                         Map<String, double[]> inputs,
                         double[] output,
                         double emissionsIntensity,
                         double abatementPotential,
                         double abatementCostScale) {
        if (abatementPotential < 0.0 || abatementPotential > 1.0) {
            throw new IllegalArgumentException("abatementPotential must be in [0,1]: " + abatementPotential);
        }
        if (abatementCostScale <= 0.0) {
            throw new IllegalArgumentException("abatementCostScale must be > 0: " + abatementCostScale);
        }
        this.name = name;
        this.driver = driver;
        this.inputs = new LinkedHashMap<>(inputs);
        this.output = output.clone();
        this.emissionsIntensity = emissionsIntensity;
        this.abatementPotential = abatementPotential;
        this.abatementCostScale = abatementCostScale;
    }

    public double emissions(int period, double tax) {
        double activity = driver.calcEmissionsDriver(inputs, output, period);
        double abated = abatementPotential * (1.0 - Math.exp(-Math.max(tax, 0.0) / abatementCostScale));
        return activity * emissionsIntensity * (1.0 - abated);
    }

    public String getName() {
        return name;
    }

    public EmissionsDriver getDriver() {
        return driver;
    }

    public Map<String, double[]> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    public int periodCount() {
        return output.length;
    }

    public double getEmissionsIntensity() {
        return emissionsIntensity;
    }

    public double getAbatementPotential() {
        return abatementPotential;
    }

    public double getAbatementCostScale() {
        return abatementCostScale;
    }
}
