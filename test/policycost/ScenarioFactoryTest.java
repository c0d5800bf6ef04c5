package policycost;

import org.junit.jupiter.api.Test;
import policycost.config.CostCurveConfig;
import policycost.engine.PolicyCostCalculator;
import policycost.engine.PolicySummary;
import policycost.scenario.StylizedScenario;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioFactoryTest {

    private static final List<String> REGIONS = List.of("USA", "EUR", "CHN", "IND");

    @Test
    void policyRunProducesPositiveCosts() {
        StylizedScenario scenario = ScenarioFactory.defaultScenario("CO2");
        ScenarioFactory.applyBaselinePolicy(scenario, "CO2", REGIONS);
        assertTrue(scenario.run(true, ""));

        PolicyCostCalculator calc = new PolicyCostCalculator(scenario, CostCurveConfig.defaults());
        assertTrue(calc.calculateAbatementCostCurve());
        assertTrue(calc.hasRun());
        assertEquals(1 + 5, scenario.getRunCount());

        PolicySummary s = calc.getSummary();
        assertEquals(REGIONS.size(), s.getRegionalCosts().size());
        double sum = 0.0;
        for (String r : REGIONS) {
            assertTrue(s.getRegionalCost(r) > 0.0, r);
            assertTrue(s.getRegionalDiscountedCost(r) < s.getRegionalCost(r), r);
            sum += s.getRegionalCost(r);
        }
        assertEquals(sum, s.getGlobalCost(), 1e-6 * sum);
    }

    @Test
    void referenceRunIsSkipped() {
        StylizedScenario scenario = ScenarioFactory.defaultScenario("CO2");
        scenario.run(true, "");

        PolicyCostCalculator calc = new PolicyCostCalculator(scenario, CostCurveConfig.defaults());
        assertTrue(calc.calculateAbatementCostCurve());
        assertFalse(calc.hasRun());
        assertEquals(1, scenario.getRunCount());
    }
}
