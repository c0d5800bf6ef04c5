package policycost.engine;

import org.junit.jupiter.api.Test;
import policycost.scenario.GhgPolicy;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrialRunnerTest {

    private static final int[] YEARS = {2020, 2025, 2030};

    private static ScriptedScenario taxedScenario() {
        ScriptedScenario s = new ScriptedScenario(YEARS, List.of("R1", "R2"), 1000.0, 2.0, false)
                .withBaselineTax("R1", 50, 100, 150)
                .withBaselineTax("R2", 10, 20, 30);
        s.run(true, "base");
        return s;
    }

    @Test
    void policyProbeUsesReferenceRegion() {
        ScriptedScenario s = taxedScenario();
        TrialRunner runner = new TrialRunner(s, "CO2", 4);
        assertTrue(runner.isPolicyActive("R1"));
        assertFalse(runner.isPolicyActive("R9"));
        assertFalse(new TrialRunner(s, "SF6", 4).isPolicyActive("R1"));
    }

    @Test
    void baselineFillsLastSlotWithoutRunning() {
        ScriptedScenario s = taxedScenario();
        TrialSet trials = new TrialRunner(s, "CO2", 4).fromBaseline();

        assertEquals(List.of("base"), s.getRunTags());
        assertTrue(trials.isRecorded(4));
        assertFalse(trials.isRecorded(0));
        assertEquals(100.0, trials.getBaselinePriceCurves().require("R1").getY(2025), 0.0);
        assertEquals(1000.0 - 2.0 * 100.0, trials.getBaselineQuantityCurves().require("R1").getY(2025), 1e-12);
    }

    @Test
    void trialsRunInOrderWithScaledTaxes() {
        ScriptedScenario s = taxedScenario();
        TrialRunner runner = new TrialRunner(s, "CO2", 4);
        TrialSet trials = runner.fromBaseline();

        assertTrue(runner.runTrials(trials));
        assertEquals(List.of("base", "0", "1", "2", "3"), s.getRunTags());

        for (int k = 0; k < 4; k++) {
            double fraction = k / 4.0;
            assertEquals(150.0 * fraction, trials.getPriceCurves(k).require("R1").getY(2030), 1e-12);
            assertEquals(20.0 * fraction, trials.getPriceCurves(k).require("R2").getY(2025), 1e-12);
        }
        // one policy per region per trial
        assertEquals(8, s.getInstalled().size());
        GhgPolicy last = s.getInstalled().get(s.getInstalled().size() - 1);
        assertEquals("CO2", last.getGasName());
        assertEquals(3, last.periodCount());
    }

    @Test
    void failedTrialDoesNotStopTheSweep() {
        ScriptedScenario s = taxedScenario().failOn("1");
        TrialRunner runner = new TrialRunner(s, "CO2", 3);
        TrialSet trials = runner.fromBaseline();

        assertFalse(runner.runTrials(trials));
        assertEquals(List.of("base", "0", "1", "2"), s.getRunTags());
        for (int k = 0; k <= 3; k++) {
            assertTrue(trials.isRecorded(k));
        }
        assertFalse(trials.isConverged(1));
        assertTrue(trials.isConverged(2));
        assertEquals(List.of(1), trials.failedTrials());
    }

    @Test
    void zeroPointsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TrialRunner(taxedScenario(), "CO2", 0));
    }
}
