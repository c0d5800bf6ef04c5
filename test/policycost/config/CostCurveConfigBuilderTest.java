package policycost.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CostCurveConfigBuilderTest {

    @Test
    void defaultsMatchDocumentedValues() {
        CostCurveConfig cfg = CostCurveConfig.defaults();
        assertEquals("CO2", cfg.getAbatedGas());
        assertEquals(5, cfg.getNumPoints());
        assertEquals(0.05, cfg.getDiscountRate(), 0.0);
        assertEquals(2005, cfg.getDiscountStartYear());
        assertEquals("USA", cfg.getReferenceRegion());
        assertNull(cfg.getOutputFileName());
    }

    @Test
    void fromCopiesAndOverrides() {
        CostCurveConfig base = new CostCurveConfigBuilder().setNumPoints(7).build();
        CostCurveConfig cfg = CostCurveConfigBuilder.from(base)
                .setDiscountRate(0.03)
                .setOutputFileName("out.xml")
                .build();
        assertEquals(7, cfg.getNumPoints());
        assertEquals(0.03, cfg.getDiscountRate(), 0.0);
        assertEquals("out.xml", cfg.outputFileNameFor("ignored"));
    }

    @Test
    void outputFileNameDerivedFromScenario() {
        assertEquals("cost_curves_ref.xml", CostCurveConfig.defaults().outputFileNameFor("ref"));
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CostCurveConfigBuilder().setNumPoints(0).build());
        assertThrows(IllegalArgumentException.class, () -> new CostCurveConfigBuilder().setAbatedGas(" ").build());
        assertThrows(IllegalArgumentException.class, () -> new CostCurveConfigBuilder().setReferenceRegion(null).build());
    }
}
