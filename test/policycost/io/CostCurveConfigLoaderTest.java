package policycost.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import policycost.config.CostCurveConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CostCurveConfigLoaderTest {

    private final CostCurveConfigLoader loader = new CostCurveConfigLoader();

    @Test
    void loadsClasspathResource() throws IOException {
        CostCurveConfig cfg = loader.loadResource("costcurves-test.properties");
        assertEquals("CH4", cfg.getAbatedGas());
        assertEquals(8, cfg.getNumPoints());
        assertEquals(0.03, cfg.getDiscountRate(), 1e-12);
        assertEquals(2010, cfg.getDiscountStartYear());
        assertEquals("USA", cfg.getReferenceRegion());
    }

    @Test
    void missingKeysKeepDefaults() {
        CostCurveConfig cfg = loader.fromProperties(new Properties());
        assertEquals("CO2", cfg.getAbatedGas());
        assertEquals(5, cfg.getNumPoints());
        assertEquals(0.05, cfg.getDiscountRate(), 0.0);
        assertEquals(2005, cfg.getDiscountStartYear());
    }

    @Test
    void loadsFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("cc.properties");
        Files.writeString(file, "numPointsForCO2CostCurve = 3\npolicy-reference-region=EUR\n"
                + "costCurvesOutputFileName=mine.xml\n");
        CostCurveConfig cfg = loader.load(file);
        assertEquals(3, cfg.getNumPoints());
        assertEquals("EUR", cfg.getReferenceRegion());
        assertEquals("mine.xml", cfg.getOutputFileName());
    }

    @Test
    void resourceAndFileDecodeAlike(@TempDir Path dir) throws IOException {
        CostCurveConfig fromResource = loader.loadResource("costcurves-utf8.properties");
        assertEquals("Z\u00fcrich", fromResource.getReferenceRegion());
        assertEquals("co\u00fbts.xml", fromResource.getOutputFileName());

        Path file = dir.resolve("utf8.properties");
        Files.writeString(file, "policy-reference-region=Z\u00fcrich\ncostCurvesOutputFileName=co\u00fbts.xml\n");
        CostCurveConfig fromFile = loader.load(file);
        assertEquals(fromResource.getReferenceRegion(), fromFile.getReferenceRegion());
        assertEquals(fromResource.getOutputFileName(), fromFile.getOutputFileName());
    }

    @Test
    void malformedNumberNamesTheKey() {
        Properties p = new Properties();
        p.setProperty("discount-start-year", "soon");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> loader.fromProperties(p));
        assertTrue(e.getMessage().contains("discount-start-year"));
    }

    @Test
    void numPointsBelowOneRejected() {
        Properties p = new Properties();
        p.setProperty("numPointsForCO2CostCurve", "0");
        assertThrows(IllegalArgumentException.class, () -> loader.fromProperties(p));
    }

    @Test
    void missingResourceFails() {
        assertThrows(IOException.class, () -> loader.loadResource("nope.properties"));
    }
}
