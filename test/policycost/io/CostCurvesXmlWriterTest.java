package policycost.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import policycost.engine.PolicyCostResults;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CostCurvesXmlWriterTest {

    @Test
    void documentHasAllSections() {
        String xml = CostCurvesXmlWriter.toXmlString(WriterFixtures.results());

        assertTrue(xml.startsWith("<?xml"));
        assertTrue(xml.contains("<CostCurvesInfo scenario=\"scripted\">"));
        assertTrue(xml.contains("<CostCurves year=\"2005\">"));
        assertTrue(xml.contains("<CostCurves year=\"2015\">"));
        assertTrue(xml.contains("<Curve name=\"R1 period cost curve\" label=\"0\">"));
        assertTrue(xml.contains("<RegionalCostCurvesByPeriod>"));
        assertTrue(xml.contains("<Curve name=\"R2\">"));
        assertTrue(xml.contains("<UndiscountedCost name=\"R1\">"));
        assertTrue(xml.contains("<DiscountedCost name=\"R2\">"));
        assertTrue(xml.contains("<GlobalUndiscountedTotalCost>"));
        assertTrue(xml.contains("<GlobalDiscountedCost>"));
        assertTrue(xml.trim().endsWith("</CostCurvesInfo>"));
        assertFalse(xml.contains("<UndiscountedCost name=\"global\">"));
    }

    @Test
    void periodCurvesListEveryTrialPoint() {
        String xml = CostCurvesXmlWriter.toXmlString(WriterFixtures.results());
        // 3 periods * 3 regions (incl. global) * (N+1 = 3) + 2 regional curves * 3 periods
        int points = xml.split("<DataPoint>", -1).length - 1;
        assertEquals(3 * 3 * 3 + 2 * 3, points);
    }

    @Test
    void globalTotalsMatchSummary() {
        PolicyCostResults r = WriterFixtures.results();
        String xml = CostCurvesXmlWriter.toXmlString(r);
        String expected = String.format(java.util.Locale.ROOT, "<GlobalUndiscountedTotalCost>%.6f</GlobalUndiscountedTotalCost>",
                r.summary().getGlobalCost());
        assertTrue(xml.contains(expected), xml);
    }

    @Test
    void writesFile(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("cost_curves_scripted.xml");
        CostCurvesXmlWriter.write(out, WriterFixtures.results());
        assertTrue(Files.readString(out).contains("<CostCurvesInfo scenario="));
    }

    @Test
    void escapesMarkup() {
        assertEquals("a&amp;b &lt;c&gt; &quot;d&quot;", CostCurvesXmlWriter.escape("a&b <c> \"d\""));
    }
}
