package policycost.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import policycost.engine.PolicyCostResults;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyCostCsvWriterTest {

    @Test
    void writesOneRowPerRegionAndVariable(@TempDir Path dir) throws IOException {
        PolicyCostResults r = WriterFixtures.results();
        Path out = dir.resolve("costs.csv");
        PolicyCostCsvWriter.write(out, r);

        List<String> lines = Files.readAllLines(out);
        assertEquals("region;variable;axis;units;2005;2010;2015", lines.get(0));
        // 2 regions * 3 variables
        assertEquals(1 + 6, lines.size());
        assertTrue(lines.get(1).startsWith("R1;PolicyCostUndisc;Period;(millions)90US$;"));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("R2;PolicyCostTotalDisc;AllYears;")));
        assertTrue(lines.stream().noneMatch(l -> l.startsWith("global;")));
    }

    @Test
    void totalsAreConvertedAndInLastColumn(@TempDir Path dir) throws IOException {
        PolicyCostResults r = WriterFixtures.results();
        Path out = dir.resolve("costs.csv");
        PolicyCostCsvWriter.write(out, r);

        String row = Files.readAllLines(out).stream()
                .filter(l -> l.startsWith("R1;PolicyCostTotalUndisc;"))
                .findFirst()
                .orElseThrow();
        String[] cells = row.split(";");
        assertEquals("0.000", cells[4]);
        assertEquals("0.000", cells[5]);
        assertEquals(r.summary().getRegionalCost("R1") * 2.212, Double.parseDouble(cells[6]), 1e-3);
    }
}
