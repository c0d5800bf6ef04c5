package policycost.io;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import policycost.config.PolicyCostConstants;
import policycost.engine.PolicyCostResults;
import policycost.engine.PolicySummary;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class PolicyCostExcelWriter {

    static final String SHEET_BY_PERIOD = "PolicyCost";
    static final String SHEET_TOTALS = "Totals";

    private static final int COLUMN_WIDTH = 16 * 256;

    private PolicyCostExcelWriter() {}

    public static void writeXlsx(Path path, PolicyCostResults results) throws IOException {

        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            CellStyle numberStyle = wb.createCellStyle();
            numberStyle.setAlignment(HorizontalAlignment.CENTER);
            numberStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            numberStyle.setDataFormat(df.getFormat("0.000"));

            // ===== by period =====
            Sheet sheet = wb.createSheet(SHEET_BY_PERIOD);
            int[] years = PolicyCostTable.years(results.modelTime());

            int r = 0;
            Row hdr = sheet.createRow(r++);
            int c = 0;
            c = writeHeader(hdr, c, "region", headerStyle);
            c = writeHeader(hdr, c, "variable", headerStyle);
            c = writeHeader(hdr, c, "axis", headerStyle);
            c = writeHeader(hdr, c, "units", headerStyle);
            for (int year : years) {
                c = writeHeader(hdr, c, Integer.toString(year), headerStyle);
            }

            for (PolicyCostTable.Row row : PolicyCostTable.rows(results)) {
                Row rr = sheet.createRow(r++);
                int cc = 0;
                rr.createCell(cc++).setCellValue(row.region());
                rr.createCell(cc++).setCellValue(row.variable());
                rr.createCell(cc++).setCellValue(row.yearLabel());
                rr.createCell(cc++).setCellValue(PolicyCostConstants.COST_UNITS);
                for (double v : row.values()) {
                    writeNumber(rr, cc++, v, numberStyle);
                }
            }
            setWidths(sheet, hdr.getLastCellNum());

            // ===== totals =====
            PolicySummary summary = results.summary();
            Sheet totals = wb.createSheet(SHEET_TOTALS);

            r = 0;
            Row th = totals.createRow(r++);
            c = 0;
            c = writeHeader(th, c, "region", headerStyle);
            c = writeHeader(th, c, "undiscounted", headerStyle);
            c = writeHeader(th, c, "discounted", headerStyle);

            for (Map.Entry<String, Double> e : summary.getRegionalCosts().entrySet()) {
                Row rr = totals.createRow(r++);
                rr.createCell(0).setCellValue(e.getKey());
                writeNumber(rr, 1, e.getValue() * PolicyCostConstants.CVRT_75_TO_90, numberStyle);
                writeNumber(rr, 2, summary.getRegionalDiscountedCost(e.getKey()) * PolicyCostConstants.CVRT_75_TO_90,
                        numberStyle);
            }

            Row gr = totals.createRow(r);
            gr.createCell(0).setCellValue(PolicyCostConstants.GLOBAL_REGION);
            writeNumber(gr, 1, summary.getGlobalCost() * PolicyCostConstants.CVRT_75_TO_90, numberStyle);
            writeNumber(gr, 2, summary.getGlobalDiscountedCost() * PolicyCostConstants.CVRT_75_TO_90, numberStyle);
            setWidths(totals, 3);

            try (OutputStream os = Files.newOutputStream(path)) {
                wb.write(os);
            }
        }
    }

    private static int writeHeader(Row hdr, int c, String text, CellStyle style) {
        Cell cell = hdr.createCell(c);
        cell.setCellValue(text);
        cell.setCellStyle(style);
        return c + 1;
    }

    private static void writeNumber(Row row, int c, double v, CellStyle style) {
        Cell cell = row.createCell(c);
        cell.setCellValue(v);
        cell.setCellStyle(style);
    }

    // autoSizeColumn needs AWT fonts
    private static void setWidths(Sheet sheet, int cols) {
        for (int i = 0; i < cols; i++) {
            sheet.setColumnWidth(i, COLUMN_WIDTH);
        }
    }
}
