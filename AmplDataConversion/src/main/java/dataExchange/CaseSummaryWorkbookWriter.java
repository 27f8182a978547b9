package dataExchange;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import models.CaseResult;

/**
 * Writes one row per converted case into an .xlsx workbook (sheet {@value #SHEET_NAME}).
 * Fixed columns first, then one column per scalar param seen in any case, in order of
 * first appearance.
 */
public class CaseSummaryWorkbookWriter {

    private static final Logger logger = LoggerFactory.getLogger(CaseSummaryWorkbookWriter.class);

    public static final String SHEET_NAME = "Cases";

    static final String[] FIXED_HEADERS = { "Case", "Status", "Sets", "Params", "Set elements", "Skipped lines",
            "JSON", "Message" };

    public void write(List<CaseResult> results, Path workbookFile) throws IOException {
        Set<String> scalarNames = new LinkedHashSet<>();
        for (CaseResult result : results) {
            scalarNames.addAll(result.getScalars().keySet());
        }
        List<String> scalarColumns = new ArrayList<>(scalarNames);

        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            XSSFSheet sheet = workbook.createSheet(SHEET_NAME);

            CellStyle headerStyle = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            headerStyle.setFont(bold);

            DataFormat format = workbook.createDataFormat();
            CellStyle decimalStyle = workbook.createCellStyle();
            decimalStyle.setDataFormat(format.getFormat("0.00000"));

            Row headerRow = sheet.createRow(0);
            int headerColumn = 0;
            for (String header : FIXED_HEADERS) {
                Cell cell = headerRow.createCell(headerColumn++);
                cell.setCellValue(header);
                cell.setCellStyle(headerStyle);
            }
            for (String scalar : scalarColumns) {
                Cell cell = headerRow.createCell(headerColumn++);
                cell.setCellValue(scalar);
                cell.setCellStyle(headerStyle);
            }

            int rowNum = 1;
            for (CaseResult result : results) {
                Row row = sheet.createRow(rowNum++);
                int colNum = 0;
                row.createCell(colNum++).setCellValue(result.getCaseName());
                row.createCell(colNum++).setCellValue(result.getStatus().name());
                row.createCell(colNum++).setCellValue(result.getSetCount());
                row.createCell(colNum++).setCellValue(result.getParamCount());
                row.createCell(colNum++).setCellValue(result.getSetElementCount());
                row.createCell(colNum++).setCellValue(result.getSkippedLineCount());
                row.createCell(colNum++).setCellValue(result.getJsonFile());
                row.createCell(colNum++).setCellValue(result.getMessage());

                for (String scalar : scalarColumns) {
                    Object value = result.getScalars().get(scalar);
                    Cell cell = row.createCell(colNum++);
                    if (value instanceof Double && Double.isFinite((Double) value)) {
                        cell.setCellValue((Double) value);
                        cell.setCellStyle(decimalStyle);
                    } else if (value != null) {
                        cell.setCellValue(String.valueOf(value));
                    } else {
                        cell.setCellValue("N/A");
                    }
                }
            }

            sheet.setColumnWidth(0, 40 * 256);
            sheet.setColumnWidth(6, 40 * 256);
            sheet.setColumnWidth(7, 60 * 256);
            sheet.createFreezePane(0, 1);

            Path parent = workbookFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileOutputStream fileOut = new FileOutputStream(workbookFile.toFile())) {
                workbook.write(fileOut);
            }
        }
        logger.info("Wrote summary of {} cases to {}", results.size(), workbookFile);
    }
}
