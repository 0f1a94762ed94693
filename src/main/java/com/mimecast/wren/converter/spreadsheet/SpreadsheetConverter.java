package com.mimecast.wren.converter.spreadsheet;

import com.mimecast.wren.config.SpreadsheetConfig;
import com.mimecast.wren.converter.AbstractConverter;
import com.mimecast.wren.converter.ConversionContext;
import com.mimecast.wren.converter.ConversionResult;
import com.mimecast.wren.converter.OutputArtifact;
import com.mimecast.wren.converter.WorkingDirectory;
import com.mimecast.wren.exception.ConversionException;
import com.mimecast.wren.exception.ProcessingException;
import com.mimecast.wren.exception.UnsupportedFormatException;
import com.mimecast.wren.extraction.Attachment;
import com.mimecast.wren.util.PathUtils;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Spreadsheet converter.
 *
 * <p>Writes one CSV per sheet named {@code <base>_<sheet>.csv}.
 * <br>Formula cells contribute their cached value, never the formula.
 * <br>Numbers and dates keep their display format.
 * <p>Sheets are selected by configuration, an empty selection converts every sheet.
 */
public class SpreadsheetConverter extends AbstractConverter {

    private static final Set<String> EXTENSIONS = Set.of(".xlsx", ".xlsm", ".xls");

    private final SpreadsheetConfig config;

    /**
     * Constructs a new SpreadsheetConverter instance.
     *
     * @param config    SpreadsheetConfig instance.
     * @param outputDir Output directory relative to the output root.
     */
    public SpreadsheetConverter(SpreadsheetConfig config, String outputDir) {
        super(outputDir);
        this.config = config;
    }

    @Override
    public String getName() {
        return "spreadsheet";
    }

    @Override
    protected Set<String> getExtensions() {
        return EXTENSIONS;
    }

    @Override
    protected long getMaxFileSize() {
        return config.getMaxFileSize();
    }

    @Override
    protected boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    protected ConversionResult convertInternal(Attachment attachment, ConversionContext context, String baseName,
                                               WorkingDirectory workDir) throws ConversionException, IOException {
        File source = workDir.write("source" + attachment.getExtension(), attachment.getContent());
        ConversionResult result = new ConversionResult(getName());

        try (Workbook workbook = open(source, attachment)) {
            List<String> selected = config.getSheets();
            for (String name : selected) {
                if (workbook.getSheet(name) == null) {
                    result.addWarning("Configured sheet not found: " + name);
                }
            }

            DataFormatter formatter = new DataFormatter();
            Map<String, Integer> rowsPerSheet = new LinkedHashMap<>();
            StringBuilder text = new StringBuilder();
            List<String> usedNames = new ArrayList<>();

            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                if (!selected.isEmpty() && !selected.contains(sheet.getSheetName())) {
                    continue;
                }

                String csv = toCsv(sheet, formatter, result);
                String fileName = uniqueSheetFile(baseName, sheet.getSheetName(), usedNames);
                result.addArtifact(new OutputArtifact(artifactPath(fileName), csv, OutputArtifact.Kind.CSV));
                rowsPerSheet.put(sheet.getSheetName(), sheet.getLastRowNum() < 0 ? 0 : sheet.getLastRowNum() + 1);

                text.append("## Sheet: ").append(sheet.getSheetName()).append("\n\n").append(csv).append('\n');
            }

            result.setText(text.toString().trim());
            result.putMetadata("source", attachment.getOriginalName());
            result.putMetadata("sheetCount", workbook.getNumberOfSheets());
            result.putMetadata("convertedSheets", rowsPerSheet);
            log.debug("Workbook {} converted {} of {} sheets", attachment.getOriginalName(), rowsPerSheet.size(),
                    workbook.getNumberOfSheets());
        }

        return result;
    }

    /**
     * Opens workbook read only from file, which POI handles with less memory than a stream.
     *
     * @param source     Workbook file.
     * @param attachment Attachment instance.
     * @return Workbook instance.
     * @throws ConversionException Encrypted or unreadable workbook.
     */
    private Workbook open(File source, Attachment attachment) throws ConversionException {
        try {
            return WorkbookFactory.create(source, null, true);
        } catch (EncryptedDocumentException e) {
            throw new ProcessingException("Workbook is password protected: " + attachment.getOriginalName(), e);
        } catch (IOException | IllegalArgumentException | POIXMLException e) {
            throw new UnsupportedFormatException("Not a readable workbook: " + attachment.getOriginalName(), e);
        }
    }

    /**
     * Renders sheet as CSV.
     *
     * @param sheet     Sheet instance.
     * @param formatter DataFormatter instance.
     * @param result    ConversionResult for warnings.
     * @return CSV text.
     */
    private String toCsv(Sheet sheet, DataFormatter formatter, ConversionResult result) {
        StringBuilder csv = new StringBuilder();
        int lastRow = sheet.getLastRowNum();
        int maxRows = config.getMaxRowsPerSheet();
        if (lastRow + 1 > maxRows) {
            result.addWarning("Sheet " + sheet.getSheetName() + " truncated to " + maxRows + " rows");
            result.setPartial(true);
            lastRow = maxRows - 1;
        }

        for (int r = 0; r <= lastRow; r++) {
            Row row = sheet.getRow(r);
            if (row != null) {
                short lastCell = row.getLastCellNum();
                for (int c = 0; c < lastCell; c++) {
                    if (c > 0) {
                        csv.append(',');
                    }
                    Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                    csv.append(quote(cell == null ? "" : cellValue(cell, formatter)));
                }
            }
            csv.append("\r\n");
        }
        return csv.toString();
    }

    /**
     * Gets display value, using the cached result for formulas.
     *
     * @param cell      Cell instance.
     * @param formatter DataFormatter instance.
     * @return Display value.
     */
    static String cellValue(Cell cell, DataFormatter formatter) {
        if (cell.getCellType() != CellType.FORMULA) {
            return formatter.formatCellValue(cell);
        }

        switch (cell.getCachedFormulaResultType()) {
            case NUMERIC:
                return formatter.formatRawCellContents(cell.getNumericCellValue(),
                        cell.getCellStyle().getDataFormat(), cell.getCellStyle().getDataFormatString());
            case STRING:
                return cell.getRichStringCellValue().getString();
            case BOOLEAN:
                return cell.getBooleanCellValue() ? "TRUE" : "FALSE";
            case ERROR:
                return FormulaError.forInt(cell.getErrorCellValue()).getString();
            default:
                return "";
        }
    }

    /**
     * Quotes CSV field when needed.
     *
     * @param value Field value.
     * @return CSV field.
     */
    static String quote(String value) {
        if (value.isEmpty()) {
            return value;
        }
        boolean needs = value.indexOf(',') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0 || value.charAt(0) == ' ' || value.charAt(value.length() - 1) == ' ';
        return needs ? "\"" + value.replace("\"", "\"\"") + "\"" : value;
    }

    private static String uniqueSheetFile(String baseName, String sheetName, List<String> used) {
        String safe = PathUtils.sanitize(sheetName).replace(' ', '_');
        String name = baseName + "_" + safe + ".csv";
        int counter = 1;
        while (used.contains(name.toLowerCase(Locale.ROOT))) {
            name = baseName + "_" + safe + "_" + counter++ + ".csv";
        }
        used.add(name.toLowerCase(Locale.ROOT));
        return name;
    }
}
