package com.proofly.backend.services.ingestion.extractors;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import com.proofly.backend.services.ingestion.DocumentFormat;
import com.proofly.backend.services.ingestion.DocumentParsingException;
import com.proofly.backend.services.ingestion.ExtractedDocument;

/**
 * First sheet of an xls/xlsx workbook. The first non-empty row is the header.
 * Date cells are rendered as ISO text so the normalizer sees one shape.
 */
@Component
public class SpreadsheetExtractor implements DocumentExtractor {

    private static final Set<String> EXTENSIONS = Set.of("xlsx", "xls");
    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter ISO_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final DataFormatter formatter = new DataFormatter(Locale.US);

    @Override
    public DocumentFormat format() {
        return DocumentFormat.SPREADSHEET;
    }

    @Override
    public boolean supports(String extension) {
        return extension != null && EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    @Override
    public ExtractedDocument extract(byte[] content) {
        if (content == null || content.length == 0) {
            throw new DocumentParsingException("File is empty");
        }

        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                return ExtractedDocument.ofRows(DocumentFormat.SPREADSHEET, List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);

            List<String> headers = null;
            List<Map<String, String>> rows = new ArrayList<>();
            for (Row row : sheet) {
                if (headers == null) {
                    List<String> candidate = readHeader(row);
                    if (!candidate.isEmpty()) headers = candidate;
                    continue;
                }

                Map<String, String> values = new LinkedHashMap<>();
                boolean any = false;
                for (int i = 0; i < headers.size(); i++) {
                    String header = headers.get(i);
                    if (header == null) continue;
                    String value = cellText(row.getCell(i));
                    if (value != null && !value.isBlank()) any = true;
                    values.putIfAbsent(header, value);
                }
                if (any) rows.add(values);
            }
            return ExtractedDocument.ofRows(DocumentFormat.SPREADSHEET, rows);
        } catch (EncryptedDocumentException e) {
            throw new DocumentParsingException("Spreadsheet is password protected", e);
        } catch (IOException | RuntimeException e) {
            throw new DocumentParsingException("Could not read spreadsheet: " + e.getMessage(), e);
        }
    }

    private List<String> readHeader(Row row) {
        List<String> headers = new ArrayList<>();
        boolean any = false;
        short last = row.getLastCellNum();
        for (int i = 0; i < Math.max(last, 0); i++) {
            String text = cellText(row.getCell(i));
            if (text == null || text.isBlank()) {
                headers.add(null);
            } else {
                headers.add(text.trim());
                any = true;
            }
        }
        return any ? headers : List.of();
    }

    private String cellText(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    LocalDateTime value = cell.getLocalDateTimeCellValue();
                    if (value == null) return null;
                    return value.toLocalTime().equals(LocalTime.MIDNIGHT)
                            ? value.format(ISO_DATE)
                            : value.format(ISO_DATE_TIME);
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case STRING:
                return cell.getStringCellValue();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case BLANK:
            case ERROR:
                return null;
            default:
                return formatter.formatCellValue(cell);
        }
    }
}
