package com.proofly.backend.services.ingestion.extractors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import com.proofly.backend.services.ingestion.DocumentFormat;
import com.proofly.backend.services.ingestion.DocumentParsingException;
import com.proofly.backend.services.ingestion.ExtractedDocument;

class SpreadsheetExtractorTest {

    private final SpreadsheetExtractor extractor = new SpreadsheetExtractor();

    @Test
    void extract_readsFirstSheet_withDateAndNumericCells() throws IOException {
        byte[] xlsx;
        try (XSSFWorkbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = wb.createSheet("Transactions");
            CellStyle dateStyle = wb.createCellStyle();
            dateStyle.setDataFormat(wb.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Date");
            header.createCell(1).setCellValue("Description");
            header.createCell(2).setCellValue("Amount");

            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue(LocalDateTime.of(2024, 1, 15, 0, 0));
            first.getCell(0).setCellStyle(dateStyle);
            first.createCell(1).setCellValue("Freelance Payment");
            first.createCell(2).setCellValue(5000.0);

            sheet.createRow(2);

            Row second = sheet.createRow(3);
            second.createCell(0).setCellValue("2024-01-16");
            second.createCell(1).setCellValue("Grocery Shopping");
            second.createCell(2).setCellValue(-1500.5);

            wb.write(out);
            xlsx = out.toByteArray();
        }

        ExtractedDocument doc = extractor.extract(xlsx);

        assertThat(doc.format()).isEqualTo(DocumentFormat.SPREADSHEET);
        List<Map<String, String>> rows = doc.rows();
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0))
                .containsEntry("Date", "2024-01-15")
                .containsEntry("Description", "Freelance Payment")
                .containsEntry("Amount", "5000");
        assertThat(rows.get(1)).containsEntry("Amount", "-1500.5");
    }

    @Test
    void extract_wrapsUnreadableWorkbook() {
        assertThatThrownBy(() -> extractor.extract("not a workbook".getBytes()))
                .isInstanceOf(DocumentParsingException.class)
                .hasMessageContaining("Could not read spreadsheet");
    }
}
