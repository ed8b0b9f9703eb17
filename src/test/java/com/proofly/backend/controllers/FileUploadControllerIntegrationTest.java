package com.proofly.backend.controllers;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import com.proofly.backend.entities.FileUpload;
import com.proofly.backend.enums.FileKind;
import com.proofly.backend.enums.SourcePlatform;
import com.proofly.backend.enums.UploadStatus;
import com.proofly.backend.security.GatewayAuthenticationFilter;
import com.proofly.backend.services.uploads.FileUploadService;
import com.proofly.backend.services.uploads.UploadPipelineService;

@SpringBootTest
@AutoConfigureMockMvc
class FileUploadControllerIntegrationTest {

    private static final String CSV = "Date,Description,Amount,Type\n"
            + "2024-01-15,Freelance Payment,5000.00,Credit\n";

    @Autowired
    MockMvc mockMvc;

    @MockBean
    FileUploadService uploadService;

    @MockBean
    UploadPipelineService pipelineService;

    private final UUID userId = UUID.randomUUID();

    @Test
    void upload_requiresAuthentication() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "statement.csv", "text/csv",
                CSV.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/uploads").file(file))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void upload_storesAndQueuesProcessing() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "statement.csv", "text/csv",
                CSV.getBytes(StandardCharsets.UTF_8));
        FileUpload upload = new FileUpload();
        upload.setId(UUID.randomUUID());
        upload.setUserId(userId);
        upload.setOriginalFilename("statement.csv");
        upload.setFileKind(FileKind.BANK_STATEMENT);
        upload.setSource(SourcePlatform.GCASH);
        upload.setStatus(UploadStatus.UPLOADED);
        when(uploadService.createUpload(eq(userId), eq("statement.csv"), eq("text/csv"), any(),
                eq(FileKind.BANK_STATEMENT), eq(SourcePlatform.GCASH),
                eq(LocalDate.of(2024, 1, 1)), eq(LocalDate.of(2024, 1, 31)))).thenReturn(upload);

        mockMvc.perform(multipart("/api/uploads").file(file)
                        .param("fileKind", "BANK_STATEMENT")
                        .param("source", "gcash")
                        .param("dateRangeStart", "2024-01-01")
                        .param("dateRangeEnd", "2024-01-31")
                        .header(GatewayAuthenticationFilter.USER_ID_HEADER, userId.toString()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.status").value("UPLOADED"))
                .andExpect(jsonPath("$.data.source").value("gcash"));

        verify(pipelineService).startProcessing(upload.getId());
    }

    @Test
    void upload_emptyFile_badRequest() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("file", "empty.csv", "text/csv", new byte[0]);

        mockMvc.perform(multipart("/api/uploads").file(empty)
                        .header(GatewayAuthenticationFilter.USER_ID_HEADER, userId.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("File is missing or empty"));

        verify(pipelineService, never()).startProcessing(any());
    }
}
