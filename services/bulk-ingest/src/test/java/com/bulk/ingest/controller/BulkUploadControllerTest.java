package com.bulk.ingest.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.bulk.common.model.ErrorSeverity;
import com.bulk.common.model.ProcessingErrorDTO;
import com.bulk.common.model.ProgressEvent;
import com.bulk.common.model.UploadJobDTO;
import com.bulk.common.model.UploadStatus;
import com.bulk.ingest.broker.BrokerUnavailableException;
import com.bulk.ingest.resilience.CircuitOpenException;
import com.bulk.ingest.service.ProgressListener;
import com.bulk.ingest.service.ProgressReporter;
import com.bulk.ingest.service.Subscription;
import com.bulk.ingest.service.UploadNotFoundException;
import com.bulk.ingest.service.UploadQueryService;
import com.bulk.ingest.service.UploadSubmissionService;

@WebMvcTest(BulkUploadController.class)
class BulkUploadControllerTest {

    private static final UUID UPLOAD_ID = UUID.fromString("0190c8a2-7d1e-7000-8000-000000000001");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UploadSubmissionService submissionService;

    @MockBean
    private UploadQueryService queryService;

    @MockBean
    private ProgressReporter progressReporter;

    private static MockMultipartFile csv(String content) {
        return new MockMultipartFile("file", "march.csv", "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }

    private static UploadJobDTO job(UploadStatus status) {
        return UploadJobDTO.builder()
                .uploadId(UPLOAD_ID)
                .fileName("march.csv")
                .status(status)
                .totalRows(3)
                .processedRows(2)
                .failedRows(1)
                .build();
    }

    @Nested
    @DisplayName("POST /bulk-upload")
    class Upload {

        @Test
        @DisplayName("answers 202 with the upload id once the job is queued")
        void accepted() throws Exception {
            when(submissionService.submit(eq("march.csv"), anyLong(), eq("alice"), any()))
                    .thenReturn(job(UploadStatus.PENDING));

            mockMvc.perform(multipart("/bulk-upload").file(csv("a,b\n1,2\n")).param("ownerId", "alice"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.uploadId").value(UPLOAD_ID.toString()))
                    .andExpect(jsonPath("$.status").value("pending"))
                    .andExpect(jsonPath("$.declaredRowCount").value(3));
        }

        @Test
        @DisplayName("an empty file is a bad request")
        void emptyFile() throws Exception {
            mockMvc.perform(multipart("/bulk-upload").file(csv("")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("File is empty"));
            verify(submissionService, never()).submit(any(), anyLong(), any(), any());
        }

        @Test
        @DisplayName("a request without a file part is a bad request")
        void missingFile() throws Exception {
            mockMvc.perform(multipart("/bulk-upload").param("ownerId", "alice"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("a file without data rows is a bad request")
        void noRows() throws Exception {
            when(submissionService.submit(any(), anyLong(), any(), any()))
                    .thenThrow(new IllegalArgumentException("File contains no data rows"));

            mockMvc.perform(multipart("/bulk-upload").file(csv("InvoiceNo\n")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("File contains no data rows"));
        }

        @Test
        @DisplayName("an open circuit answers 503 with Retry-After rounded up to whole seconds")
        void circuitOpen() throws Exception {
            when(submissionService.submit(any(), anyLong(), any(), any()))
                    .thenThrow(new CircuitOpenException("broker", Duration.ofMillis(12_500)));

            mockMvc.perform(multipart("/bulk-upload").file(csv("a\n1\n")))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(header().string("Retry-After", "13"));
        }

        @Test
        @DisplayName("a failed enqueue answers 503")
        void brokerUnavailable() throws Exception {
            when(submissionService.submit(any(), anyLong(), any(), any()))
                    .thenThrow(new BrokerUnavailableException("Publish timed out", null));

            mockMvc.perform(multipart("/bulk-upload").file(csv("a\n1\n")))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(header().string("Retry-After", "30"));
        }
    }

    @Nested
    @DisplayName("job endpoints")
    class JobEndpoints {

        @Test
        @DisplayName("status returns the job snapshot")
        void status200() throws Exception {
            when(queryService.getStatus(UPLOAD_ID)).thenReturn(job(UploadStatus.PROCESSING));

            mockMvc.perform(get("/bulk-upload/{id}/status", UPLOAD_ID))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("processing"))
                    .andExpect(jsonPath("$.processedRows").value(2))
                    .andExpect(jsonPath("$.failedRows").value(1));
        }

        @Test
        @DisplayName("an unknown upload is 404")
        void notFound() throws Exception {
            when(queryService.getStatus(UPLOAD_ID)).thenThrow(new UploadNotFoundException(UPLOAD_ID));

            mockMvc.perform(get("/bulk-upload/{id}/status", UPLOAD_ID))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("errors are returned one page at a time")
        void errors() throws Exception {
            ProcessingErrorDTO error = ProcessingErrorDTO.builder()
                    .uploadId(UPLOAD_ID)
                    .rowNumber(37L)
                    .errorMessage("Quantity cannot be negative: -2")
                    .severity(ErrorSeverity.VALIDATION)
                    .build();
            when(queryService.getErrors(UPLOAD_ID, 1, 20))
                    .thenReturn(new PageImpl<>(List.of(error), PageRequest.of(1, 20), 21));

            mockMvc.perform(get("/bulk-upload/{id}/errors", UPLOAD_ID).param("page", "1").param("size", "20"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.page").value(1))
                    .andExpect(jsonPath("$.totalElements").value(21))
                    .andExpect(jsonPath("$.totalPages").value(2))
                    .andExpect(jsonPath("$.errors[0].rowNumber").value(37))
                    .andExpect(jsonPath("$.errors[0].errorMessage").value("Quantity cannot be negative: -2"));
        }

        @Test
        @DisplayName("errors default to the first page of 50")
        void errorsDefaults() throws Exception {
            when(queryService.getErrors(eq(UPLOAD_ID), anyInt(), anyInt()))
                    .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 50), 0));

            mockMvc.perform(get("/bulk-upload/{id}/errors", UPLOAD_ID)).andExpect(status().isOk());

            verify(queryService).getErrors(UPLOAD_ID, 0, 50);
        }

        @Test
        @DisplayName("cancel answers 202")
        void cancel() throws Exception {
            when(queryService.cancel(UPLOAD_ID)).thenReturn(job(UploadStatus.PROCESSING));

            mockMvc.perform(post("/bulk-upload/{id}/cancel", UPLOAD_ID))
                    .andExpect(status().isAccepted());
        }

        @Test
        @DisplayName("cancelling a finished job is a conflict")
        void cancelTerminal() throws Exception {
            when(queryService.cancel(UPLOAD_ID))
                    .thenThrow(new IllegalStateException("Upload " + UPLOAD_ID + " is already completed"));

            mockMvc.perform(post("/bulk-upload/{id}/cancel", UPLOAD_ID))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("progress is streamed as server-sent events")
        void progress() throws Exception {
            when(progressReporter.subscribe(eq(UPLOAD_ID), any())).thenAnswer(invocation -> {
                ProgressListener listener = invocation.getArgument(1);
                listener.onEvent(ProgressEvent.builder()
                        .uploadId(UPLOAD_ID)
                        .status(UploadStatus.COMPLETED)
                        .processedRows(10)
                        .terminal(true)
                        .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                        .build());
                listener.onComplete();
                return (Subscription) () -> { };
            });

            MvcResult result = mockMvc.perform(get("/bulk-upload/{id}/progress", UPLOAD_ID))
                    .andExpect(request().asyncStarted())
                    .andReturn();

            String body = result.getResponse().getContentAsString();
            assertThat(body).contains("event:progress").contains("\"processedRows\":10").contains("\"terminal\":true");
        }
    }
}
