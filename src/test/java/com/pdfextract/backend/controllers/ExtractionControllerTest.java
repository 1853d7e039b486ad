package com.pdfextract.backend.controllers;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.pdfextract.backend.dto.ExtractionResultDTO;
import com.pdfextract.backend.entities.ExtractionJob;
import com.pdfextract.backend.enums.DocumentType;
import com.pdfextract.backend.enums.JobStatus;
import com.pdfextract.backend.exceptions.ConflictException;
import com.pdfextract.backend.exceptions.ResourceNotFoundException;
import com.pdfextract.backend.services.ExtractionJobService;

@WebMvcTest(controllers = ExtractionController.class)
class ExtractionControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    ExtractionJobService jobService;

    private static ExtractionJob job(JobStatus status) {
        ExtractionJob job = new ExtractionJob();
        job.setId("job_20240301120000_abcd1234");
        job.setStatus(status);
        job.setTotalFiles(2);
        job.setStartedAt(LocalDateTime.of(2024, 3, 1, 12, 0));
        return job;
    }

    @Test
    void start_returnsAcceptedWithPendingJob() throws Exception {
        when(jobService.submit(anyList(), eq(DocumentType.UTILITY_BILL), any(), anyBoolean()))
                .thenReturn(job(JobStatus.PENDING));

        mockMvc.perform(post("/api/extract/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileIds\":[\"f1\",\"f2\"],\"documentType\":\"utility_bill\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.jobId").value("job_20240301120000_abcd1234"))
                .andExpect(jsonPath("$.data.status").value("pending"))
                .andExpect(jsonPath("$.data.totalFiles").value(2));

        verify(jobService).submit(List.of("f1", "f2"), DocumentType.UTILITY_BILL, null, true);
    }

    @Test
    void start_withoutFileIds_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/extract/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileIds\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void start_withUnknownDocumentType_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/extract/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileIds\":[\"f1\"],\"documentType\":\"receipt\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void status_unknownJob_isNotFound() throws Exception {
        when(jobService.getStatus("job_x")).thenThrow(new ResourceNotFoundException("Job not found: job_x"));

        mockMvc.perform(get("/api/extract/status/job_x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Job not found: job_x"));
    }

    @Test
    void result_ofRunningJob_isConflict() throws Exception {
        when(jobService.getResult("job_1")).thenThrow(new ConflictException("Job not completed. Current status: processing"));

        mockMvc.perform(get("/api/extract/result/job_1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Job not completed. Current status: processing"));
    }

    @Test
    void result_ofCompletedJob_returnsCounts() throws Exception {
        when(jobService.getResult("job_1")).thenReturn(ExtractionResultDTO.builder()
                .jobId("job_1")
                .status(JobStatus.COMPLETED)
                .documents(List.of())
                .totalProcessed(3)
                .successful(2)
                .failed(1)
                .outputPath("outputs/job_1_results.xlsx")
                .build());

        mockMvc.perform(get("/api/extract/result/job_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("completed"))
                .andExpect(jsonPath("$.data.successful").value(2))
                .andExpect(jsonPath("$.data.failed").value(1));
    }

    @Test
    void jobs_listsStatuses() throws Exception {
        when(jobService.listJobs()).thenReturn(List.of(job(JobStatus.COMPLETED)));

        mockMvc.perform(get("/api/extract/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].status").value("completed"));
    }

    @Test
    void delete_existingJob_returnsEnvelopeWithoutData() throws Exception {
        mockMvc.perform(delete("/api/extract/job_20240301120000_abcd1234"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Job deleted successfully"))
                .andExpect(jsonPath("$.data").doesNotExist());

        verify(jobService).delete("job_20240301120000_abcd1234");
    }

    @Test
    void delete_unknownJob_isNotFound() throws Exception {
        doThrow(new ResourceNotFoundException("Job not found: job_x")).when(jobService).delete("job_x");

        mockMvc.perform(delete("/api/extract/job_x"))
                .andExpect(status().isNotFound());
    }
}
