package com.visualoom.controller;

import com.visualoom.dto.JobStatus;
import com.visualoom.model.JobState;
import com.visualoom.service.IndexJobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(IndexController.class)
class IndexControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IndexJobService indexJobService;

    @Test
    void startIndexingReturnsJobIdImmediately() throws Exception {
        when(indexJobService.submit("/photos", "Holiday")).thenReturn("job-1");

        mockMvc.perform(post("/api/index")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \" /photos \", \"tag\": \"Holiday\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.job_id").value("job-1"))
                .andExpect(jsonPath("$.path").value("/photos"));
    }

    @Test
    void startIndexingWithoutPathIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/index")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tag\": \"Holiday\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verify(indexJobService, never()).submit(anyString(), any());
    }

    @Test
    void statusOfRunningJob() throws Exception {
        when(indexJobService.status("job-1")).thenReturn(Optional.of(
                new JobStatus("job-1", "/photos", null, JobState.RUNNING, 40, 10, 4, null)));

        mockMvc.perform(get("/api/index/job-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value("job-1"))
                .andExpect(jsonPath("$.state").value("RUNNING"))
                .andExpect(jsonPath("$.progress").value(40))
                .andExpect(jsonPath("$.total").value(10))
                .andExpect(jsonPath("$.indexed").value(4))
                .andExpect(jsonPath("$.done").value(false));
    }

    @Test
    void statusOfFailedJobCarriesError() throws Exception {
        when(indexJobService.status("job-2")).thenReturn(Optional.of(
                new JobStatus("job-2", "/photos", null, JobState.FAILED, 25, 4, 0, "disk full")));

        mockMvc.perform(get("/api/index/job-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.done").value(true))
                .andExpect(jsonPath("$.error").value("disk full"));
    }

    @Test
    void statusOfUnknownJobIsNotFound() throws Exception {
        when(indexJobService.status(eq("nope"))).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/index/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void listJobs() throws Exception {
        when(indexJobService.listJobs()).thenReturn(List.of(
                new JobStatus("job-1", "/a", null, JobState.COMPLETED, 100, 2, 2, null)));

        mockMvc.perform(get("/api/index"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.jobs[0].job_id").value("job-1"));
    }
}
