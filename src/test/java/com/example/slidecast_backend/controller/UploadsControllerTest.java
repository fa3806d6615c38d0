package com.example.slidecast_backend.controller;

import com.example.slidecast_backend.dto.web.UploadProgress;
import com.example.slidecast_backend.service.TaskService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = UploadsController.class)
@AutoConfigureMockMvc(addFilters = false)
class UploadsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TaskService taskService;

    @Test
    void progressReturnsSnapshot() throws Exception {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        UploadProgress progress = new UploadProgress("u1", "t1", "PROCESSING", "extract", 50,
                List.of(new UploadProgress.StepView("extract", "Extracting presentation content", "COMPLETED", null),
                        new UploadProgress.StepView("compose", "Composing final presentation", "PENDING", null)),
                List.of(), now, now);
        when(taskService.getProgress("u1")).thenReturn(Optional.of(progress));

        mockMvc.perform(get("/v1/uploads/u1/progress"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.progress").value(50))
                .andExpect(jsonPath("$.steps[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$.steps[1].key").value("compose"));
    }

    @Test
    void unknownUploadIs404() throws Exception {
        when(taskService.getProgress("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/uploads/missing/progress"))
                .andExpect(status().isNotFound());
    }
}
