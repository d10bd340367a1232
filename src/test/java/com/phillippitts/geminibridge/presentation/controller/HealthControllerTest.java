package com.phillippitts.geminibridge.presentation.controller;

import com.phillippitts.geminibridge.domain.QueueStats;
import com.phillippitts.geminibridge.service.queue.AdmissionQueue;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = HealthController.class,
        properties = "bridge.security.bearer-token=" + ControllerTestSupport.TOKEN)
@Import(ControllerTestSupport.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AdmissionQueue queue;

    @Test
    void reportsQueueStatsWithoutAuthentication() throws Exception {
        when(queue.getStats()).thenReturn(new QueueStats(2, 1, 40, 120, 5));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("GeminiBridge"))
                .andExpect(jsonPath("$.version").value("2.0.0"))
                .andExpect(jsonPath("$.queue.active_requests").value(2))
                .andExpect(jsonPath("$.queue.queued_requests").value(1))
                .andExpect(jsonPath("$.queue.total_processed").value(40))
                .andExpect(jsonPath("$.queue.average_wait_time_ms").value(120))
                .andExpect(jsonPath("$.queue.max_concurrent").value(5));
    }
}
