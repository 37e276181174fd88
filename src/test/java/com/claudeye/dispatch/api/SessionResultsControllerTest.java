package com.claudeye.dispatch.api;

import com.claudeye.core.evals.EvalRunResult;
import com.claudeye.core.evals.EvalRunSummary;
import com.claudeye.core.evals.FilterComputeResult;
import com.claudeye.core.evals.FilterComputeSummary;
import com.claudeye.core.processing.BatchOutcome;
import com.claudeye.core.processing.SessionResultService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SessionResultsController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SessionResultsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionResultService resultService;

    @Test
    @DisplayName("GET /evals returns the summary and whether it was cached")
    void evals() throws Exception {
        var summary = EvalRunSummary.of(List.of(
                new EvalRunResult("quality", true, 1.0, null, null, 4, null, false)), 4);
        when(resultService.runEvals("proj", "sess", true)).thenReturn(BatchOutcome.computed(summary));

        mockMvc.perform(get("/api/sessions/proj/sess/evals").param("forceRefresh", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.cached").value(false))
                .andExpect(jsonPath("$.summary.passCount").value(1))
                .andExpect(jsonPath("$.summary.results[0].name").value("quality"));
    }

    @Test
    @DisplayName("GET /enrichments reports when nothing is registered")
    void enrichmentsNothingRegistered() throws Exception {
        when(resultService.runEnrichments("proj", "sess", false)).thenReturn(BatchOutcome.nothingRegistered());

        mockMvc.perform(get("/api/sessions/proj/sess/enrichments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasItems").value(false))
                .andExpect(jsonPath("$.summary").doesNotExist());
    }

    @Test
    @DisplayName("GET /filters/{view} returns filter values")
    void filters() throws Exception {
        var summary = FilterComputeSummary.of(List.of(new FilterComputeResult("model", "opus", 1, null, false)), 1);
        when(resultService.computeFilters("costs", "proj", "sess")).thenReturn(BatchOutcome.fromCache(summary));

        mockMvc.perform(get("/api/sessions/proj/sess/filters/costs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cached").value(true))
                .andExpect(jsonPath("$.summary.results[0].value").value("opus"));
    }

    @Test
    @DisplayName("failed runs return 500 with the error")
    void failure() throws Exception {
        when(resultService.runEvals("proj", "ghost", false)).thenReturn(BatchOutcome.failure("no such file"));

        mockMvc.perform(get("/api/sessions/proj/ghost/evals"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error").value("no such file"));
    }
}
