package com.fillline.scheduler.web;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public class ScheduleControllerTest {

    private static final String THREE_LOTS = "["
            + "{\"id\":\"A\",\"type\":\"Solution\",\"vialCount\":\"1000000\"},"
            + "{\"id\":\"B\",\"type\":\"Solution\",\"vialCount\":\"500000\"},"
            + "{\"id\":\"C\",\"type\":\"Suspension\",\"vialCount\":\"2000000\"}]";

    @Autowired
    private MockMvc mockMvc;

    @Test
    public void testSchedule() throws Exception {
        String body = "{\"lots\":" + THREE_LOTS + ",\"strategy\":\"spt-pack\",\"startTime\":\"2025-01-01T08:00:00\"}";

        mockMvc.perform(post("/api/v1/schedules").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("spt-pack"))
                .andExpect(jsonPath("$.schedule.activities", hasSize(6)))
                .andExpect(jsonPath("$.schedule.activities[0].kind").value("CLEAN"))
                .andExpect(jsonPath("$.schedule.activities[0].start").value("2025-01-01T08:00:00"))
                .andExpect(jsonPath("$.kpis.cleanBlocks").value(2));
    }

    @Test
    public void testPreflightReport() throws Exception {
        String body = "{\"lots\":[{\"id\":\"A\",\"type\":\"Solution\",\"vialCount\":\"abc\"},"
                + "{\"id\":\"B\",\"type\":\"Solution\",\"vialCount\":\"10\"}]}";

        mockMvc.perform(post("/api/v1/schedules/preflight").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.errors[0].code").value("NON_NUMERIC_VIAL_COUNT"))
                .andExpect(jsonPath("$.lots", hasSize(1)));
    }

    @Test
    public void testInvalidLotsAreBadRequest() throws Exception {
        String body = "{\"lots\":[{\"id\":\"A\",\"type\":\"Solution\",\"vialCount\":\"0\"}],\"strategy\":\"spt\"}";

        mockMvc.perform(post("/api/v1/schedules").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("PreflightFailedException"))
                .andExpect(jsonPath("$.issues[0].code").value("NON_POSITIVE_VIAL_COUNT"));
    }

    @Test
    public void testUnknownStrategyIsBadRequest() throws Exception {
        String body = "{\"lots\":" + THREE_LOTS + ",\"strategy\":\"fifo\"}";

        mockMvc.perform(post("/api/v1/schedules").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testTooManyLotsForExactSolver() throws Exception {
        String body = "{\"lots\":" + THREE_LOTS + ",\"strategy\":\"milp-opt\",\"config\":{\"milpMaxLots\":2}}";

        mockMvc.perform(post("/api/v1/schedules").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("SolverSizeLimitException"));
    }

    @Test
    public void testCompare() throws Exception {
        String body = "{\"lots\":" + THREE_LOTS + ",\"strategies\":[\"spt\",\"lpt\",\"cfs\"],\"sortBy\":\"makespan\"}";

        mockMvc.perform(post("/api/v1/schedules/compare").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sortBy").value("MAKESPAN"))
                .andExpect(jsonPath("$.results", hasSize(3)))
                .andExpect(jsonPath("$.failures", hasSize(0)));
    }

    @Test
    public void testCompareWithUnknownMetric() throws Exception {
        String body = "{\"lots\":" + THREE_LOTS + ",\"sortBy\":\"cost\"}";

        mockMvc.perform(post("/api/v1/schedules/compare").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testStrategies() throws Exception {
        mockMvc.perform(get("/api/v1/schedules/strategies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(6)));
    }
}
