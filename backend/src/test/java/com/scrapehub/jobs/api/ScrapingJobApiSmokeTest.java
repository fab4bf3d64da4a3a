package com.scrapehub.jobs.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.Map;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ScrapingJobApiSmokeTest {
    private static final String YEARLY = "0 0 1 1 *";

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void createdJobGetsATrigger() throws Exception {
        String id = createJob("u-smoke", YEARLY);

        mockMvc.perform(get("/api/jobs/" + id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cronSchedule").value(YEARLY));

        mockMvc.perform(get("/api/scheduler/triggers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].jobId").value(hasItem(id)));

        mockMvc.perform(get("/api/scheduler/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.timeZone").value("America/New_York"))
            .andExpect(jsonPath("$.lastResult.status").value("COMPLETED"));
    }

    @Test
    void invalidScheduleIsRejected() throws Exception {
        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("u-smoke", "every five minutes")))
            .andExpect(status().isBadRequest());
    }

    @Test
    void updateChangesSchedule() throws Exception {
        String id = createJob("u-smoke", YEARLY);

        mockMvc.perform(put("/api/jobs/" + id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("u-smoke", "0 0 2 1 *")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cronSchedule").value("0 0 2 1 *"));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/jobs/does-not-exist"))
            .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/jobs/does-not-exist/run"))
            .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/jobs/does-not-exist"))
            .andExpect(status().isNotFound());
    }

    @Test
    void latestIsNotFoundBeforeFirstSuccessAndDeleteRemovesJob() throws Exception {
        String id = createJob("u-smoke", YEARLY);

        mockMvc.perform(get("/api/jobs/" + id + "/latest"))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/jobs/" + id + "/history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(delete("/api/jobs/" + id))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/jobs/" + id))
            .andExpect(status().isNotFound());
    }

    @Test
    void manualReconcileReturnsResult() throws Exception {
        mockMvc.perform(post("/api/scheduler/reconcile"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.reason").value("manual"));
    }

    private String createJob(String userId, String cron) throws Exception {
        String response = mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(userId, cron)))
            .andExpect(status().isCreated())
            .andReturn()
            .getResponse()
            .getContentAsString();
        JsonNode created = objectMapper.readTree(response);
        return created.get("id").asText();
    }

    private String body(String userId, String cron) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
            "userId", userId,
            "href", "https://example.com/news",
            "selector", "h2.title",
            "description", "headlines",
            "cronSchedule", cron
        ));
    }
}
