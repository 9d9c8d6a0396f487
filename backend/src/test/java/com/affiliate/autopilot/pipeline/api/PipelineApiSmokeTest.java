package com.affiliate.autopilot.pipeline.api;

import com.affiliate.autopilot.pipeline.model.ActionType;
import com.affiliate.autopilot.pipeline.model.NewOpportunity;
import com.affiliate.autopilot.pipeline.model.ThreadIntent;
import com.affiliate.autopilot.pipeline.persistence.KeywordRepository;
import com.affiliate.autopilot.pipeline.persistence.OpportunityRepository;
import com.affiliate.autopilot.pipeline.persistence.ScheduledPostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.time.Instant;
import java.util.UUID;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PipelineApiSmokeTest {

    @Autowired
    private WebApplicationContext context;
    @Autowired
    private ScheduledPostRepository postRepository;
    @Autowired
    private KeywordRepository keywordRepository;
    @Autowired
    private OpportunityRepository opportunityRepository;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void scheduleListAndCancelPost() throws Exception {
        long id = postRepository.insertDraft(null, "fitness", "Tracker roundup", "Body", "text");
        int postId = (int) id;

        mockMvc.perform(post("/api/posts/{id}/schedule", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"scheduledTime\":\"2030-01-01T10:00:00Z\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.postId").value(postId))
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.scheduledTime").value("2030-01-01T10:00:00Z"));

        mockMvc.perform(get("/api/scheduled-posts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].id").value(hasItem(postId)));

        mockMvc.perform(post("/api/posts/{id}/cancel-schedule", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(post("/api/posts/{id}/cancel-schedule", id))
            .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/scheduled-posts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].id").value(not(hasItem(postId))));
    }

    @Test
    void schedulingRequiresKnownPostAndTime() throws Exception {
        mockMvc.perform(post("/api/posts/{id}/schedule", 987654)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"scheduledTime\":\"2030-01-01T10:00:00Z\"}"))
            .andExpect(status().isNotFound());

        long id = postRepository.insertDraft(null, "fitness", "No time", "Body", "text");
        mockMvc.perform(post("/api/posts/{id}/schedule", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void campaignSchedulingForUnknownCampaignIs404() throws Exception {
        mockMvc.perform(post("/api/campaigns/{id}/schedule-posts", 987654)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"postIds\":[1,2]}"))
            .andExpect(status().isNotFound());
    }

    @Test
    void illegalStatusChangeIsAConflict() throws Exception {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        long keywordId = keywordRepository.insert("kettlebell " + suffix, "active", null, null);
        long id = opportunityRepository.insert(new NewOpportunity(
            keywordId,
            "kettlebell " + suffix,
            "https://www.reddit.com/r/homegym/comments/" + suffix + "/kettlebell/",
            "Which kettlebell should I get?",
            "Starting out",
            "homegym",
            2,
            ThreadIntent.QUESTION,
            65,
            ActionType.COMMENT,
            null
        ), Instant.parse("2024-03-04T12:00:00Z"));

        mockMvc.perform(patch("/api/opportunities/{id}/status", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"ignored\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ignored"));

        mockMvc.perform(patch("/api/opportunities/{id}/status", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"queued\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("illegal_transition"));

        mockMvc.perform(patch("/api/opportunities/{id}/status", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"bogus\"}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(patch("/api/opportunities/{id}/status", 987654)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"ignored\"}"))
            .andExpect(status().isNotFound());
    }

    @Test
    void rateLimitAndSchedulerStatusAreExposed() throws Exception {
        mockMvc.perform(get("/api/rate-limit"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.limit").value(100))
            .andExpect(jsonPath("$.resetTime").isNotEmpty())
            .andExpect(jsonPath("$.remainingPercent").isNumber());

        mockMvc.perform(get("/api/scheduler/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false))
            .andExpect(jsonPath("$.rateLimit.limit").value(100));
    }

    @Test
    void rankingForUnknownCampaignIs404() throws Exception {
        mockMvc.perform(get("/api/opportunities/rank/{campaignId}", 987654))
            .andExpect(status().isNotFound());
    }

    @Test
    void listRejectsUnknownStatus() throws Exception {
        mockMvc.perform(get("/api/opportunities").param("status", "archived"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/opportunities/top"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }
}
