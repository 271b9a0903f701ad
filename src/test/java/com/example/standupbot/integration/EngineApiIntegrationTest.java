package com.example.standupbot.integration;

import com.example.standupbot.domain.enums.HealthCheckAnswer;
import com.example.standupbot.dto.HealthCheckAnswerRequest;
import com.example.standupbot.dto.StandupResponseRequest;
import com.example.standupbot.service.directory.UserDirectory;
import com.example.standupbot.service.prompt.PromptMessages;
import com.example.standupbot.service.tracker.DailyPromptTracker;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slack.api.model.block.ActionsBlock;
import com.slack.api.model.block.element.ButtonElement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Engine API Integration Tests")
class EngineApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private UserDirectory userDirectory;

    @SpyBean
    private DailyPromptTracker tracker;

    @Nested
    @DisplayName("Jobs API")
    class JobsApiTests {

        @Test
        @DisplayName("Should list the registered prompt jobs in order")
        void shouldListJobs() throws Exception {
            mockMvc.perform(get("/api/v1/engine/jobs"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data", hasSize(5)))
                    .andExpect(jsonPath("$.data[0].name").value("daily-reset"))
                    .andExpect(jsonPath("$.data[1].schedule").value("daily at 09:00"))
                    .andExpect(jsonPath("$.data[3].name").value("missing-response-reminder"))
                    .andExpect(jsonPath("$.data[4].triggerType").value("FIXED_INTERVAL"));
        }

        @Test
        @DisplayName("Should run a job on demand")
        void shouldTriggerJob() throws Exception {
            mockMvc.perform(post("/api/v1/engine/jobs/daily-reset/trigger"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.jobName").value("daily-reset"))
                    .andExpect(jsonPath("$.data.success").value(true))
                    .andExpect(jsonPath("$.data.manual").value(true));
        }

        @Test
        @DisplayName("Should send nothing when the directory has no users")
        void shouldTriggerHealthCheckWithoutUsers() throws Exception {
            when(userDirectory.listActiveUsers()).thenReturn(List.of());

            mockMvc.perform(post("/api/v1/engine/jobs/health-check/trigger"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.success").value(true));

            mockMvc.perform(get("/api/v1/engine/summary"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.prompts.HEALTH_CHECK").value(false));
        }

        @Test
        @DisplayName("Should return 404 for an unknown job")
        void shouldReturn404ForUnknownJob() throws Exception {
            mockMvc.perform(post("/api/v1/engine/jobs/retro/trigger"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.message").value("Job not found: retro"));
        }
    }

    @Nested
    @DisplayName("Responses API")
    class ResponsesApiTests {

        @Test
        @DisplayName("Should hand a standup response to the tracker")
        void shouldAcceptStandupResponse() throws Exception {
            var request = StandupResponseRequest.builder().threadId("1710234000.000100").userId("U1").build();

            mockMvc.perform(post("/api/v1/engine/responses/standup")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.success").value(true));

            verify(tracker, timeout(2000)).recordResponse("1710234000.000100", "U1");
        }

        @Test
        @DisplayName("Should reject a response without a user")
        void shouldRejectInvalidResponse() throws Exception {
            var request = StandupResponseRequest.builder().threadId("1710234000.000100").userId(" ").build();

            mockMvc.perform(post("/api/v1/engine/responses/standup")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Validation failed"))
                    .andExpect(jsonPath("$.errors", hasSize(1)));
        }

        @Test
        @DisplayName("Should hand a health-check answer to the tracker")
        void shouldAcceptHealthCheckAnswer() throws Exception {
            var request = HealthCheckAnswerRequest.builder().userId("U2").answer(HealthCheckAnswer.NOT_GREAT).build();

            mockMvc.perform(post("/api/v1/engine/responses/health-check")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isAccepted());

            verify(tracker, timeout(2000)).recordHealthCheckAnswer("U2", HealthCheckAnswer.NOT_GREAT);
        }

        @Test
        @DisplayName("Should accept the value sent by the health-check button")
        void shouldAcceptButtonValue() throws Exception {
            // Given
            var actions = (ActionsBlock) PromptMessages.healthCheckPrompt().getBlocks().get(1);
            var buttonValue = ((ButtonElement) actions.getElements().get(2)).getValue();

            // When / Then
            mockMvc.perform(post("/api/v1/engine/responses/health-check")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"userId\":\"U3\",\"answer\":\"" + buttonValue + "\"}"))
                    .andExpect(status().isAccepted());

            verify(tracker, timeout(2000)).recordHealthCheckAnswer("U3", HealthCheckAnswer.NOT_GREAT);
        }

        @Test
        @DisplayName("Should reject an unknown answer")
        void shouldRejectUnknownAnswer() throws Exception {
            mockMvc.perform(post("/api/v1/engine/responses/health-check")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"userId\":\"U2\",\"answer\":\"MEH\"}"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("Summary API")
    class SummaryApiTests {

        @Test
        @DisplayName("Should report an untracked day as empty")
        void shouldReportOtherDayAsEmpty() throws Exception {
            mockMvc.perform(get("/api/v1/engine/summary").param("date", "2020-01-01"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.date").value("2020-01-01"))
                    .andExpect(jsonPath("$.data.activeStandups").value(0))
                    .andExpect(jsonPath("$.data.prompts.STANDUP").value(false));
        }

        @Test
        @DisplayName("Should reject a malformed date")
        void shouldRejectMalformedDate() throws Exception {
            mockMvc.perform(get("/api/v1/engine/summary").param("date", "yesterday"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should report healthy")
        void shouldReportHealthy() throws Exception {
            mockMvc.perform(get("/api/v1/engine/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data").value("OK"));
        }
    }
}
