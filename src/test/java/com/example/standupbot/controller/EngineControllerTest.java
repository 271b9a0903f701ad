package com.example.standupbot.controller;

import com.example.standupbot.config.StandupBotProperties;
import com.example.standupbot.dto.JobRunResult;
import com.example.standupbot.service.NotificationEngineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EngineController Tests")
class EngineControllerTest {

    @Mock
    private NotificationEngineService engineService;

    private EngineController controller;

    @BeforeEach
    void setUp() {
        var properties = new StandupBotProperties();
        properties.getDispatch().setTriggerWaitSeconds(1);
        controller = new EngineController(engineService, properties);
    }

    @Nested
    @DisplayName("Manual trigger")
    class TriggerTests {

        @Test
        @DisplayName("Should answer 200 with the run result when the job finishes in time")
        void shouldReturnFinishedRun() {
            // Given
            var run = JobRunResult.builder().jobName("standup").success(true).startedAt(Instant.now()).manual(true).build();
            when(engineService.triggerNow("standup")).thenReturn(CompletableFuture.completedFuture(run));

            // When
            var response = controller.triggerJob("standup");

            // Then
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(response.getBody().getData()).isEqualTo(run);
            assertThat(response.getBody().getMessage()).isEqualTo("Job executed");
        }

        @Test
        @DisplayName("Should answer 202 instead of hanging when the dispatch thread is busy")
        void shouldStopWaitingForBusyDispatchThread() {
            // Given
            when(engineService.triggerNow("standup")).thenReturn(new CompletableFuture<>());

            // When
            var start = System.nanoTime();
            var response = controller.triggerJob("standup");
            var elapsedMs = (System.nanoTime() - start) / 1_000_000;

            // Then
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
            assertThat(response.getBody().isSuccess()).isTrue();
            assertThat(response.getBody().getMessage()).contains("still running");
            assertThat(elapsedMs).isLessThan(5_000);
        }

        @Test
        @DisplayName("Should answer 503 when the dispatch loop is shut down")
        void shouldReportShutDownLoop() {
            // Given
            when(engineService.triggerNow("standup"))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("Dispatch loop is shut down")));

            // When
            var response = controller.triggerJob("standup");

            // Then
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(response.getBody().getMessage()).isEqualTo("Dispatch loop is shut down");
        }
    }
}
