package com.example.standupbot.service.scheduler;

import com.example.standupbot.config.MetricsConfig;
import com.example.standupbot.config.StandupBotProperties;
import com.example.standupbot.domain.model.JobTrigger;
import com.example.standupbot.exception.JobNotFoundException;
import com.example.standupbot.service.alert.OperatorAlertService;
import com.example.standupbot.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DispatchLoop Tests")
class DispatchLoopTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Berlin");

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private OperatorAlertService alertService;

    private MutableClock clock;
    private JobRegistry registry;
    private StandupBotProperties properties;
    private ScheduledExecutorService executor;
    private DispatchLoop dispatchLoop;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(LocalDateTime.of(2024, 3, 12, 8, 0), ZONE);
        registry = new JobRegistry(clock);
        properties = new StandupBotProperties();
        executor = Executors.newSingleThreadScheduledExecutor();
        dispatchLoop = new DispatchLoop(registry, metricsConfig, alertService, properties, executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("runDueJobs Tests")
    class RunDueJobsTests {

        @ParameterizedTest(name = "tick every {0}s")
        @ValueSource(longs = {1, 17, 60, 301, 3600})
        @DisplayName("Should fire each fixed-time job exactly once per day across midnight")
        void shouldFireExactlyOncePerDay(long tickSeconds) {
            Map<String, List<LocalDate>> runs = new HashMap<>();
            for (var entry : Map.of("daily-reset", LocalTime.MIDNIGHT,
                    "standup", LocalTime.of(9, 0),
                    "evening", LocalTime.of(22, 45)).entrySet()) {
                var name = entry.getKey();
                runs.put(name, new ArrayList<>());
                registry.register(name, JobTrigger.dailyAt(entry.getValue()),
                        () -> runs.get(name).add(LocalDate.now(clock)));
            }

            clock.setTo(LocalDateTime.of(2024, 3, 12, 0, 0));
            var end = LocalDateTime.of(2024, 3, 14, 0, 0).atZone(ZONE).toInstant();
            while (clock.instant().isBefore(end)) {
                dispatchLoop.runDueJobs(clock.instant());
                clock.advance(Duration.ofSeconds(tickSeconds));
            }

            var expectedDays = List.of(LocalDate.of(2024, 3, 12), LocalDate.of(2024, 3, 13));
            assertThat(runs.get("daily-reset")).isEqualTo(expectedDays);
            assertThat(runs.get("standup")).isEqualTo(expectedDays);
            assertThat(runs.get("evening")).isEqualTo(expectedDays);
        }

        @Test
        @DisplayName("Should run remaining jobs when one job fails")
        void shouldIsolateFailures() {
            var ran = new CopyOnWriteArrayList<String>();
            var failing = registry.register("failing", JobTrigger.dailyAt(LocalTime.of(9, 0)), () -> {
                ran.add("failing");
                throw new IllegalStateException("boom");
            });
            registry.register("healthy", JobTrigger.dailyAt(LocalTime.of(9, 0)), () -> ran.add("healthy"));

            clock.setTo(LocalDateTime.of(2024, 3, 12, 9, 0));
            var invoked = dispatchLoop.runDueJobs(clock.instant());

            assertThat(invoked).isEqualTo(2);
            assertThat(ran).containsExactly("failing", "healthy");
            assertThat(failing.getFailureCount()).isEqualTo(1);
            assertThat(failing.getLastRunDate()).isEqualTo(LocalDate.of(2024, 3, 12));
            verify(metricsConfig).recordJobFailure("failing", "IllegalStateException");
            verify(alertService).sendJobFailureAlert(eq("failing"), any(IllegalStateException.class));
            verify(metricsConfig).recordJobExecution(any(), eq("healthy"), eq(true));
        }

        @Test
        @DisplayName("Should not retry a failed job within the same day")
        void shouldNotRetryFailedJobSameDay() {
            var attempts = new CopyOnWriteArrayList<String>();
            registry.register("failing", JobTrigger.dailyAt(LocalTime.of(9, 0)), () -> {
                attempts.add("attempt");
                throw new IllegalStateException("boom");
            });

            clock.setTo(LocalDateTime.of(2024, 3, 12, 9, 0));
            dispatchLoop.runDueJobs(clock.instant());
            clock.advance(Duration.ofMinutes(1));
            dispatchLoop.runDueJobs(clock.instant());

            assertThat(attempts).hasSize(1);
        }

        @Test
        @DisplayName("Should keep ticking when the tick itself fails")
        void tickShouldNeverThrow() {
            registry.register("standup", JobTrigger.dailyAt(LocalTime.of(9, 0)), () -> { });
            when(metricsConfig.startJobTimer()).thenThrow(new IllegalStateException("registry closed"));
            clock.setTo(LocalDateTime.of(2024, 3, 12, 9, 0));

            dispatchLoop.tick();

            verify(metricsConfig).startJobTimer();
        }
    }

    @Nested
    @DisplayName("Lifecycle Tests")
    class LifecycleTests {

        @Mock
        private ScheduledExecutorService idleExecutor;

        @Test
        @DisplayName("Should start no further job once stop was requested")
        void shouldStopBetweenJobs() {
            var loop = new DispatchLoop(registry, metricsConfig, alertService, properties, idleExecutor, clock);
            var ran = new CopyOnWriteArrayList<String>();
            registry.register("first", JobTrigger.dailyAt(LocalTime.of(9, 0)), () -> {
                ran.add("first");
                loop.stop();
            });
            registry.register("second", JobTrigger.dailyAt(LocalTime.of(9, 0)), () -> ran.add("second"));

            loop.start();
            assertThat(loop.isRunning()).isTrue();

            clock.setTo(LocalDateTime.of(2024, 3, 12, 9, 0));
            var invoked = loop.runDueJobs(clock.instant());

            assertThat(invoked).isEqualTo(1);
            assertThat(ran).containsExactly("first");
            assertThat(loop.isRunning()).isFalse();
            assertThat(registry.find("second").orElseThrow().getRunCount()).isZero();
            verify(idleExecutor).shutdown();
        }

        @Test
        @DisplayName("Should follow the auto-start property")
        void shouldFollowAutoStartProperty() {
            assertThat(dispatchLoop.isAutoStartup()).isTrue();

            properties.getDispatch().setAutoStart(false);

            assertThat(dispatchLoop.isAutoStartup()).isFalse();
        }
    }

    @Nested
    @DisplayName("triggerNow Tests")
    class TriggerNowTests {

        @Test
        @DisplayName("Should run the job without touching its schedule")
        void shouldRunWithoutBookkeeping() throws Exception {
            var ran = new CopyOnWriteArrayList<String>();
            var job = registry.register("standup", JobTrigger.dailyAt(LocalTime.of(9, 0)), () -> ran.add(Thread.currentThread().getName()));

            var result = dispatchLoop.triggerNow("standup").get(5, TimeUnit.SECONDS);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isManual()).isTrue();
            assertThat(result.getJobName()).isEqualTo("standup");
            assertThat(ran).hasSize(1);
            assertThat(job.getRunCount()).isZero();
            assertThat(job.getLastRunDate()).isNull();
        }

        @Test
        @DisplayName("Should report the failure of a manually triggered job")
        void shouldReportFailure() throws Exception {
            registry.register("health-check", JobTrigger.dailyAt(LocalTime.of(9, 0)), () -> {
                throw new IllegalStateException("no users");
            });

            var result = dispatchLoop.triggerNow("health-check").get(5, TimeUnit.SECONDS);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrorMessage()).isEqualTo("no users");
        }

        @Test
        @DisplayName("Should reject an unknown job name")
        void shouldRejectUnknownJob() {
            assertThatThrownBy(() -> dispatchLoop.triggerNow("retro"))
                    .isInstanceOf(JobNotFoundException.class);
        }

        @Test
        @DisplayName("Should return a failed future after shutdown")
        void shouldFailAfterShutdown() {
            registry.register("standup", JobTrigger.dailyAt(LocalTime.of(9, 0)), () -> { });
            executor.shutdown();

            var future = dispatchLoop.triggerNow("standup");

            assertThat(future).isCompletedExceptionally();
        }
    }

    @Nested
    @DisplayName("submit Tests")
    class SubmitTests {

        @Test
        @DisplayName("Should apply events on the dispatch thread")
        void shouldApplyEvents() throws Exception {
            var threads = new CopyOnWriteArrayList<String>();

            var accepted = dispatchLoop.submit("test event", () -> threads.add(Thread.currentThread().getName()));
            executor.submit(() -> { }).get(5, TimeUnit.SECONDS);

            assertThat(accepted).isTrue();
            assertThat(threads).hasSize(1);
            assertThat(threads.get(0)).isNotEqualTo(Thread.currentThread().getName());
        }

        @Test
        @DisplayName("Should drop events once shut down")
        void shouldDropEventsAfterShutdown() {
            executor.shutdown();

            assertThat(dispatchLoop.submit("late event", () -> { })).isFalse();
            verify(alertService, never()).sendJobFailureAlert(any(), any());
        }
    }
}
