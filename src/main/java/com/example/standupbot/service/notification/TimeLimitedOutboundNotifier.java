package com.example.standupbot.service.notification;

import com.example.standupbot.config.MetricsConfig;
import com.example.standupbot.config.StandupBotProperties;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounds every outbound call with the {@code slackNotifier} time limiter.
 * <p>
 * The call runs on the notifier pool while the caller waits at most the
 * limiter's timeout. When no {@code resilience4j.timelimiter} instance is
 * configured the limit is {@code send-timeout-seconds}. A timeout, an exception
 * or a rejected call all come back as a failed {@link DeliveryResult}, so a hung
 * Slack request never stalls the dispatch thread.
 */
@Slf4j
@Primary
@Component
public class TimeLimitedOutboundNotifier implements OutboundNotifier {

    static final String TIME_LIMITER_NAME = "slackNotifier";

    private final OutboundNotifier delegate;
    private final ExecutorService notifierCallExecutor;
    private final MetricsConfig metricsConfig;
    private final TimeLimiter timeLimiter;

    public TimeLimitedOutboundNotifier(@Qualifier("slackOutboundNotifier") OutboundNotifier delegate,
                                       @Qualifier("notifierCallExecutor") ExecutorService notifierCallExecutor,
                                       MetricsConfig metricsConfig,
                                       TimeLimiterRegistry timeLimiterRegistry,
                                       StandupBotProperties properties) {
        this.delegate = delegate;
        this.notifierCallExecutor = notifierCallExecutor;
        this.metricsConfig = metricsConfig;
        this.timeLimiter = timeLimiterRegistry.timeLimiter(TIME_LIMITER_NAME, TimeLimiterConfig.custom()
                .timeoutDuration(properties.sendTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    @Override
    public DeliveryResult sendToUser(String userId, MessagePayload payload) {
        return call("DM to " + userId, () -> delegate.sendToUser(userId, payload));
    }

    @Override
    public DeliveryResult sendToThread(String threadId, MessagePayload payload) {
        return call("reply in thread " + threadId, () -> delegate.sendToThread(threadId, payload));
    }

    @Override
    public DeliveryResult sendToChannel(String channelId, MessagePayload payload) {
        return call("post to " + channelId, () -> delegate.sendToChannel(channelId, payload));
    }

    private DeliveryResult call(String what, Supplier<DeliveryResult> send) {
        var result = invoke(what, send);
        if (!result.isSuccess()) {
            metricsConfig.recordDeliveryFailure(result.getErrorType());
        }
        return result;
    }

    private DeliveryResult invoke(String what, Supplier<DeliveryResult> send) {
        try {
            var result = timeLimiter.executeFutureSupplier(() -> notifierCallExecutor.submit(send::get));
            return result != null ? result : DeliveryResult.failure("Notifier returned no result", "NO_RESULT");
        } catch (TimeoutException e) {
            var timeout = timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
            log.warn("Timed out after {}ms waiting for {}", timeout.toMillis(), what);
            return DeliveryResult.timeout(timeout.toMillis());
        } catch (RejectedExecutionException e) {
            log.error("Notifier pool rejected {}: {}", what, e.getMessage());
            return DeliveryResult.failure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {}", what);
            return DeliveryResult.failure(e);
        } catch (Exception e) {
            log.warn("Error during {}: {}", what, e.getMessage(), e);
            return DeliveryResult.failure(e);
        }
    }
}
