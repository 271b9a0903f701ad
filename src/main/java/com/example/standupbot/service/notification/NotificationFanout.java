package com.example.standupbot.service.notification;

import com.example.standupbot.config.MetricsConfig;
import com.example.standupbot.config.StandupBotProperties;
import com.example.standupbot.service.alert.OperatorAlertService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.function.Function;

/**
 * Best-effort broadcast of a prompt to many users, one direct message each.
 * <p>
 * A failed send is logged and counted, and the remaining users are still tried.
 * Sends are paced by {@code send-pacing-ms} to stay under Slack's rate limits.
 */
@Slf4j
@Service
public class NotificationFanout {

    private final OutboundNotifier notifier;
    private final MetricsConfig metricsConfig;
    private final OperatorAlertService alertService;
    private final long pacingMs;

    public NotificationFanout(OutboundNotifier notifier, MetricsConfig metricsConfig,
                              OperatorAlertService alertService, StandupBotProperties properties) {
        this.notifier = notifier;
        this.metricsConfig = metricsConfig;
        this.alertService = alertService;
        this.pacingMs = properties.getSendPacingMs();
    }

    public BroadcastResult broadcast(Collection<String> userIds, String purpose, MessagePayload payload) {
        return broadcast(userIds, purpose, userId -> payload);
    }

    /**
     * Send {@code payloadFor(user)} to every user.
     *
     * @return attempted and successful send counts
     */
    public BroadcastResult broadcast(Collection<String> userIds, String purpose, Function<String, MessagePayload> payloadFor) {
        if (userIds == null || userIds.isEmpty()) {
            log.info("No users to send {} to", purpose);
            return BroadcastResult.empty(purpose);
        }

        var attempted = 0;
        var succeeded = 0;
        for (var userId : userIds) {
            if (attempted > 0 && !pause()) {
                log.warn("{} broadcast interrupted after {} of {} users", purpose, attempted, userIds.size());
                break;
            }
            attempted++;
            if (sendOne(userId, purpose, payloadFor)) {
                succeeded++;
            }
        }

        var result = new BroadcastResult(purpose, attempted, succeeded);
        log.info("{} sent to {} of {} users", purpose, succeeded, attempted);
        if (result.isTotalFailure()) {
            alertService.sendBroadcastFailureAlert(result);
        }
        return result;
    }

    private boolean sendOne(String userId, String purpose, Function<String, MessagePayload> payloadFor) {
        try {
            var result = notifier.sendToUser(userId, payloadFor.apply(userId));
            metricsConfig.recordDelivery(purpose, result.isSuccess());
            if (!result.isSuccess()) {
                log.warn("Could not send {} to {}: {} ({})", purpose, userId, result.getErrorMessage(), result.getErrorType());
            }
            return result.isSuccess();
        } catch (Exception e) {
            metricsConfig.recordDelivery(purpose, false);
            log.error("Error sending {} to {}: {}", purpose, userId, e.getMessage(), e);
            return false;
        }
    }

    private boolean pause() {
        if (pacingMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(pacingMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
