package com.example.standupbot.service.alert;

import com.example.standupbot.config.SlackProperties;
import com.example.standupbot.service.notification.BroadcastResult;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

/**
 * Sends operator alerts to the ops channel through a Slack incoming webhook.
 * <p>
 * Alerts run asynchronously so the dispatch thread never waits on them. End
 * users never see these messages.
 */
@Slf4j
@Service
public class OperatorAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;
    private final Clock clock;

    @Value("${spring.application.name:standup-bot}")
    private String applicationName = "standup-bot";

    public OperatorAlertService(SlackProperties slackProperties, Slack slack, Clock clock) {
        this.slackProperties = slackProperties;
        this.slack = slack;
        this.clock = clock;
    }

    /**
     * Alert for a scheduled job whose action threw
     */
    @Async
    public void sendJobFailureAlert(String jobName, Exception error) {
        if (!slackProperties.isWebhookConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Job {} failed but no alert was sent.", jobName);
            return;
        }

        var payload = Payload.builder()
                .channel(slackProperties.getAlertChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Scheduled job failed*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title("Job: " + jobName)
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Error Type")
                                                .value(error.getClass().getSimpleName())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Error")
                                                .value("```" + truncate(error.getMessage(), 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | The job runs again at its next scheduled time")
                                .ts(String.valueOf(clock.instant().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "job failure " + jobName);
    }

    /**
     * Alert for a broadcast in which no user could be reached
     */
    @Async
    public void sendBroadcastFailureAlert(BroadcastResult result) {
        if (!slackProperties.isWebhookConfigured()) {
            log.warn("Slack alerting disabled. Broadcast failure alert not sent for {}", result.getPurpose());
            return;
        }

        var payload = Payload.builder()
                .channel(slackProperties.getAlertChannel())
                .username(applicationName)
                .iconEmoji(":warning:")
                .text(":warning: *Broadcast reached nobody*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("warning")
                                .text("Every send of " + result.getPurpose() + " failed.")
                                .fields(List.of(
                                        Field.builder()
                                                .title("Attempted")
                                                .value(String.valueOf(result.getAttempted()))
                                                .valueShortEnough(true)
                                                .build()
                                ))
                                .footer(applicationName)
                                .ts(String.valueOf(clock.instant().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "broadcast failure " + result.getPurpose());
    }

    private void send(Payload payload, String what) {
        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert for {}. Response code: {}, body: {}", what, response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for {}", what);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for {}: {}", what, e.getMessage(), e);
        }
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
