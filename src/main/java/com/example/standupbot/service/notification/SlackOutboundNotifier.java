package com.example.standupbot.service.notification;

import com.example.standupbot.config.SlackProperties;
import com.example.standupbot.exception.TransportException;
import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Slack Web API transport.
 * <p>
 * Direct messages open (or reuse) the user's DM conversation first. Thread
 * replies go to the configured standup channel. No call is made while Slack is
 * disabled or the bot token is missing.
 */
@Slf4j
@Component("slackOutboundNotifier")
public class SlackOutboundNotifier implements OutboundNotifier {

    private final Slack slack;
    private final SlackProperties slackProperties;

    public SlackOutboundNotifier(Slack slack, SlackProperties slackProperties) {
        this.slack = slack;
        this.slackProperties = slackProperties;
    }

    @Override
    public DeliveryResult sendToUser(String userId, MessagePayload payload) {
        if (!isEnabled()) {
            return disabled("DM to " + userId);
        }
        try {
            var methods = methods();
            var dmChannel = openDirectMessage(methods, userId);
            return post(methods, dmChannel, null, payload);
        } catch (TransportException e) {
            return failed("DM to " + userId, e);
        }
    }

    @Override
    public DeliveryResult sendToThread(String threadId, MessagePayload payload) {
        if (!isEnabled()) {
            return disabled("reply in thread " + threadId);
        }
        try {
            return post(methods(), slackProperties.getChannelId(), threadId, payload);
        } catch (TransportException e) {
            return failed("reply in thread " + threadId, e);
        }
    }

    @Override
    public DeliveryResult sendToChannel(String channelId, MessagePayload payload) {
        if (!isEnabled()) {
            return disabled("post to " + channelId);
        }
        try {
            return post(methods(), channelId, null, payload);
        } catch (TransportException e) {
            return failed("post to " + channelId, e);
        }
    }

    private String openDirectMessage(MethodsClient methods, String userId) {
        try {
            var response = methods.conversationsOpen(r -> r.users(List.of(userId)));
            if (!response.isOk()) {
                throw new TransportException("conversations.open", response.getError());
            }
            return response.getChannel().getId();
        } catch (IOException | SlackApiException e) {
            throw new TransportException("conversations.open", e);
        }
    }

    private DeliveryResult post(MethodsClient methods, String channel, String threadTs, MessagePayload payload) {
        try {
            var response = methods.chatPostMessage(r -> {
                r.channel(channel).text(payload.getText());
                if (payload.hasBlocks()) {
                    r.blocks(payload.getBlocks());
                }
                if (threadTs != null) {
                    r.threadTs(threadTs);
                }
                return r;
            });
            if (!response.isOk()) {
                throw new TransportException("chat.postMessage", response.getError());
            }
            log.debug("Posted message {} to {}", response.getTs(), channel);
            return DeliveryResult.success(response.getTs());
        } catch (IOException | SlackApiException e) {
            throw new TransportException("chat.postMessage", e);
        }
    }

    private MethodsClient methods() {
        return slack.methods(slackProperties.getBotToken());
    }

    private boolean isEnabled() {
        return slackProperties.isEnabled()
                && slackProperties.getBotToken() != null
                && !slackProperties.getBotToken().isBlank();
    }

    private DeliveryResult failed(String what, TransportException e) {
        log.warn("Slack call failed for {}: {}", what, e.getMessage());
        var errorType = e.getSlackError() != null ? e.getSlackError() : e.getClass().getSimpleName();
        return DeliveryResult.failure(e.getMessage(), errorType);
    }

    private DeliveryResult disabled(String what) {
        log.warn("Slack delivery is disabled or bot token not configured, skipped {}", what);
        return DeliveryResult.failure("Slack delivery disabled", DeliveryResult.DISABLED);
    }
}
