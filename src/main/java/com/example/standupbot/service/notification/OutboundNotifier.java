package com.example.standupbot.service.notification;

/**
 * The only way the engine produces user-visible side effects.
 * <p>
 * Implementations report failures through {@link DeliveryResult} and are safe
 * to call repeatedly for different users in any order.
 */
public interface OutboundNotifier {

    /**
     * Send a direct message to a user
     */
    DeliveryResult sendToUser(String userId, MessagePayload payload);

    /**
     * Reply in a standup thread of the team channel
     *
     * @param threadId timestamp of the thread's parent message
     */
    DeliveryResult sendToThread(String threadId, MessagePayload payload);

    /**
     * Post a top-level message to a channel; a successful result carries the message timestamp
     */
    DeliveryResult sendToChannel(String channelId, MessagePayload payload);
}
