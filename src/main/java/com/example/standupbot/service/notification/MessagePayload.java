package com.example.standupbot.service.notification;

import com.slack.api.model.block.LayoutBlock;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Message content handed to the outbound notifier. {@code text} is the
 * notification fallback; {@code blocks} is the rich layout, when present.
 */
@Value
@Builder
public class MessagePayload {

    String text;

    @Builder.Default
    List<LayoutBlock> blocks = List.of();

    public static MessagePayload text(String text) {
        return MessagePayload.builder().text(text).build();
    }

    public boolean hasBlocks() {
        return blocks != null && !blocks.isEmpty();
    }
}
