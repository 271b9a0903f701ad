package com.example.standupbot.service.prompt;

import com.example.standupbot.domain.enums.HealthCheckAnswer;
import com.example.standupbot.service.notification.MessagePayload;
import com.slack.api.model.block.ActionsBlock;
import com.slack.api.model.block.DividerBlock;
import com.slack.api.model.block.LayoutBlock;
import com.slack.api.model.block.SectionBlock;
import com.slack.api.model.block.composition.MarkdownTextObject;
import com.slack.api.model.block.composition.PlainTextObject;
import com.slack.api.model.block.element.BlockElement;
import com.slack.api.model.block.element.ButtonElement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Slack messages sent by the prompt jobs and the reminder escalator.
 */
public final class PromptMessages {

    /**
     * Action id of the "Check in" button on the standup DM; its value is the standup thread id
     */
    public static final String STANDUP_CHECKIN_ACTION = "standup_checkin";

    private PromptMessages() {
    }

    public static MessagePayload standupAnnouncement() {
        var text = """
                :sunny: *Good morning team! Time for the daily standup!*

                Reply in this thread with:
                • *Today:* what you are working on
                • *On track:* yes / no
                • *Blockers:* anything in your way

                A reaction works too: :white_check_mark: all good, :warning: minor issues, :rotating_light: need help.""";
        return MessagePayload.builder()
                .text("Daily Standup - reply in this thread with your update")
                .blocks(List.of(section(text)))
                .build();
    }

    /**
     * Direct standup prompt. When the team thread exists, the check-in button carries its id.
     */
    public static MessagePayload standupDirectPrompt(String threadId) {
        var blocks = new ArrayList<LayoutBlock>();
        blocks.add(section(":wave: *Daily Standup*\nWhat are you working on today, and is anything blocking you?"));
        if (threadId != null) {
            blocks.add(actions(button(STANDUP_CHECKIN_ACTION, ":memo: Check in", threadId)));
        }
        return MessagePayload.builder()
                .text("Daily Standup")
                .blocks(blocks)
                .build();
    }

    public static MessagePayload healthCheckPrompt() {
        var buttons = Arrays.stream(HealthCheckAnswer.values())
                .map(answer -> (BlockElement) button(answer.getCode(), answer.getLabel(), answer.getCode()))
                .toList();
        return MessagePayload.builder()
                .text("Daily Health Check")
                .blocks(List.of(
                        section(":wave: *Daily Health Check*\nHow are you feeling today?"),
                        ActionsBlock.builder().elements(buttons).build()))
                .build();
    }

    /**
     * Thread reminder naming everyone who has not answered yet
     */
    public static MessagePayload threadReminder(List<String> pendingUsers) {
        var text = ":alarm_clock: *Reminder: please respond to the daily standup!*\n\n"
                + "Still waiting on: " + mentions(pendingUsers) + "\n"
                + "React to the main message with your status or reply in this thread with your update.";
        return MessagePayload.builder()
                .text("Reminder: please respond to the daily standup")
                .blocks(List.of(section(text)))
                .build();
    }

    public static MessagePayload missingResponseReminder(String userId) {
        return MessagePayload.text("<@" + userId + "> Don't forget to respond to today's standup! :memo:");
    }

    public static MessagePayload escalationNotice(String threadId, List<String> pendingUsers) {
        var text = ":rotating_light: *Standup still incomplete*\n"
                + pendingUsers.size() + " teammate(s) have not answered thread " + threadId + ": " + mentions(pendingUsers);
        return MessagePayload.builder()
                .text("Standup still incomplete")
                .blocks(List.of(section(text), DividerBlock.builder().build()))
                .build();
    }

    private static String mentions(List<String> userIds) {
        return userIds.stream()
                .map(id -> "<@" + id + ">")
                .collect(Collectors.joining(", "));
    }

    private static SectionBlock section(String markdown) {
        return SectionBlock.builder()
                .text(MarkdownTextObject.builder().text(markdown).build())
                .build();
    }

    private static ActionsBlock actions(BlockElement... elements) {
        return ActionsBlock.builder().elements(List.of(elements)).build();
    }

    private static ButtonElement button(String actionId, String label, String value) {
        return ButtonElement.builder()
                .actionId(actionId)
                .text(PlainTextObject.builder().text(label).emoji(true).build())
                .value(value)
                .build();
    }
}
