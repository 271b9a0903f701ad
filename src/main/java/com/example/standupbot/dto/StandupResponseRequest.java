package com.example.standupbot.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user's answer to a standup thread, as forwarded by the callback handler
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StandupResponseRequest {

    @NotBlank(message = "Thread ID is required")
    private String threadId;

    @NotBlank(message = "User ID is required")
    private String userId;
}
