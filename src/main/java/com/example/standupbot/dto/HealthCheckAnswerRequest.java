package com.example.standupbot.dto;

import com.example.standupbot.domain.enums.HealthCheckAnswer;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A health-check button click, as forwarded by the callback handler
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckAnswerRequest {

    @NotBlank(message = "User ID is required")
    private String userId;

    @NotNull(message = "Answer is required")
    private HealthCheckAnswer answer;
}
