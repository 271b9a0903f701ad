package com.example.standupbot.service.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts of a best-effort broadcast. Per-user errors are only logged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastResult {

    private String purpose;
    private int attempted;
    private int succeeded;

    public static BroadcastResult empty(String purpose) {
        return new BroadcastResult(purpose, 0, 0);
    }

    public int getFailed() {
        return attempted - succeeded;
    }

    public boolean isTotalFailure() {
        return attempted > 0 && succeeded == 0;
    }
}
