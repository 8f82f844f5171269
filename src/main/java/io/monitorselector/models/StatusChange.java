package io.monitorselector.models;

import io.monitorselector.enums.ServerScoreStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A planned transition of one assignment row.
 */
@Data
@AllArgsConstructor
public class StatusChange {

    private long monitorId;

    private ServerScoreStatus fromStatus;

    private ServerScoreStatus toStatus;

    private String reason;

    public boolean isDemotionFrom(ServerScoreStatus status) {
        return fromStatus == status && toStatus != status;
    }
}
