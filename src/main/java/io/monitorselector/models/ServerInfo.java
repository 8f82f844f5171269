package io.monitorselector.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * NTP server being reviewed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServerInfo {

    private long id;

    private String ip;

    private String ipVersion; // "v4" or "v6"

    private Long accountId;
}
