package io.monitorselector.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON document stored in accounts.flags.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountFlags {

    @JsonProperty("monitor_limit")
    private int monitorLimit;

    @JsonProperty("monitors_per_server_limit")
    private int monitorsPerServerLimit;

    @JsonProperty("monitor_enabled")
    private boolean monitorEnabled = true;
}
