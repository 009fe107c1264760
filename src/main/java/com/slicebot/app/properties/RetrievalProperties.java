package com.slicebot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "retrieve")
public class RetrievalProperties {
    private double cooldownMinutes = 61.0;
    private long cooldownPollMs = 1000L;
    private int maxCooldownRetries = 3;
    private String successMarkerKey = "last_retrieve_all_slices_success_at_ms";
    private String lockName = "retrieve_all_slices";
    private int lockLeaseMinutes = 240;
}
