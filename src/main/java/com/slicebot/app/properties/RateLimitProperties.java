package com.slicebot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "ratelimit")
public class RateLimitProperties {
    private long minDelayMs = 500L;
    private long initialBackoffMs = 5000L;
    private double backoffMultiplier = 2.0;
    private long maxBackoffMs = 300000L;
}
