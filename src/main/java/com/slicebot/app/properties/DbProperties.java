package com.slicebot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "jdbc:postgresql://localhost:5432/slicebot";
    private String user = "slicebot";
    private String pass = "slicebot";
    private String schema = "slicebot";
}
