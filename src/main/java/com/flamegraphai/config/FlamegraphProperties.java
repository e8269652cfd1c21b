package com.flamegraphai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "flamegraph")
public class FlamegraphProperties {
    private String corsOrigin = "*";

    // Number of top hotspots echoed to the debug log per analysis
    private int loggedHotspots = 5;
}
