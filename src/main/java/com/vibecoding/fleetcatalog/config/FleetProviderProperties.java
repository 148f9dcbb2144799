package com.vibecoding.fleetcatalog.config;

import com.vibecoding.fleetcatalog.model.FleetClusterConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * catalog.providers.fleet.&lt;id&gt; 설정
 */
@Configuration
@ConfigurationProperties(prefix = "catalog.providers")
@Data
public class FleetProviderProperties {

    /** provider ID -> 설정 */
    private Map<String, ProviderSettings> fleet = new LinkedHashMap<>();

    @Data
    public static class ProviderSettings {
        private List<FleetClusterConfig> clusters = new ArrayList<>();
        private int concurrency = 3;
        private boolean includeNodes = false;
        private Schedule schedule = new Schedule();
    }

    @Data
    public static class Schedule {
        private Duration frequency = Duration.ofMinutes(10);
        private Duration timeout = Duration.ofMinutes(5);
        private Duration initialDelay = Duration.ofSeconds(15);
    }
}
