package com.vibecoding.fleetcatalog.model.topology;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Rancher 관리 API (/v3/clusters) 클러스터 항목
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RancherCluster {
    private String id;                        // c-m-xxxxxxxx, local
    private String name;
    private Map<String, String> annotations;
    private Map<String, String> labels;
    private String driver;
    private String provider;
    private String caCert;
    private String state;
    private String fleetWorkspaceName;
    private Integer nodeCount;
    private RancherVersion version;
    private List<RancherCondition> conditions;

    public boolean isHarvester() {
        return "harvester".equals(provider)
                || "harvester".equals(driver)
                || (labels != null && "harvester".equals(labels.get("provider.cattle.io")));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RancherVersion {
        private String gitVersion;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RancherCondition {
        private String type;
        private String status;
        private String message;
    }
}
