package com.vibecoding.fleetcatalog.model.topology;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rancher 관리 API (/v3/clusters/{id}/nodes) 노드 항목
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RancherNode {
    private String id;
    private String nodeName;
    private String hostname;
    private String name;
    private String state;

    public String displayName() {
        if (nodeName != null && !nodeName.isBlank()) {
            return nodeName;
        }
        if (hostname != null && !hostname.isBlank()) {
            return hostname;
        }
        return name != null && !name.isBlank() ? name : id;
    }
}
