package com.vibecoding.fleetcatalog.model;

import io.fabric8.kubernetes.api.model.LabelSelector;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 스캔 대상 Fleet 워크스페이스 네임스페이스
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FleetNamespaceConfig {
    private String name;
    private LabelSelector labelSelector;

    public static FleetNamespaceConfig of(String name) {
        return FleetNamespaceConfig.builder().name(name).build();
    }
}
