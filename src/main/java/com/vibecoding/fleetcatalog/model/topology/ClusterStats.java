package com.vibecoding.fleetcatalog.model.topology;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 다운스트림 클러스터 보강 통계
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterStats {
    private String clusterId;
    private String driver;
    private String provider;
    private String version;
    private String state;
    private String workspace;               // Rancher fleetWorkspaceName
    private Integer nodeCount;
    private Integer machineDeploymentCount;
    private Integer virtualMachineCount;

    @Builder.Default
    private List<String> conditions = new ArrayList<>();   // "Ready=True"
}
