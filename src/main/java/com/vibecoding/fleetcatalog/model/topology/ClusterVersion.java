package com.vibecoding.fleetcatalog.model.topology;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterVersion {
    private String clusterId;
    private String clusterName;
    private String version;
}
