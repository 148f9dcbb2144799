package com.vibecoding.fleetcatalog.model.fleet;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BundleDeploymentSpec {
    private String deploymentID;
    private String stagedDeploymentID;
    private List<BundleDependsOn> dependsOn;
}
