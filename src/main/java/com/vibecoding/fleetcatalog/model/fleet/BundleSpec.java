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
public class BundleSpec {
    private List<FleetTarget> targets;
    private List<BundleDependsOn> dependsOn;
    private HelmOptions helm;
    private String defaultNamespace;
    private String targetNamespace;
    private String namespace;
    private String serviceAccount;
    private Boolean paused;
}
