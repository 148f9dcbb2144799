package com.vibecoding.fleetcatalog.model.fleetyaml;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vibecoding.fleetcatalog.model.fleet.BundleDependsOn;
import com.vibecoding.fleetcatalog.model.fleet.HelmOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * fleet.yaml 디스크립터 (GitRepo 보강 메타데이터)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FleetYaml {
    private String defaultNamespace;
    private String namespace;
    private String targetNamespace;
    private HelmOptions helm;
    private List<BundleDependsOn> dependsOn;
    private Boolean paused;
    private FleetYamlBackstage backstage;      // Fleet가 무시하는 카탈로그 전용 섹션
    private Map<String, String> annotations;
}
