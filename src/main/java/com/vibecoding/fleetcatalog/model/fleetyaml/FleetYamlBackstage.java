package com.vibecoding.fleetcatalog.model.fleetyaml;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * fleet.yaml 의 backstage 섹션
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FleetYamlBackstage {
    private String type;                 // service(기본), website, library ...
    private String description;
    private String owner;
    private String lifecycle;
    private List<String> tags;
    private List<String> dependsOn;      // 완성된 엔티티 참조
    private List<FleetYamlApiDefinition> providesApis;
    private List<String> consumesApis;
    private Map<String, String> annotations;
}
