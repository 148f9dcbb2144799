package com.vibecoding.fleetcatalog.model.fleetyaml;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FleetYamlApiDefinition {
    private String name;
    private String type;            // openapi, asyncapi, graphql, grpc ...
    private String description;
    private String definition;
    private String definitionUrl;
}
