package com.vibecoding.fleetcatalog.model.fleet;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * status.resources 항목 (실제 적용된 Kubernetes 오브젝트)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppliedResource {
    private String kind;
    private String apiVersion;
    private String namespace;
    private String name;
    private String id;
    private String state;
    private Boolean error;
    private String message;
}
