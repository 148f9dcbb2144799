package com.vibecoding.fleetcatalog.model.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 종류별 spec. 해당 종류에 없는 필드는 비워 둔다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class EntitySpec {
    private String type;
    private String lifecycle;
    private String owner;
    private String domain;      // System
    private String system;      // Component, API

    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    @Builder.Default
    private List<String> providesApis = new ArrayList<>();

    @Builder.Default
    private List<String> consumesApis = new ArrayList<>();

    private String definition;  // API
}
