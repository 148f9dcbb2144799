package com.vibecoding.fleetcatalog.model.fleet;

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
public class StatusSummary {
    private Integer ready;
    private Integer desiredReady;
    private Integer notReady;
    private Integer waitApplied;
    private Integer errApplied;
    private Integer outOfSync;
    private Integer modified;
    private Integer pending;
}
