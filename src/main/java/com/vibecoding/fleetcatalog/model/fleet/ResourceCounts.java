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
public class ResourceCounts {
    private Integer ready;
    private Integer desiredReady;
    private Integer waitApplied;
    private Integer modified;
    private Integer orphaned;
    private Integer missing;
    private Integer unknown;
    private Integer notReady;
}
