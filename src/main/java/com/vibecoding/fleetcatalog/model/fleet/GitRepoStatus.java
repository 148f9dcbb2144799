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
public class GitRepoStatus {
    private StatusDisplay display;
    private StatusSummary summary;
    private ResourceCounts resourceCounts;
    private List<AppliedResource> resources;   // 상태에 보고된 적용 리소스
    private String commit;
    private String gitJobStatus;
    private Long observedGeneration;
}
