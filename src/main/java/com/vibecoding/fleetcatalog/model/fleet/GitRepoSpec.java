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
public class GitRepoSpec {
    private String repo;
    private String branch;
    private String revision;
    private List<String> paths;
    private List<FleetTarget> targets;
    private String pollingInterval;
    private Boolean insecureSkipTLSVerify;
    private String clientSecretName;
}
