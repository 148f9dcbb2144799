package com.vibecoding.fleetcatalog.sync;

import com.vibecoding.fleetcatalog.model.fleet.GitRepo;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYaml;

import java.util.Optional;

/**
 * GitRepo 의 fleet.yaml 조회
 */
public interface FleetYamlFetcher {

    Optional<FleetYaml> fetch(GitRepo gitRepo);
}
