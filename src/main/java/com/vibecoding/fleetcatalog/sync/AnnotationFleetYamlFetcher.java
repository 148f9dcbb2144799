package com.vibecoding.fleetcatalog.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.fleetcatalog.mapper.FleetAnnotations;
import com.vibecoding.fleetcatalog.model.fleet.GitRepo;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYaml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * GitRepo annotation (fleet.cattle.io/fleet-yaml) 에 미리 넣어 둔 JSON 을 읽는다.
 * Git 저장소를 직접 clone 하지는 않는다.
 */
@Component
public class AnnotationFleetYamlFetcher implements FleetYamlFetcher {

    private static final Logger log = LoggerFactory.getLogger(AnnotationFleetYamlFetcher.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public Optional<FleetYaml> fetch(GitRepo gitRepo) {
        if (gitRepo.getMetadata() == null) {
            return Optional.empty();
        }
        Map<String, String> annotations = gitRepo.getMetadata().getAnnotations();
        String raw = annotations != null ? annotations.get(FleetAnnotations.FLEET_YAML) : null;
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(objectMapper.readValue(raw, FleetYaml.class));
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse fleet.yaml annotation for GitRepo {}/{}: {}",
                    gitRepo.getMetadata().getNamespace(), gitRepo.getMetadata().getName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
