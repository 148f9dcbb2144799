package com.vibecoding.fleetcatalog.sync;

import com.vibecoding.fleetcatalog.FleetFixtures;
import com.vibecoding.fleetcatalog.mapper.FleetAnnotations;
import com.vibecoding.fleetcatalog.model.fleet.GitRepo;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYaml;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AnnotationFleetYamlFetcherTest {

    private final AnnotationFleetYamlFetcher fetcher = new AnnotationFleetYamlFetcher();

    private GitRepo gitRepoWithAnnotation(String value) {
        GitRepo gitRepo = FleetFixtures.gitRepo("fleet-default", "checkout", "https://github.com/acme/checkout", "Ready");
        Map<String, String> annotations = new HashMap<>();
        annotations.put(FleetAnnotations.FLEET_YAML, value);
        gitRepo.getMetadata().setAnnotations(annotations);
        return gitRepo;
    }

    @Test
    void fetch_shouldParseJsonAnnotation() {
        GitRepo gitRepo = gitRepoWithAnnotation("{"
                + "\"defaultNamespace\":\"checkout\","
                + "\"helm\":{\"releaseName\":\"checkout\"},"
                + "\"unknownField\":true,"
                + "\"backstage\":{\"owner\":\"team-payments\",\"tags\":[\"payments\"],"
                + "\"providesApis\":[{\"name\":\"checkout-api\",\"type\":\"openapi\"}]}"
                + "}");

        Optional<FleetYaml> fleetYaml = fetcher.fetch(gitRepo);

        assertThat(fleetYaml).isPresent();
        assertThat(fleetYaml.get().getDefaultNamespace()).isEqualTo("checkout");
        assertThat(fleetYaml.get().getHelm().getReleaseName()).isEqualTo("checkout");
        assertThat(fleetYaml.get().getBackstage().getOwner()).isEqualTo("team-payments");
        assertThat(fleetYaml.get().getBackstage().getProvidesApis()).hasSize(1);
    }

    @Test
    void fetch_shouldTreatMalformedJsonAsAbsent() {
        assertThat(fetcher.fetch(gitRepoWithAnnotation("{not json"))).isEmpty();
    }

    @Test
    void fetch_shouldReturnEmptyWithoutAnnotation() {
        GitRepo gitRepo = FleetFixtures.gitRepo("fleet-default", "checkout", null, null);

        assertThat(fetcher.fetch(gitRepo)).isEmpty();
        assertThat(fetcher.fetch(gitRepoWithAnnotation("  "))).isEmpty();
    }
}
