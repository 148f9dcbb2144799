package com.vibecoding.fleetcatalog.sync;

import com.vibecoding.fleetcatalog.catalog.CatalogSnapshotStore;
import com.vibecoding.fleetcatalog.client.KubernetesClientFactory;
import com.vibecoding.fleetcatalog.config.FleetProviderProperties;
import com.vibecoding.fleetcatalog.config.FleetProviderProperties.ProviderSettings;
import com.vibecoding.fleetcatalog.exception.FleetProviderNotFoundException;
import com.vibecoding.fleetcatalog.topology.ClusterTopologyCollector;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 설정된 provider 생성 및 스냅샷 저장소 연결
 */
@Component
@RequiredArgsConstructor
public class FleetProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(FleetProviderRegistry.class);

    private final FleetProviderProperties properties;
    private final KubernetesClientFactory clientFactory;
    private final ClusterTopologyCollector topologyCollector;
    private final FleetYamlFetcher fleetYamlFetcher;
    private final CatalogSnapshotStore snapshotStore;

    private final Map<String, FleetEntityProvider> providers = new LinkedHashMap<>();

    @PostConstruct
    public void initializeProviders() {
        log.info("Initializing Fleet providers from configuration...");

        for (Map.Entry<String, ProviderSettings> entry : properties.getFleet().entrySet()) {
            String id = entry.getKey();
            ProviderSettings settings = entry.getValue();
            if (settings.getClusters() == null || settings.getClusters().isEmpty()) {
                log.warn("Fleet provider {} has no clusters configured, skipping", id);
                continue;
            }

            FleetEntityProvider provider = new FleetEntityProvider(id, settings.getClusters(),
                    settings.getConcurrency(), settings.isIncludeNodes(),
                    clientFactory, topologyCollector, fleetYamlFetcher);
            provider.connect(snapshotStore.connectionFor(provider.getProviderName()));
            providers.put(id, provider);

            log.info("Created FleetEntityProvider[{}] with {} cluster(s)", id, settings.getClusters().size());
        }

        log.info("Fleet provider initialization completed: {} provider(s)", providers.size());
    }

    public List<FleetEntityProvider> getProviders() {
        return new ArrayList<>(providers.values());
    }

    /**
     * @throws FleetProviderNotFoundException 등록되지 않은 ID
     */
    public FleetEntityProvider getProvider(String id) {
        FleetEntityProvider provider = providers.get(id);
        if (provider == null) {
            throw new FleetProviderNotFoundException(id);
        }
        return provider;
    }

    public ProviderSettings getSettings(String id) {
        return properties.getFleet().get(id);
    }
}
