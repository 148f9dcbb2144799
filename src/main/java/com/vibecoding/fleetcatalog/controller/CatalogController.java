package com.vibecoding.fleetcatalog.controller;

import com.vibecoding.fleetcatalog.catalog.CatalogSnapshotStore;
import com.vibecoding.fleetcatalog.model.catalog.CatalogEntity;
import com.vibecoding.fleetcatalog.model.catalog.EntityKind;
import com.vibecoding.fleetcatalog.sync.FleetEntityProvider;
import com.vibecoding.fleetcatalog.sync.FleetProviderRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 카탈로그 스냅샷 조회 및 수동 동기화 API
 */
@RestController
@RequestMapping("/api/catalog/providers")
@RequiredArgsConstructor
public class CatalogController {

    private static final Logger log = LoggerFactory.getLogger(CatalogController.class);

    private final FleetProviderRegistry registry;
    private final CatalogSnapshotStore snapshotStore;

    /**
     * provider 목록과 마지막 동기화 상태
     */
    @GetMapping
    public List<Map<String, Object>> listProviders() {
        return registry.getProviders().stream()
                .map(this::summarize)
                .collect(Collectors.toList());
    }

    /**
     * 최신 스냅샷 엔티티, kind 로 필터링 가능
     */
    @GetMapping("/{id}/entities")
    public List<CatalogEntity> listEntities(@PathVariable String id,
                                            @RequestParam(required = false) String kind) {
        FleetEntityProvider provider = registry.getProvider(id);
        EntityKind entityKind = kind != null ? EntityKind.fromValue(kind) : null;
        return snapshotStore.getEntities(provider.getProviderName(), entityKind);
    }

    /**
     * 즉시 동기화. 패스가 끝날 때까지 기다린다
     */
    @PostMapping("/{id}/sync")
    public Map<String, Object> sync(@PathVariable String id) {
        FleetEntityProvider provider = registry.getProvider(id);
        log.info("Manual sync requested for {}", provider.getProviderName());
        provider.run();
        return summarize(provider);
    }

    private Map<String, Object> summarize(FleetEntityProvider provider) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", provider.getId());
        summary.put("providerName", provider.getProviderName());
        summary.put("state", provider.getState());
        summary.put("lastResult", provider.getLastResult());
        summary.put("clusters", provider.getClusters().size());
        summary.put("lastSyncAt", provider.getLastSyncAt() != null ? provider.getLastSyncAt().toString() : null);
        summary.put("entityCount", provider.getLastEntityCount());
        return summary;
    }
}
