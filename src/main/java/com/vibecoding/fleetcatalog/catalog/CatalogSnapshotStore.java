package com.vibecoding.fleetcatalog.catalog;

import com.vibecoding.fleetcatalog.model.catalog.CatalogEntity;
import com.vibecoding.fleetcatalog.model.catalog.DeferredEntity;
import com.vibecoding.fleetcatalog.model.catalog.EntityKind;
import com.vibecoding.fleetcatalog.model.catalog.EntityMutation;
import com.vibecoding.fleetcatalog.sync.EntityProviderConnection;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * provider 별 최신 full 스냅샷 보관소
 *
 * full mutation 은 같은 provider 의 이전 스냅샷을 통째로 대체한다.
 */
@Component
public class CatalogSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(CatalogSnapshotStore.class);

    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    /**
     * provider 이름(location key)에 묶인 출력 채널
     */
    public EntityProviderConnection connectionFor(String providerName) {
        return mutation -> apply(providerName, mutation);
    }

    public void apply(String providerName, EntityMutation mutation) {
        switch (mutation.getType()) {
            case FULL:
                List<DeferredEntity> entities = List.copyOf(mutation.getEntities());
                Snapshot previous = snapshots.put(providerName, new Snapshot(providerName, entities, LocalDateTime.now()));
                log.info("Applied full mutation for {}: {} entities (previously {})",
                        providerName, entities.size(), previous != null ? previous.getEntities().size() : 0);
                break;
            default:
                throw new IllegalArgumentException("Unsupported mutation type: " + mutation.getType());
        }
    }

    public Optional<Snapshot> getSnapshot(String providerName) {
        return Optional.ofNullable(snapshots.get(providerName));
    }

    /**
     * @param kind null 이면 전체
     */
    public List<CatalogEntity> getEntities(String providerName, EntityKind kind) {
        Snapshot snapshot = snapshots.get(providerName);
        if (snapshot == null) {
            return Collections.emptyList();
        }
        return snapshot.getEntities().stream()
                .map(DeferredEntity::getEntity)
                .filter(entity -> kind == null || kind.getValue().equals(entity.getKind()))
                .collect(Collectors.toList());
    }

    @Getter
    @AllArgsConstructor
    public static class Snapshot {
        private final String providerName;
        private final List<DeferredEntity> entities;
        private final LocalDateTime appliedAt;
    }
}
