package com.vibecoding.fleetcatalog.topology;

import com.vibecoding.fleetcatalog.mapper.FleetNamespaces;
import com.vibecoding.fleetcatalog.model.topology.ClusterStats;
import com.vibecoding.fleetcatalog.model.topology.InventoryItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 한 번의 동기화 패스 동안 유지되는 다운스트림 클러스터 정보
 *
 * 키는 정규 클러스터 ID. 별칭(클러스터 이름, Fleet 클러스터 이름)과
 * Fleet 가 붙이는 12자리 hex 접미사를 제거한 짧은 이름으로도 조회된다.
 * 이름/별칭은 fan-out 전에 순차 등록되고, 통계와 인벤토리는 관리 클러스터 fetch 가 동시에 채우므로 동시성 맵을 쓴다.
 */
public class ClusterTopology {

    private final boolean degraded;
    private final Map<String, String> names = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();
    private final Map<String, ClusterStats> stats = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, List<InventoryItem>> inventory = new ConcurrentHashMap<>();

    public ClusterTopology(boolean degraded) {
        this.degraded = degraded;
    }

    public static ClusterTopology degraded() {
        return new ClusterTopology(true);
    }

    public boolean isDegraded() {
        return degraded;
    }

    // ========== 등록 ==========

    public void registerCluster(String clusterId, String friendlyName, ClusterStats clusterStats) {
        if (friendlyName != null) {
            names.put(clusterId, friendlyName);
        }
        if (clusterStats != null) {
            stats.put(clusterId, clusterStats);
        }
    }

    /**
     * 먼저 등록된 이름 유지. 호출 순서가 우선순위가 되므로 순차적으로 호출해야 한다.
     */
    public void registerName(String clusterId, String friendlyName) {
        if (clusterId != null && friendlyName != null) {
            names.putIfAbsent(clusterId, friendlyName);
        }
    }

    public void registerAlias(String alias, String clusterId) {
        if (alias != null && !alias.equals(clusterId)) {
            aliases.putIfAbsent(alias, clusterId);
        }
    }

    public void putStats(String clusterId, ClusterStats clusterStats) {
        stats.putIfAbsent(clusterId, clusterStats);
    }

    public void addInventory(String clusterId, List<InventoryItem> items) {
        inventory.computeIfAbsent(clusterId, id -> Collections.synchronizedList(new ArrayList<>())).addAll(items);
    }

    // ========== 조회 ==========

    /**
     * 전체 ID, 별칭, 짧은 이름 순으로 알려진 클러스터 ID 를 찾는다
     */
    public Optional<String> canonicalId(String clusterId) {
        if (clusterId == null) {
            return Optional.empty();
        }
        Optional<String> direct = lookup(clusterId);
        if (direct.isPresent()) {
            return direct;
        }
        return FleetNamespaces.shortName(clusterId).flatMap(this::lookup);
    }

    /**
     * 친숙한 이름. 모르는 클러스터면 empty
     */
    public Optional<String> resolveClusterName(String clusterId) {
        if (clusterId == null) {
            return Optional.empty();
        }
        if (names.containsKey(clusterId)) {
            return Optional.of(names.get(clusterId));
        }
        Optional<String> canonical = canonicalId(clusterId);
        if (canonical.isPresent() && names.containsKey(canonical.get())) {
            return Optional.of(names.get(canonical.get()));
        }
        return FleetNamespaces.shortName(clusterId).map(names::get);
    }

    public Optional<ClusterStats> getStats(String clusterId) {
        return canonicalId(clusterId).map(stats::get);
    }

    public List<InventoryItem> getInventory(String clusterId) {
        List<InventoryItem> items = inventory.get(clusterId);
        if (items == null) {
            return Collections.emptyList();
        }
        synchronized (items) {
            return new ArrayList<>(items);
        }
    }

    /**
     * 통계가 있는 클러스터 ID, 등록 순서
     */
    public List<String> knownClusterIds() {
        synchronized (stats) {
            return new ArrayList<>(stats.keySet());
        }
    }

    public List<String> inventoryClusterIds() {
        return new ArrayList<>(inventory.keySet());
    }

    private Optional<String> lookup(String id) {
        if (stats.containsKey(id) || names.containsKey(id)) {
            return Optional.of(id);
        }
        return Optional.ofNullable(aliases.get(id));
    }
}
