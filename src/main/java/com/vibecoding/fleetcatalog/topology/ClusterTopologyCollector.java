package com.vibecoding.fleetcatalog.topology;

import com.vibecoding.fleetcatalog.mapper.FleetNamespaces;
import com.vibecoding.fleetcatalog.model.FetchResult;
import com.vibecoding.fleetcatalog.model.fleet.FleetResources;
import com.vibecoding.fleetcatalog.model.topology.ClusterItems;
import com.vibecoding.fleetcatalog.model.topology.ClusterStats;
import com.vibecoding.fleetcatalog.model.topology.ClusterVersion;
import com.vibecoding.fleetcatalog.model.topology.InventoryItem;
import com.vibecoding.fleetcatalog.model.topology.RancherCluster;
import com.vibecoding.fleetcatalog.model.topology.RancherNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * 동기화 패스마다 다운스트림 클러스터 토폴로지 수집
 *
 * 인벤토리 API 를 쓸 수 없으면 degraded 토폴로지를 반환하고,
 * 이후 BundleDeployment 에서 발견된 클러스터 ID 로 노드 목록만 보강한다.
 */
@Component
@RequiredArgsConstructor
public class ClusterTopologyCollector {

    private static final Logger log = LoggerFactory.getLogger(ClusterTopologyCollector.class);

    static final String ANNOTATION_DISPLAY_NAME = "field.cattle.io/displayName";
    static final String ANNOTATION_HARVESTER_DISPLAY_NAME = "harvesterhci.io/cluster-display-name";

    private final TopologyClient topologyClient;

    /**
     * @param includeInventory 노드/MachineDeployment/VM 항목까지 보관할지 여부
     */
    public ClusterTopology collect(boolean includeInventory) {
        if (!topologyClient.isEnabled()) {
            log.debug("Topology client disabled, using degraded topology");
            return ClusterTopology.degraded();
        }

        FetchResult<List<RancherCluster>> details = topologyClient.listClusterDetails();
        if (details.isFailure()) {
            log.warn("Cluster inventory unavailable, using degraded topology: {}",
                    details.getError().map(Exception::getMessage).orElse("unknown error"));
            return ClusterTopology.degraded();
        }

        List<RancherCluster> clusters = details.getOrDefault(Collections.emptyList());
        ClusterTopology topology = new ClusterTopology(false);
        Map<String, ClusterStats> statsById = new LinkedHashMap<>();

        for (RancherCluster cluster : clusters) {
            ClusterStats stats = ClusterStats.builder()
                    .clusterId(cluster.getId())
                    .driver(cluster.getDriver())
                    .provider(cluster.getProvider())
                    .version(cluster.getVersion() != null ? cluster.getVersion().getGitVersion() : null)
                    .state(cluster.getState())
                    .workspace(cluster.getFleetWorkspaceName() != null
                            ? cluster.getFleetWorkspaceName()
                            : FleetNamespaces.DEFAULT_WORKSPACE)
                    .nodeCount(cluster.getNodeCount())
                    .conditions(describeConditions(cluster.getConditions()))
                    .build();
            statsById.put(cluster.getId(), stats);
            topology.registerCluster(cluster.getId(), friendlyName(cluster), stats);
            topology.registerAlias(cluster.getName(), cluster.getId());
        }

        topologyClient.listClusterVersions(clusters).getOrDefault(Collections.emptyList())
                .forEach(version -> applyVersion(statsById, version));

        applyGroups(topology, statsById, includeInventory,
                topologyClient.listNodesDetailed(clusters),
                (stats, count) -> stats.setNodeCount(count));
        applyGroups(topology, statsById, includeInventory,
                topologyClient.listMachineDeploymentGroups(clusters),
                (stats, count) -> stats.setMachineDeploymentCount(count));
        applyGroups(topology, statsById, includeInventory,
                topologyClient.listVirtualMachineGroups(clusters),
                (stats, count) -> stats.setVirtualMachineCount(count));

        log.info("Collected topology for {} downstream clusters", clusters.size());
        return topology;
    }

    /**
     * degraded 토폴로지에서 발견된 클러스터의 노드 수/노드 목록 보강
     */
    public void enrichDegraded(ClusterTopology topology, Collection<String> clusterIds, boolean includeInventory) {
        if (!topology.isDegraded() || !topologyClient.isEnabled()) {
            return;
        }
        for (String clusterId : clusterIds) {
            if (topology.getStats(clusterId).isPresent()) {
                continue;
            }
            FetchResult<List<RancherNode>> nodes = topologyClient.listClusterNodes(clusterId);
            if (nodes.isFailure()) {
                continue;
            }
            List<RancherNode> items = nodes.getOrDefault(Collections.emptyList());
            topology.putStats(clusterId, ClusterStats.builder()
                    .clusterId(clusterId)
                    .nodeCount(items.size())
                    .build());
            if (includeInventory) {
                topology.addInventory(clusterId, items.stream()
                        .map(ClusterTopologyCollector::toNodeItem)
                        .collect(Collectors.toList()));
            }
            log.debug("Degraded topology: {} nodes for cluster {}", items.size(), clusterId);
        }
    }

    /**
     * displayName annotation -> Rancher 표시 이름 -> Harvester 표시 이름 -> name -> id
     */
    static String friendlyName(RancherCluster cluster) {
        Map<String, String> annotations = cluster.getAnnotations() != null ? cluster.getAnnotations() : Collections.emptyMap();
        Map<String, String> labels = cluster.getLabels() != null ? cluster.getLabels() : Collections.emptyMap();

        List<String> candidates = new ArrayList<>();
        candidates.add(annotations.get(ANNOTATION_DISPLAY_NAME));
        candidates.add(annotations.get(FleetResources.LABEL_CLUSTER_DISPLAY_NAME));
        candidates.add(labels.get(FleetResources.LABEL_CLUSTER_DISPLAY_NAME));
        if (cluster.isHarvester()) {
            candidates.add(annotations.get(ANNOTATION_HARVESTER_DISPLAY_NAME));
        }
        candidates.add(cluster.getName());
        candidates.add(cluster.getId());

        return candidates.stream()
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse(null);
    }

    static List<String> describeConditions(List<RancherCluster.RancherCondition> conditions) {
        if (conditions == null) {
            return new ArrayList<>();
        }
        return conditions.stream()
                .filter(condition -> condition.getType() != null)
                .map(condition -> condition.getType() + "=" + condition.getStatus())
                .collect(Collectors.toList());
    }

    private static InventoryItem toNodeItem(RancherNode node) {
        InventoryItem item = InventoryItem.builder()
                .type(InventoryItem.TYPE_NODE)
                .name(node.displayName())
                .build();
        if (node.getState() != null) {
            item.getDetails().put("node-state", node.getState());
        }
        return item;
    }

    private static void applyVersion(Map<String, ClusterStats> statsById, ClusterVersion version) {
        ClusterStats stats = statsById.get(version.getClusterId());
        if (stats != null && version.getVersion() != null) {
            stats.setVersion(version.getVersion());
        }
    }

    private static void applyGroups(ClusterTopology topology, Map<String, ClusterStats> statsById,
                                    boolean includeInventory, FetchResult<List<ClusterItems<InventoryItem>>> result,
                                    BiConsumer<ClusterStats, Integer> counter) {
        for (ClusterItems<InventoryItem> group : result.getOrDefault(Collections.emptyList())) {
            List<InventoryItem> items = group.getItems() != null ? group.getItems() : Collections.emptyList();
            ClusterStats stats = statsById.get(group.getClusterId());
            if (stats != null) {
                counter.accept(stats, items.size());
            }
            if (includeInventory && !items.isEmpty()) {
                topology.addInventory(group.getClusterId(), items);
            }
        }
    }
}
