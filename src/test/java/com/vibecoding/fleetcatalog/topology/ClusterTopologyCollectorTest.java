package com.vibecoding.fleetcatalog.topology;

import com.vibecoding.fleetcatalog.exception.FleetApiException;
import com.vibecoding.fleetcatalog.model.FetchResult;
import com.vibecoding.fleetcatalog.model.topology.ClusterItems;
import com.vibecoding.fleetcatalog.model.topology.ClusterStats;
import com.vibecoding.fleetcatalog.model.topology.ClusterVersion;
import com.vibecoding.fleetcatalog.model.topology.InventoryItem;
import com.vibecoding.fleetcatalog.model.topology.RancherCluster;
import com.vibecoding.fleetcatalog.model.topology.RancherNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClusterTopologyCollectorTest {

    @Mock
    private TopologyClient topologyClient;

    private ClusterTopologyCollector collector;

    @BeforeEach
    void setUp() {
        collector = new ClusterTopologyCollector(topologyClient);
    }

    @Test
    void collect_shouldReturnDegradedTopologyWhenDisabled() {
        when(topologyClient.isEnabled()).thenReturn(false);

        ClusterTopology topology = collector.collect(false);

        assertThat(topology.isDegraded()).isTrue();
        verify(topologyClient, never()).listClusterDetails();
    }

    @Test
    void collect_shouldReturnDegradedTopologyWhenInventoryFails() {
        when(topologyClient.isEnabled()).thenReturn(true);
        when(topologyClient.listClusterDetails()).thenReturn(FetchResult.failure(new FleetApiException("401 Unauthorized")));

        ClusterTopology topology = collector.collect(true);

        assertThat(topology.isDegraded()).isTrue();
        assertThat(topology.knownClusterIds()).isEmpty();
    }

    @Test
    void collect_shouldAggregateStatsAndInventory() {
        RancherCluster cluster = RancherCluster.builder()
                .id("c-m-abc123")
                .name("prod-east")
                .annotations(Map.of("field.cattle.io/displayName", "Prod East"))
                .driver("rke2")
                .state("active")
                .fleetWorkspaceName("fleet-default")
                .conditions(List.of(new RancherCluster.RancherCondition("Ready", "True", null)))
                .build();
        List<RancherCluster> clusters = List.of(cluster);
        InventoryItem node = InventoryItem.builder().type(InventoryItem.TYPE_NODE).name("worker-1").build();

        when(topologyClient.isEnabled()).thenReturn(true);
        when(topologyClient.listClusterDetails()).thenReturn(FetchResult.success(clusters));
        when(topologyClient.listClusterVersions(clusters))
                .thenReturn(FetchResult.success(List.of(new ClusterVersion("c-m-abc123", "prod-east", "v1.29.4+rke2r1"))));
        when(topologyClient.listNodesDetailed(clusters))
                .thenReturn(FetchResult.success(List.of(new ClusterItems<>("c-m-abc123", "prod-east", List.of(node)))));
        when(topologyClient.listMachineDeploymentGroups(clusters))
                .thenReturn(FetchResult.failure(new FleetApiException("no CAPI")));
        when(topologyClient.listVirtualMachineGroups(clusters)).thenReturn(FetchResult.success(Collections.emptyList()));

        ClusterTopology topology = collector.collect(true);

        assertThat(topology.isDegraded()).isFalse();
        assertThat(topology.resolveClusterName("c-m-abc123")).contains("Prod East");
        assertThat(topology.canonicalId("prod-east")).contains("c-m-abc123");

        ClusterStats stats = topology.getStats("c-m-abc123").orElseThrow();
        assertThat(stats.getVersion()).isEqualTo("v1.29.4+rke2r1");
        assertThat(stats.getNodeCount()).isEqualTo(1);
        assertThat(stats.getMachineDeploymentCount()).isNull();
        assertThat(stats.getConditions()).containsExactly("Ready=True");
        assertThat(topology.getInventory("c-m-abc123")).containsExactly(node);
    }

    @Test
    void collect_shouldSkipInventoryWhenNotRequested() {
        RancherCluster cluster = RancherCluster.builder().id("local").name("local").build();
        List<RancherCluster> clusters = List.of(cluster);
        InventoryItem node = InventoryItem.builder().type(InventoryItem.TYPE_NODE).name("server-0").build();

        when(topologyClient.isEnabled()).thenReturn(true);
        when(topologyClient.listClusterDetails()).thenReturn(FetchResult.success(clusters));
        when(topologyClient.listClusterVersions(anyList())).thenReturn(FetchResult.success(Collections.emptyList()));
        when(topologyClient.listNodesDetailed(anyList()))
                .thenReturn(FetchResult.success(List.of(new ClusterItems<>("local", "local", List.of(node)))));
        when(topologyClient.listMachineDeploymentGroups(anyList())).thenReturn(FetchResult.success(Collections.emptyList()));
        when(topologyClient.listVirtualMachineGroups(anyList())).thenReturn(FetchResult.success(Collections.emptyList()));

        ClusterTopology topology = collector.collect(false);

        assertThat(topology.getStats("local").orElseThrow().getNodeCount()).isEqualTo(1);
        assertThat(topology.getInventory("local")).isEmpty();
        assertThat(topology.getStats("local").orElseThrow().getWorkspace()).isEqualTo("fleet-default");
    }

    @Test
    void enrichDegraded_shouldListNodesForUnknownClusters() {
        ClusterTopology topology = ClusterTopology.degraded();
        when(topologyClient.isEnabled()).thenReturn(true);
        when(topologyClient.listClusterNodes("c-m-abc123")).thenReturn(FetchResult.success(List.of(
                RancherNode.builder().id("m-1").nodeName("worker-1").state("active").build(),
                RancherNode.builder().id("m-2").hostname("worker-2").build())));
        when(topologyClient.listClusterNodes("c-m-broken")).thenReturn(FetchResult.failure(new FleetApiException("503")));

        collector.enrichDegraded(topology, List.of("c-m-abc123", "c-m-broken"), true);

        assertThat(topology.getStats("c-m-abc123").orElseThrow().getNodeCount()).isEqualTo(2);
        assertThat(topology.getStats("c-m-broken")).isEmpty();
        assertThat(topology.getInventory("c-m-abc123"))
                .extracting(InventoryItem::getName)
                .containsExactly("worker-1", "worker-2");
    }

    @Test
    void enrichDegraded_shouldDoNothingForFullTopology() {
        collector.enrichDegraded(new ClusterTopology(false), List.of("c1"), true);

        verify(topologyClient, never()).listClusterNodes("c1");
    }

    @Test
    void friendlyName_shouldFollowPrecedence() {
        RancherCluster plain = RancherCluster.builder().id("c-m-1").name("raw-name").build();
        RancherCluster labeled = RancherCluster.builder().id("c-m-2").name("raw-name")
                .labels(Map.of("management.cattle.io/cluster-display-name", "Labeled")).build();
        RancherCluster harvester = RancherCluster.builder().id("c-m-3").name("raw-name").provider("harvester")
                .annotations(Map.of("harvesterhci.io/cluster-display-name", "Harvester HCI")).build();
        RancherCluster notHarvester = RancherCluster.builder().id("c-m-4").name("raw-name").provider("rke2")
                .annotations(Map.of("harvesterhci.io/cluster-display-name", "Ignored")).build();
        RancherCluster displayName = RancherCluster.builder().id("c-m-5").name("raw-name")
                .annotations(Map.of("field.cattle.io/displayName", "Display",
                        "management.cattle.io/cluster-display-name", "Managed"))
                .build();
        RancherCluster idOnly = RancherCluster.builder().id("c-m-6").build();

        assertThat(ClusterTopologyCollector.friendlyName(plain)).isEqualTo("raw-name");
        assertThat(ClusterTopologyCollector.friendlyName(labeled)).isEqualTo("Labeled");
        assertThat(ClusterTopologyCollector.friendlyName(harvester)).isEqualTo("Harvester HCI");
        assertThat(ClusterTopologyCollector.friendlyName(notHarvester)).isEqualTo("raw-name");
        assertThat(ClusterTopologyCollector.friendlyName(displayName)).isEqualTo("Display");
        assertThat(ClusterTopologyCollector.friendlyName(idOnly)).isEqualTo("c-m-6");
    }
}
