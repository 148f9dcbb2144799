package com.vibecoding.fleetcatalog.topology;

import com.vibecoding.fleetcatalog.model.topology.ClusterStats;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClusterTopologyTest {

    @Test
    void canonicalId_shouldResolveAliasesAndShortNames() {
        ClusterTopology topology = new ClusterTopology(false);
        topology.registerCluster("c-m-abc123", "Prod East", ClusterStats.builder().clusterId("c-m-abc123").build());
        topology.registerAlias("prod-east", "c-m-abc123");

        assertThat(topology.canonicalId("c-m-abc123")).contains("c-m-abc123");
        assertThat(topology.canonicalId("prod-east")).contains("c-m-abc123");
        assertThat(topology.canonicalId("prod-east-0123456789ab")).contains("c-m-abc123");
        assertThat(topology.canonicalId("staging")).isEmpty();
    }

    @Test
    void resolveClusterName_shouldUseShortNameHit() {
        ClusterTopology topology = ClusterTopology.degraded();
        topology.registerName("edge-01", "Edge Store 01");

        assertThat(topology.resolveClusterName("edge-01")).contains("Edge Store 01");
        assertThat(topology.resolveClusterName("edge-01-a1b2c3d4e5f6")).contains("Edge Store 01");
        assertThat(topology.resolveClusterName("edge-02")).isEmpty();
    }

    @Test
    void registerName_shouldKeepFirstName() {
        ClusterTopology topology = ClusterTopology.degraded();
        topology.registerName("c1", "first");
        topology.registerName("c1", "second");

        assertThat(topology.resolveClusterName("c1")).contains("first");
    }

    @Test
    void knownClusterIds_shouldFollowRegistrationOrder() {
        ClusterTopology topology = new ClusterTopology(false);
        topology.registerCluster("b", null, ClusterStats.builder().clusterId("b").build());
        topology.registerCluster("a", null, ClusterStats.builder().clusterId("a").build());
        topology.putStats("b", ClusterStats.builder().clusterId("b").nodeCount(9).build());

        assertThat(topology.knownClusterIds()).containsExactly("b", "a");
        assertThat(topology.getStats("b").orElseThrow().getNodeCount()).isNull();
    }
}
