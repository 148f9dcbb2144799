package com.vibecoding.fleetcatalog.sync;

import com.vibecoding.fleetcatalog.FleetFixtures;
import com.vibecoding.fleetcatalog.client.FleetResourceClient;
import com.vibecoding.fleetcatalog.client.KubernetesClientFactory;
import com.vibecoding.fleetcatalog.exception.FleetApiException;
import com.vibecoding.fleetcatalog.exception.FleetProviderNotConnectedException;
import com.vibecoding.fleetcatalog.exception.FleetSyncException;
import com.vibecoding.fleetcatalog.mapper.FleetAnnotations;
import com.vibecoding.fleetcatalog.mapper.FleetEntityMapper;
import com.vibecoding.fleetcatalog.mapper.MapperContext;
import com.vibecoding.fleetcatalog.model.FetchResult;
import com.vibecoding.fleetcatalog.model.FleetClusterConfig;
import com.vibecoding.fleetcatalog.model.FleetNamespaceConfig;
import com.vibecoding.fleetcatalog.model.catalog.CatalogEntity;
import com.vibecoding.fleetcatalog.model.catalog.DeferredEntity;
import com.vibecoding.fleetcatalog.model.catalog.EntityMutation;
import com.vibecoding.fleetcatalog.model.fleet.FleetCluster;
import com.vibecoding.fleetcatalog.model.fleet.FleetResources;
import com.vibecoding.fleetcatalog.model.fleet.GitRepo;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYaml;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYamlApiDefinition;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYamlBackstage;
import com.vibecoding.fleetcatalog.model.topology.ClusterStats;
import com.vibecoding.fleetcatalog.model.topology.InventoryItem;
import com.vibecoding.fleetcatalog.topology.ClusterTopology;
import com.vibecoding.fleetcatalog.topology.ClusterTopologyCollector;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FleetEntityProviderTest {

    private static final String REPO_URL = "https://github.com/acme/my-app";

    @Mock
    private KubernetesClientFactory clientFactory;
    @Mock
    private FleetResourceClient client;
    @Mock
    private ClusterTopologyCollector topologyCollector;
    @Mock
    private FleetYamlFetcher fleetYamlFetcher;

    private final List<EntityMutation> applied = new ArrayList<>();

    @BeforeEach
    void setUp() {
        when(clientFactory.createResourceClient(any())).thenReturn(client);
        when(topologyCollector.collect(anyBoolean())).thenAnswer(invocation -> ClusterTopology.degraded());
        when(client.listClusters(anyString())).thenReturn(FetchResult.success(Collections.emptyList()));
        when(client.listGitRepos(anyString(), any())).thenReturn(FetchResult.success(Collections.emptyList()));
        when(client.listBundlesForGitRepo(anyString(), anyString())).thenReturn(FetchResult.success(Collections.emptyList()));
        when(client.listBundleDeploymentsForBundle(anyString())).thenReturn(FetchResult.success(Collections.emptyList()));
        when(fleetYamlFetcher.fetch(any())).thenReturn(Optional.empty());
    }

    private FleetEntityProvider provider(FleetClusterConfig... clusters) {
        FleetEntityProvider provider = new FleetEntityProvider("test", List.of(clusters), 3, false,
                clientFactory, topologyCollector, fleetYamlFetcher);
        provider.connect(applied::add);
        return provider;
    }

    private List<CatalogEntity> lastEntities() {
        assertThat(applied).isNotEmpty();
        return applied.get(applied.size() - 1).getEntities().stream()
                .map(DeferredEntity::getEntity)
                .collect(Collectors.toList());
    }

    private CatalogEntity entity(String ref) {
        return lastEntities().stream()
                .filter(entity -> entity.getRef().equals(ref))
                .findFirst()
                .orElseThrow(() -> new AssertionError("missing entity " + ref));
    }

    private List<String> kinds() {
        return lastEntities().stream().map(CatalogEntity::getKind).collect(Collectors.toList());
    }

    @Test
    void run_shouldFailFastWhenNotConnected() {
        FleetEntityProvider provider = new FleetEntityProvider("test", List.of(FleetFixtures.cluster("mgmt")), 3, false,
                clientFactory, topologyCollector, fleetYamlFetcher);

        assertThatThrownBy(provider::run).isInstanceOf(FleetProviderNotConnectedException.class);
        assertThat(provider.getState()).isEqualTo(ProviderState.DISCONNECTED);
    }

    @Test
    void run_shouldEmitDomainAndSystemForRepoWithoutBundles() {
        when(client.listGitRepos(eq("fleet-default"), any()))
                .thenReturn(FetchResult.success(List.of(FleetFixtures.gitRepo("fleet-default", "my-app", REPO_URL, "Ready"))));
        FleetEntityProvider provider = provider(FleetFixtures.cluster("mgmt", "fleet-default"));

        provider.run();

        assertThat(applied).hasSize(1);
        assertThat(applied.get(0).getType()).isEqualTo(EntityMutation.Type.FULL);
        assertThat(kinds()).containsExactly("Domain", "System");
        assertThat(applied.get(0).getEntities()).allMatch(deferred -> "fleet:test".equals(deferred.getLocationKey()));
        assertThat(entity("system:fleet-default/my-app").getSpec().getDomain()).isEqualTo("domain:default/mgmt");
        assertThat(provider.getState()).isEqualTo(ProviderState.CONNECTED);
        assertThat(provider.getLastResult()).isEqualTo(ProviderState.SUCCEEDED);
        assertThat(provider.getLastEntityCount()).isEqualTo(2);
    }

    @Test
    void run_shouldLinkBundleDeploymentsToComponentAndClusters() {
        FleetClusterConfig cluster = FleetFixtures.cluster("mgmt", "fleet-default");
        cluster.setIncludeBundleDeployments(true);
        when(client.listGitRepos(eq("fleet-default"), any()))
                .thenReturn(FetchResult.success(List.of(FleetFixtures.gitRepo("fleet-default", "my-app", REPO_URL, "Ready"))));
        when(client.listBundlesForGitRepo("fleet-default", "my-app"))
                .thenReturn(FetchResult.success(List.of(FleetFixtures.bundle("fleet-default", "my-app-web", "my-app", "Ready"))));
        when(client.listBundleDeploymentsForBundle("my-app-web")).thenReturn(FetchResult.success(List.of(
                FleetFixtures.bundleDeployment("default", "c1", "my-app-web", "Ready"),
                FleetFixtures.bundleDeployment("default", "c2", "my-app-web", "ErrApplied"))));

        provider(cluster).run();

        String deploymentC1 = "resource:cluster-fleet-default-c1/my-app-web-c1";
        String deploymentC2 = "resource:cluster-fleet-default-c2/my-app-web-c2";
        CatalogEntity component = entity("component:fleet-default/my-app-web");
        assertThat(component.getSpec().getSystem()).isEqualTo("system:fleet-default/my-app");
        assertThat(component.getSpec().getDependsOn()).containsExactlyInAnyOrder(deploymentC1, deploymentC2);
        assertThat(component.getMetadata().getAnnotations())
                .containsEntry(FleetAnnotations.DEPLOYMENT_STATUS, "ErrApplied");

        assertThat(entity(deploymentC1).getSpec().getDependsOn())
                .containsExactly("component:fleet-default/my-app-web", "resource:fleet-default/c1");
        assertThat(entity(deploymentC2).getSpec().getDependsOn())
                .containsExactly("component:fleet-default/my-app-web", "resource:fleet-default/c2");

        CatalogEntity clusterC1 = entity("resource:fleet-default/c1");
        assertThat(clusterC1.getSpec().getType()).isEqualTo("kubernetes-cluster");
        assertThat(clusterC1.getMetadata().getAnnotations()).containsEntry(FleetAnnotations.PRIMARY_WORKSPACE, "true");
        assertThat(entity("resource:fleet-default/c2")).isNotNull();
        assertThat(lastEntities()).hasSize(7);
    }

    @Test
    void run_shouldApplyFleetYamlOwner() {
        FleetClusterConfig cluster = FleetFixtures.cluster("mgmt", "fleet-default");
        cluster.setFetchFleetYaml(true);
        cluster.setGenerateApis(true);
        GitRepo gitRepo = FleetFixtures.gitRepo("fleet-default", "my-app", REPO_URL, "Ready");
        when(client.listGitRepos(eq("fleet-default"), any())).thenReturn(FetchResult.success(List.of(gitRepo)));
        when(fleetYamlFetcher.fetch(gitRepo)).thenReturn(Optional.of(FleetYaml.builder()
                .backstage(FleetYamlBackstage.builder()
                        .owner("team-platform")
                        .providesApis(List.of(FleetYamlApiDefinition.builder().name("my-app-api").build()))
                        .build())
                .build()));

        provider(cluster).run();

        assertThat(entity("system:fleet-default/my-app").getSpec().getOwner()).isEqualTo("team-platform");
        assertThat(entity("api:fleet-default/my-app-api").getSpec().getOwner()).isEqualTo("team-platform");
    }

    @Test
    void run_shouldIgnoreFleetYamlWhenFetchDisabled() {
        GitRepo gitRepo = FleetFixtures.gitRepo("fleet-default", "my-app", REPO_URL, "Ready");
        when(client.listGitRepos(eq("fleet-default"), any())).thenReturn(FetchResult.success(List.of(gitRepo)));
        when(fleetYamlFetcher.fetch(gitRepo)).thenReturn(Optional.of(FleetYaml.builder()
                .backstage(FleetYamlBackstage.builder().owner("team-platform").build())
                .build()));

        provider(FleetFixtures.cluster("mgmt", "fleet-default")).run();

        assertThat(entity("system:fleet-default/my-app").getSpec().getOwner()).isEqualTo("group:default/acme");
    }

    @Test
    void run_shouldKeepFirstEntityForDuplicateKeys() {
        when(client.listGitRepos(eq("fleet-default"), any())).thenReturn(FetchResult.success(List.of(
                FleetFixtures.gitRepo("fleet-default", "My_App", "https://github.com/first/my-app", "Ready"),
                FleetFixtures.gitRepo("fleet-default", "my-app", "https://github.com/second/my-app", "Ready"))));

        provider(FleetFixtures.cluster("mgmt", "fleet-default"), FleetFixtures.cluster("mgmt", "fleet-default")).run();

        assertThat(kinds()).containsExactly("Domain", "System");
        assertThat(entity("system:fleet-default/my-app").getMetadata().getAnnotations())
                .containsEntry(FleetAnnotations.REPO, "https://github.com/first/my-app");
    }

    @Test
    void run_shouldBeIdempotentForUnchangedUpstream() {
        FleetClusterConfig cluster = FleetFixtures.cluster("mgmt", "fleet-default");
        cluster.setIncludeBundleDeployments(true);
        when(client.listGitRepos(eq("fleet-default"), any()))
                .thenReturn(FetchResult.success(List.of(FleetFixtures.gitRepo("fleet-default", "my-app", REPO_URL, "Ready"))));
        when(client.listBundlesForGitRepo("fleet-default", "my-app"))
                .thenAnswer(invocation -> FetchResult.success(List.of(FleetFixtures.bundle("fleet-default", "my-app-web", "my-app", "Ready"))));
        when(client.listBundleDeploymentsForBundle("my-app-web"))
                .thenAnswer(invocation -> FetchResult.success(List.of(FleetFixtures.bundleDeployment("default", "c1", "my-app-web", "Ready"))));
        FleetEntityProvider provider = provider(cluster);

        provider.run();
        List<CatalogEntity> first = lastEntities();
        provider.run();
        List<CatalogEntity> second = lastEntities();

        assertThat(applied).hasSize(2);
        assertThat(second).containsExactlyInAnyOrderElementsOf(first);
    }

    @Test
    void run_shouldTolerateCollaboratorFailures() {
        when(client.listGitRepos(eq("fleet-default"), any()))
                .thenReturn(FetchResult.success(List.of(FleetFixtures.gitRepo("fleet-default", "my-app", REPO_URL, "Ready"))));
        when(client.listBundlesForGitRepo("fleet-default", "my-app"))
                .thenReturn(FetchResult.failure(new FleetApiException("bundles unavailable")));
        when(client.listGitRepos(eq("fleet-local"), any()))
                .thenReturn(FetchResult.failure(new FleetApiException("forbidden")));

        provider(FleetFixtures.cluster("mgmt", "fleet-default", "fleet-local")).run();

        assertThat(kinds()).containsExactly("Domain", "System");
    }

    @Test
    void run_shouldEmitNothingWhenPassFails() {
        when(topologyCollector.collect(anyBoolean())).thenThrow(new IllegalStateException("topology exploded"));
        FleetEntityProvider provider = provider(FleetFixtures.cluster("mgmt", "fleet-default"));

        assertThatThrownBy(provider::run).isInstanceOf(IllegalStateException.class).hasMessage("topology exploded");
        assertThat(applied).isEmpty();
        assertThat(provider.getState()).isEqualTo(ProviderState.CONNECTED);
        assertThat(provider.getLastResult()).isEqualTo(ProviderState.FAILED);
    }

    @Test
    void run_shouldAbortWithoutEmittingWhenInterrupted() {
        when(topologyCollector.collect(anyBoolean())).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            return ClusterTopology.degraded();
        });
        FleetEntityProvider provider = provider(FleetFixtures.cluster("mgmt", "fleet-default"));

        try {
            assertThatThrownBy(provider::run)
                    .isInstanceOf(FleetSyncException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(applied).isEmpty();
        assertThat(provider.getLastResult()).isEqualTo(ProviderState.FAILED);
    }

    @Test
    void run_shouldRethrowClusterFetchFailure() {
        FleetClusterConfig broken = FleetFixtures.cluster("broken", "fleet-default");
        when(clientFactory.createResourceClient(broken)).thenThrow(new FleetApiException("invalid CA data"));
        FleetEntityProvider provider = provider(FleetFixtures.cluster("mgmt", "fleet-default"), broken);

        assertThatThrownBy(provider::run).isInstanceOf(FleetApiException.class).hasMessage("invalid CA data");
        assertThat(applied).isEmpty();
        assertThat(provider.getState()).isEqualTo(ProviderState.CONNECTED);
        assertThat(provider.getLastResult()).isEqualTo(ProviderState.FAILED);
    }

    @Test
    void run_shouldResolveClusterNamesFromFleetClustersInDegradedMode() {
        FleetClusterConfig cluster = FleetFixtures.cluster("mgmt", "fleet-default");
        cluster.setIncludeBundleDeployments(true);
        FleetCluster fleetCluster = new FleetCluster();
        fleetCluster.setMetadata(new ObjectMetaBuilder()
                .withNamespace("fleet-default")
                .withName("c-abcde")
                .addToLabels(FleetResources.LABEL_MANAGEMENT_CLUSTER_NAME, "c-m-xyz")
                .addToLabels(FleetResources.LABEL_CLUSTER_DISPLAY_NAME, "Prod")
                .build());
        when(client.listClusters("fleet-default")).thenReturn(FetchResult.success(List.of(fleetCluster)));
        when(client.listGitRepos(eq("fleet-default"), any()))
                .thenReturn(FetchResult.success(List.of(FleetFixtures.gitRepo("fleet-default", "my-app", REPO_URL, "Ready"))));
        when(client.listBundlesForGitRepo("fleet-default", "my-app"))
                .thenReturn(FetchResult.success(List.of(FleetFixtures.bundle("fleet-default", "my-app-web", "my-app", "Ready"))));
        when(client.listBundleDeploymentsForBundle("my-app-web")).thenReturn(FetchResult.success(List.of(
                FleetFixtures.bundleDeployment("default", "c-abcde-0123456789ab", "my-app-web", "Ready"))));

        provider(cluster).run();

        CatalogEntity clusterResource = entity("resource:fleet-default/prod");
        assertThat(clusterResource.getMetadata().getAnnotations()).containsEntry(FleetAnnotations.CLUSTER_ID, "c-m-xyz");
        assertThat(lastEntities())
                .filteredOn(entity -> "fleet-deployment".equals(entity.getSpec().getType()))
                .singleElement()
                .satisfies(deployment -> assertThat(deployment.getSpec().getDependsOn())
                        .contains("resource:fleet-default/prod"));
    }

    @Test
    void run_shouldPreferFirstConfiguredClusterNameInDegradedMode() {
        FleetClusterConfig first = FleetFixtures.cluster("mgmt-a", "fleet-default");
        first.setIncludeBundleDeployments(true);
        FleetClusterConfig second = FleetFixtures.cluster("mgmt-b", "fleet-default");
        FleetResourceClient secondClient = mock(FleetResourceClient.class);
        when(clientFactory.createResourceClient(second)).thenReturn(secondClient);
        when(secondClient.listGitRepos(anyString(), any())).thenReturn(FetchResult.success(Collections.emptyList()));
        when(secondClient.listClusters("fleet-default"))
                .thenReturn(FetchResult.success(List.of(fleetCluster("c-abcde", "c-m-xyz", "Prod B"))));
        // 첫 번째 관리 클러스터가 늦게 응답해도 설정 순서가 이겨야 한다
        when(client.listClusters("fleet-default")).thenAnswer(invocation -> {
            Thread.sleep(200);
            return FetchResult.success(List.of(fleetCluster("c-abcde", "c-m-xyz", "Prod A")));
        });
        when(client.listGitRepos(eq("fleet-default"), any()))
                .thenReturn(FetchResult.success(List.of(FleetFixtures.gitRepo("fleet-default", "my-app", REPO_URL, "Ready"))));
        when(client.listBundlesForGitRepo("fleet-default", "my-app"))
                .thenReturn(FetchResult.success(List.of(FleetFixtures.bundle("fleet-default", "my-app-web", "my-app", "Ready"))));
        when(client.listBundleDeploymentsForBundle("my-app-web")).thenReturn(FetchResult.success(List.of(
                FleetFixtures.bundleDeployment("default", "c-abcde-0123456789ab", "my-app-web", "Ready"))));

        provider(first, second).run();

        assertThat(entity("resource:fleet-default/prod-a").getMetadata().getAnnotations())
                .containsEntry(FleetAnnotations.CLUSTER_ID, "c-m-xyz");
        assertThat(lastEntities()).noneMatch(entity -> "prod-b".equals(entity.getMetadata().getName()));
    }

    private static FleetCluster fleetCluster(String name, String rancherId, String displayName) {
        FleetCluster fleetCluster = new FleetCluster();
        fleetCluster.setMetadata(new ObjectMetaBuilder()
                .withNamespace("fleet-default")
                .withName(name)
                .addToLabels(FleetResources.LABEL_MANAGEMENT_CLUSTER_NAME, rancherId)
                .addToLabels(FleetResources.LABEL_CLUSTER_DISPLAY_NAME, displayName)
                .build());
        return fleetCluster;
    }

    @Test
    void run_shouldEmitTopologyOnlyClustersAndInventory() {
        ClusterTopology topology = new ClusterTopology(false);
        topology.registerCluster("c-m-idle", "Idle", ClusterStats.builder()
                .clusterId("c-m-idle").workspace("fleet-default").nodeCount(1).build());
        topology.addInventory("c-m-idle", List.of(InventoryItem.builder().type(InventoryItem.TYPE_NODE).name("node-0").build()));
        when(topologyCollector.collect(true)).thenReturn(topology);
        FleetEntityProvider provider = new FleetEntityProvider("test", List.of(FleetFixtures.cluster("mgmt", "fleet-default")),
                3, true, clientFactory, topologyCollector, fleetYamlFetcher);
        provider.connect(applied::add);

        provider.run();

        CatalogEntity idle = entity("resource:fleet-default/idle");
        assertThat(idle.getMetadata().getAnnotations())
                .containsEntry(FleetAnnotations.NODE_COUNT, "1")
                .containsEntry(FleetAnnotations.PRIMARY_WORKSPACE, "true");
        assertThat(entity("resource:fleet-default/idle-node-0").getSpec().getDependsOn())
                .containsExactly("resource:fleet-default/idle");
    }

    @Test
    void constructor_shouldDefaultToFleetDefaultNamespace() {
        FleetClusterConfig cluster = FleetFixtures.cluster("mgmt");

        FleetEntityProvider provider = provider(cluster);

        assertThat(provider.getClusters().get(0).getNamespaces())
                .extracting(FleetNamespaceConfig::getName)
                .containsExactly("fleet-default");
        assertThat(provider.getProviderName()).isEqualTo("fleet:test");
        assertThat(provider.getState()).isEqualTo(ProviderState.CONNECTED);
    }

    @Test
    void deduplicate_shouldKeepFirstOccurrence() {
        GitRepo first = FleetFixtures.gitRepo("fleet-default", "app", "https://github.com/a/app", "Ready");
        GitRepo second = FleetFixtures.gitRepo("fleet-default", "APP", "https://github.com/b/app", "Ready");
        MapperContext context = MapperContext.of(FleetFixtures.cluster("mgmt", "fleet-default"), "fleet:test");
        CatalogEntity a = FleetEntityMapper.toSystem(first, context);
        CatalogEntity b = FleetEntityMapper.toSystem(second, context);

        List<CatalogEntity> result = FleetEntityProvider.deduplicate(List.of(a, b, a));

        assertThat(result).containsExactly(a);
    }
}
