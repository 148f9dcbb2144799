package com.vibecoding.fleetcatalog.sync;

import com.vibecoding.fleetcatalog.client.FleetResourceClient;
import com.vibecoding.fleetcatalog.client.KubernetesClientFactory;
import com.vibecoding.fleetcatalog.client.LabelSelectors;
import com.vibecoding.fleetcatalog.exception.FleetProviderNotConnectedException;
import com.vibecoding.fleetcatalog.exception.FleetSyncException;
import com.vibecoding.fleetcatalog.mapper.FleetAnnotations;
import com.vibecoding.fleetcatalog.mapper.FleetEntityMapper;
import com.vibecoding.fleetcatalog.mapper.FleetNamespaces;
import com.vibecoding.fleetcatalog.mapper.MapperContext;
import com.vibecoding.fleetcatalog.model.FleetClusterConfig;
import com.vibecoding.fleetcatalog.model.FleetNamespaceConfig;
import com.vibecoding.fleetcatalog.model.FleetState;
import com.vibecoding.fleetcatalog.model.catalog.CatalogEntity;
import com.vibecoding.fleetcatalog.model.catalog.DeferredEntity;
import com.vibecoding.fleetcatalog.model.catalog.EntityBatch;
import com.vibecoding.fleetcatalog.model.catalog.EntityMutation;
import com.vibecoding.fleetcatalog.model.fleet.Bundle;
import com.vibecoding.fleetcatalog.model.fleet.BundleDeployment;
import com.vibecoding.fleetcatalog.model.fleet.FleetCluster;
import com.vibecoding.fleetcatalog.model.fleet.FleetResources;
import com.vibecoding.fleetcatalog.model.fleet.GitRepo;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYaml;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYamlApiDefinition;
import com.vibecoding.fleetcatalog.model.topology.ClusterStats;
import com.vibecoding.fleetcatalog.model.topology.InventoryItem;
import com.vibecoding.fleetcatalog.topology.ClusterTopology;
import com.vibecoding.fleetcatalog.topology.ClusterTopologyCollector;
import com.vibecoding.fleetcatalog.topology.ClusterWorkspaces;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Fleet GitOps 리소스를 카탈로그 엔티티로 동기화하는 provider
 *
 * run() 한 번이 전체 패스이며, 결과는 항상 full 스냅샷 하나로 내보낸다.
 * 상태는 DISCONNECTED → CONNECTED → RUNNING 이고, 패스가 끝나면 결과와 무관하게 CONNECTED 로 돌아온다.
 * 패스 도중 예외가 나면 아무 것도 내보내지 않고 호출자에게 다시 던진다.
 */
public class FleetEntityProvider {

    private static final Logger log = LoggerFactory.getLogger(FleetEntityProvider.class);

    public static final String LOCATION_PREFIX = "fleet:";

    private final String id;
    private final String locationKey;
    private final List<FleetClusterConfig> clusters;
    private final int concurrency;
    private final boolean includeNodes;
    private final KubernetesClientFactory clientFactory;
    private final ClusterTopologyCollector topologyCollector;
    private final FleetYamlFetcher fleetYamlFetcher;

    private volatile EntityProviderConnection connection;
    private volatile ProviderState state = ProviderState.DISCONNECTED;
    // 마지막 패스 결과 (SUCCEEDED / FAILED), 실행 전에는 null
    private volatile ProviderState lastResult;
    private volatile LocalDateTime lastSyncAt;
    private volatile int lastEntityCount;

    public FleetEntityProvider(String id, List<FleetClusterConfig> clusters, int concurrency, boolean includeNodes,
                               KubernetesClientFactory clientFactory, ClusterTopologyCollector topologyCollector,
                               FleetYamlFetcher fleetYamlFetcher) {
        this.id = id;
        this.locationKey = LOCATION_PREFIX + id;
        this.clusters = clusters.stream()
                .map(FleetEntityProvider::withDefaultNamespaces)
                .collect(Collectors.toUnmodifiableList());
        this.concurrency = Math.max(1, concurrency);
        this.includeNodes = includeNodes;
        this.clientFactory = clientFactory;
        this.topologyCollector = topologyCollector;
        this.fleetYamlFetcher = fleetYamlFetcher;
    }

    public String getId() {
        return id;
    }

    public String getProviderName() {
        return locationKey;
    }

    public List<FleetClusterConfig> getClusters() {
        return clusters;
    }

    public ProviderState getState() {
        return state;
    }

    public ProviderState getLastResult() {
        return lastResult;
    }

    public LocalDateTime getLastSyncAt() {
        return lastSyncAt;
    }

    public int getLastEntityCount() {
        return lastEntityCount;
    }

    public void connect(EntityProviderConnection connection) {
        this.connection = connection;
        if (state == ProviderState.DISCONNECTED) {
            state = ProviderState.CONNECTED;
        }
        log.info("Connected FleetEntityProvider[{}]", locationKey);
    }

    /**
     * 전체 동기화 패스
     *
     * @throws FleetProviderNotConnectedException connect() 전에 호출된 경우
     */
    public synchronized void run() {
        EntityProviderConnection target = this.connection;
        if (target == null) {
            throw new FleetProviderNotConnectedException(locationKey);
        }

        long startTime = System.currentTimeMillis();
        state = ProviderState.RUNNING;
        log.info("FleetEntityProvider[{}] starting sync", locationKey);

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(concurrency, clusters.size())));
        try {
            ClusterTopology topology = topologyCollector.collect(includeNodes);
            if (topology.isDegraded()) {
                // 이름 충돌 시 설정 순서상 앞선 관리 클러스터가 이기도록 fan-out 전에 순차 등록
                for (FleetClusterConfig cluster : clusters) {
                    try (FleetResourceClient client = clientFactory.createResourceClient(cluster)) {
                        registerFleetClusterNames(client, cluster, topology);
                    }
                }
            }

            List<CompletableFuture<EntityBatch>> futures = clusters.stream()
                    .map(cluster -> CompletableFuture.supplyAsync(() -> fetchCluster(cluster, topology), executor))
                    .collect(Collectors.toList());

            // 설정 순서대로 병합하여 first-seen 규칙이 실행 순서에 좌우되지 않게 한다
            EntityBatch batch = new EntityBatch();
            for (CompletableFuture<EntityBatch> future : futures) {
                batch.addAll(future.get());
            }
            addTopologyOnlyClusters(batch, topology);
            if (includeNodes) {
                addInventoryResources(batch, topology);
            }

            List<CatalogEntity> entities = deduplicate(batch.flatten());
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Sync interrupted before applying mutation");
            }
            target.applyMutation(EntityMutation.full(entities.stream()
                    .map(entity -> new DeferredEntity(entity, locationKey))
                    .collect(Collectors.toList())));

            lastSyncAt = LocalDateTime.now();
            lastEntityCount = entities.size();
            lastResult = ProviderState.SUCCEEDED;
            log.info("FleetEntityProvider[{}] sync completed in {}ms: {} domains, {} systems, {} components, "
                            + "{} resources, {} APIs ({} entities after dedup)",
                    locationKey, System.currentTimeMillis() - startTime,
                    batch.getDomains().size(), batch.getSystems().size(), batch.getComponents().size(),
                    batch.getResources().size(), batch.getApis().size(), entities.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lastResult = ProviderState.FAILED;
            log.warn("FleetEntityProvider[{}] sync interrupted, nothing applied", locationKey);
            throw new FleetSyncException("Sync interrupted for " + locationKey, e);
        } catch (ExecutionException e) {
            lastResult = ProviderState.FAILED;
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("FleetEntityProvider[{}] sync failed: {}", locationKey, cause.getMessage(), cause);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new FleetSyncException("Sync failed for " + locationKey, cause);
        } catch (RuntimeException e) {
            lastResult = ProviderState.FAILED;
            log.error("FleetEntityProvider[{}] sync failed: {}", locationKey, e.getMessage(), e);
            throw e;
        } finally {
            executor.shutdownNow();
            state = ProviderState.CONNECTED;
        }
    }

    // ==================== 관리 클러스터 ====================

    EntityBatch fetchCluster(FleetClusterConfig cluster, ClusterTopology topology) {
        log.debug("Fetching Fleet resources from cluster {}", cluster.getName());

        EntityBatch batch = new EntityBatch();
        MapperContext context = MapperContext.of(cluster, locationKey);
        batch.add(FleetEntityMapper.toDomain(context));

        ClusterWorkspaces workspaces = new ClusterWorkspaces();
        Map<String, String> observedNames = new LinkedHashMap<>();
        try (FleetResourceClient client = clientFactory.createResourceClient(cluster)) {
            for (FleetNamespaceConfig namespace : cluster.getNamespaces()) {
                fetchNamespace(client, cluster, namespace, context, topology, workspaces, observedNames, batch);
            }
        }

        topologyCollector.enrichDegraded(topology, workspaces.clusterIds(), includeNodes);

        for (String clusterId : workspaces.clusterIds()) {
            String primary = workspaces.primaryWorkspace(clusterId);
            ClusterStats stats = topology.getStats(clusterId).orElse(null);
            for (String workspace : workspaces.workspacesOf(clusterId)) {
                batch.add(FleetEntityMapper.toClusterResource(clusterId, observedNames.get(clusterId), workspace,
                        stats, workspace.equals(primary), context));
            }
        }

        log.debug("Cluster {} produced {} entities", cluster.getName(), batch.size());
        return batch;
    }

    /**
     * degraded 토폴로지일 때 Fleet Cluster CR 의 표시 이름 라벨로 이름을 보충
     */
    private void registerFleetClusterNames(FleetResourceClient client, FleetClusterConfig cluster,
                                           ClusterTopology topology) {
        for (FleetNamespaceConfig namespace : cluster.getNamespaces()) {
            for (FleetCluster fleetCluster : client.listClusters(namespace.getName()).getOrDefault(Collections.emptyList())) {
                ObjectMeta meta = fleetCluster.getMetadata();
                if (meta == null || meta.getName() == null) {
                    continue;
                }
                Map<String, String> labels = meta.getLabels() != null ? meta.getLabels() : Collections.emptyMap();
                String rancherId = labels.get(FleetResources.LABEL_MANAGEMENT_CLUSTER_NAME);
                String clusterId = rancherId != null ? rancherId : meta.getName();
                String displayName = labels.get(FleetResources.LABEL_CLUSTER_DISPLAY_NAME);
                topology.registerName(clusterId, displayName != null ? displayName : meta.getName());
                topology.registerAlias(meta.getName(), clusterId);
            }
        }
    }

    // ==================== 네임스페이스 / GitRepo ====================

    private void fetchNamespace(FleetResourceClient client, FleetClusterConfig cluster, FleetNamespaceConfig namespace,
                                MapperContext context, ClusterTopology topology, ClusterWorkspaces workspaces,
                                Map<String, String> observedNames, EntityBatch batch) {
        // 클러스터 단위 selector 가 네임스페이스 selector 보다 우선
        String labelSelector = LabelSelectors.selectorToString(
                cluster.getGitRepoSelector() != null ? cluster.getGitRepoSelector() : namespace.getLabelSelector());
        log.debug("Fetching GitRepos from {}/{} (selector: {})",
                cluster.getName(), namespace.getName(), labelSelector != null ? labelSelector : "none");

        List<GitRepo> gitRepos = client.listGitRepos(namespace.getName(), labelSelector)
                .getOrDefault(Collections.emptyList());
        log.debug("Found {} GitRepos in {}", gitRepos.size(), namespace.getName());

        for (GitRepo gitRepo : gitRepos) {
            processGitRepo(client, cluster, gitRepo, context, topology, workspaces, observedNames, batch);
        }
    }

    private void processGitRepo(FleetResourceClient client, FleetClusterConfig cluster, GitRepo gitRepo,
                                MapperContext context, ClusterTopology topology, ClusterWorkspaces workspaces,
                                Map<String, String> observedNames, EntityBatch batch) {
        String gitRepoName = gitRepo.getMetadata().getName();
        String namespace = gitRepo.getMetadata().getNamespace() != null
                ? gitRepo.getMetadata().getNamespace()
                : FleetNamespaces.DEFAULT_WORKSPACE;

        FleetYaml fleetYaml = cluster.isFetchFleetYaml() ? fleetYamlFetcher.fetch(gitRepo).orElse(null) : null;
        MapperContext repoContext = context.withFleetYaml(fleetYaml);

        CatalogEntity system = FleetEntityMapper.toSystem(gitRepo, repoContext);
        batch.add(system);

        if (cluster.isGenerateApis() && fleetYaml != null && fleetYaml.getBackstage() != null
                && fleetYaml.getBackstage().getProvidesApis() != null) {
            for (FleetYamlApiDefinition api : fleetYaml.getBackstage().getProvidesApis()) {
                batch.add(FleetEntityMapper.toApi(api, gitRepo, repoContext));
            }
        }

        if (!cluster.isIncludeBundles()) {
            return;
        }
        List<Bundle> bundles = client.listBundlesForGitRepo(namespace, gitRepoName)
                .getOrDefault(Collections.emptyList());
        log.debug("Found {} Bundles for GitRepo {}", bundles.size(), gitRepoName);

        for (Bundle bundle : bundles) {
            processBundle(client, cluster, bundle, repoContext, system.getRef(), topology, workspaces, observedNames, batch);
        }
    }

    // ==================== Bundle / BundleDeployment ====================

    private void processBundle(FleetResourceClient client, FleetClusterConfig cluster, Bundle bundle,
                               MapperContext context, String systemRef, ClusterTopology topology,
                               ClusterWorkspaces workspaces, Map<String, String> observedNames, EntityBatch batch) {
        CatalogEntity component = FleetEntityMapper.toComponent(bundle, context);
        batch.add(component);

        if (!cluster.isIncludeBundleDeployments()) {
            return;
        }
        String bundleName = bundle.getMetadata().getName();
        List<BundleDeployment> deployments = client.listBundleDeploymentsForBundle(bundleName)
                .getOrDefault(Collections.emptyList());
        log.debug("Found {} BundleDeployments for Bundle {}", deployments.size(), bundleName);

        List<String> states = new ArrayList<>();
        for (BundleDeployment deployment : deployments) {
            ObjectMeta meta = deployment.getMetadata();
            String namespace = meta != null ? meta.getNamespace() : null;
            Optional<String> clusterId = FleetNamespaces.extractClusterId(namespace)
                    .or(() -> Optional.ofNullable(meta != null && meta.getLabels() != null
                            ? meta.getLabels().get(FleetResources.LABEL_CLUSTER)
                            : null));
            if (clusterId.isEmpty()) {
                log.debug("Skipping BundleDeployment {}/{}: no target cluster",
                        namespace, meta != null ? meta.getName() : null);
                continue;
            }

            String rawId = clusterId.get();
            String clusterName = topology.resolveClusterName(rawId).orElse(null);
            CatalogEntity resource = FleetEntityMapper.toDeploymentResource(deployment, rawId, clusterName,
                    systemRef, context);
            batch.add(resource);

            if (!component.getSpec().getDependsOn().contains(resource.getRef())) {
                component.getSpec().getDependsOn().add(resource.getRef());
            }
            states.add(FleetEntityMapper.deploymentStateOf(deployment));

            String clusterKey = topology.canonicalId(rawId).orElse(rawId);
            observedNames.putIfAbsent(clusterKey, clusterName != null ? clusterName : rawId);
            workspaces.observe(clusterKey, FleetNamespaces.extractWorkspace(namespace)
                    .orElse(FleetEntityMapper.DEFAULT_NAMESPACE));
        }

        if (!states.isEmpty()) {
            component.getMetadata().getAnnotations()
                    .put(FleetAnnotations.DEPLOYMENT_STATUS, FleetState.worstOf(states));
        }
    }

    // ==================== 토폴로지 ====================

    /**
     * BundleDeployment 로 관찰되지 않은 클러스터도 Rancher 워크스페이스에 Resource 로 남긴다
     */
    private void addTopologyOnlyClusters(EntityBatch batch, ClusterTopology topology) {
        Set<String> tags = new HashSet<>();
        batch.getResources().forEach(resource -> tags.addAll(resource.getMetadata().getTags()));

        MapperContext context = MapperContext.builder().locationKey(locationKey).build();
        for (String clusterId : topology.knownClusterIds()) {
            if (tags.contains(FleetEntityMapper.clusterTag(clusterId))) {
                continue;
            }
            ClusterStats stats = topology.getStats(clusterId).orElse(null);
            String workspace = stats != null && stats.getWorkspace() != null
                    ? stats.getWorkspace()
                    : FleetNamespaces.DEFAULT_WORKSPACE;
            batch.add(FleetEntityMapper.toClusterResource(clusterId, topology.resolveClusterName(clusterId).orElse(null),
                    workspace, stats, true, context));
        }
    }

    private void addInventoryResources(EntityBatch batch, ClusterTopology topology) {
        MapperContext context = MapperContext.builder().locationKey(locationKey).build();
        for (String clusterId : topology.inventoryClusterIds()) {
            Optional<CatalogEntity> clusterResource = findClusterResource(batch, clusterId);
            if (clusterResource.isEmpty()) {
                log.debug("No cluster resource for inventory of {}", clusterId);
                continue;
            }
            for (InventoryItem item : topology.getInventory(clusterId)) {
                batch.add(FleetEntityMapper.toInventoryResource(item, clusterId, clusterResource.get(), context));
            }
        }
    }

    /**
     * 주 워크스페이스의 클러스터 Resource 우선
     */
    private static Optional<CatalogEntity> findClusterResource(EntityBatch batch, String clusterId) {
        String tag = FleetEntityMapper.clusterTag(clusterId);
        List<CatalogEntity> candidates = batch.getResources().stream()
                .filter(resource -> resource.getMetadata().getTags().contains(tag))
                .collect(Collectors.toList());
        return candidates.stream()
                .filter(resource -> "true".equals(resource.getMetadata().getAnnotations().get(FleetAnnotations.PRIMARY_WORKSPACE)))
                .findFirst()
                .or(() -> candidates.stream().findFirst());
    }

    private static FleetClusterConfig withDefaultNamespaces(FleetClusterConfig cluster) {
        if (cluster.getNamespaces() == null || cluster.getNamespaces().isEmpty()) {
            cluster.setNamespaces(new ArrayList<>(List.of(FleetNamespaceConfig.of(FleetNamespaces.DEFAULT_WORKSPACE))));
        }
        return cluster;
    }

    // ==================== 중복 제거 ====================

    /**
     * (kind, namespace, name) 기준 중복 제거, 처음 나온 엔티티를 유지
     */
    static List<CatalogEntity> deduplicate(List<CatalogEntity> entities) {
        Map<String, CatalogEntity> seen = new LinkedHashMap<>();
        for (CatalogEntity entity : entities) {
            String ref = entity.getRef();
            CatalogEntity existing = seen.putIfAbsent(ref, entity);
            if (existing != null && !existing.equals(entity)) {
                log.warn("Dropping duplicate entity {} that differs from the first occurrence", ref);
            }
        }
        return new ArrayList<>(seen.values());
    }
}
