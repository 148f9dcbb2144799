package com.vibecoding.fleetcatalog.mapper;

import com.vibecoding.fleetcatalog.model.FleetClusterConfig;
import com.vibecoding.fleetcatalog.model.FleetNamespaceConfig;
import com.vibecoding.fleetcatalog.model.FleetState;
import com.vibecoding.fleetcatalog.model.catalog.CatalogEntity;
import com.vibecoding.fleetcatalog.model.catalog.EntityKind;
import com.vibecoding.fleetcatalog.model.catalog.EntityLink;
import com.vibecoding.fleetcatalog.model.catalog.EntityMetadata;
import com.vibecoding.fleetcatalog.model.catalog.EntityRef;
import com.vibecoding.fleetcatalog.model.catalog.EntitySpec;
import com.vibecoding.fleetcatalog.model.fleet.AppliedResource;
import com.vibecoding.fleetcatalog.model.fleet.Bundle;
import com.vibecoding.fleetcatalog.model.fleet.BundleDependsOn;
import com.vibecoding.fleetcatalog.model.fleet.BundleDeployment;
import com.vibecoding.fleetcatalog.model.fleet.BundleDeploymentStatus;
import com.vibecoding.fleetcatalog.model.fleet.BundleSpec;
import com.vibecoding.fleetcatalog.model.fleet.BundleStatus;
import com.vibecoding.fleetcatalog.model.fleet.FleetResources;
import com.vibecoding.fleetcatalog.model.fleet.FleetTarget;
import com.vibecoding.fleetcatalog.model.fleet.GitRepo;
import com.vibecoding.fleetcatalog.model.fleet.GitRepoSpec;
import com.vibecoding.fleetcatalog.model.fleet.GitRepoStatus;
import com.vibecoding.fleetcatalog.model.fleet.HelmOptions;
import com.vibecoding.fleetcatalog.model.fleet.StatusDisplay;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYaml;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYamlApiDefinition;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYamlBackstage;
import com.vibecoding.fleetcatalog.model.topology.ClusterStats;
import com.vibecoding.fleetcatalog.model.topology.InventoryItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.ObjectMeta;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fleet 리소스 -> 카탈로그 엔티티 변환
 *
 * 모든 메서드는 순수 함수이며 같은 입력에 같은 엔티티를 만든다.
 * fleet.yaml 의 annotation override 는 항상 마지막에 적용된다.
 */
public final class FleetEntityMapper {

    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_BRANCH = "main";
    public static final String UNKNOWN_STATUS = "Unknown";

    public static final String PLATFORM_OWNER = "platform-team";
    public static final String UNKNOWN_OWNER = "unknown";
    public static final String FALLBACK_GROUP_OWNER = "group:default/default";

    public static final String TYPE_SERVICE = "service";
    public static final String TYPE_FLEET_DEPLOYMENT = "fleet-deployment";
    public static final String TYPE_KUBERNETES_CLUSTER = "kubernetes-cluster";
    public static final String DEFAULT_API_TYPE = "openapi";

    public static final int DEPLOYMENT_NAME_MAX_LENGTH = 50;
    public static final int MESSAGE_MAX_LENGTH = 500;

    private static final String CLUSTER_TAG_PREFIX = "fleet-cluster-";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private FleetEntityMapper() {
    }

    // ==================== Domain ====================

    /**
     * 관리 클러스터 -> Domain
     */
    public static CatalogEntity toDomain(MapperContext ctx) {
        FleetClusterConfig cluster = ctx.getCluster();
        String url = cluster.getUrl();

        Map<String, String> annotations = locationAnnotations(ctx);
        annotations.put(FleetAnnotations.CLUSTER, nullToEmpty(cluster.getName()));
        annotations.put(FleetAnnotations.URL, nullToEmpty(url));
        annotations.put(FleetAnnotations.NAMESPACES, cluster.getNamespaces().stream()
                .map(FleetNamespaceConfig::getName)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(",")));
        applyOverrides(annotations, ctx.getFleetYaml());

        List<EntityLink> links = new ArrayList<>();
        if (url != null) {
            links.add(new EntityLink(url, "Rancher Fleet"));
        }

        return entity(EntityKind.DOMAIN,
                EntityMetadata.builder()
                        .name(EntityNames.toSafeName(cluster.getName()))
                        .namespace(DEFAULT_NAMESPACE)
                        .description("Fleet Rancher Cluster: " + hostOf(url))
                        .annotations(annotations)
                        .tags(new ArrayList<>(List.of("fleet", "rancher", "gitops")))
                        .links(links)
                        .build(),
                EntitySpec.builder()
                        .owner(PLATFORM_OWNER)
                        .build());
    }

    // ==================== System ====================

    /**
     * GitRepo -> System
     */
    public static CatalogEntity toSystem(GitRepo gitRepo, MapperContext ctx) {
        ObjectMeta meta = metaOf(gitRepo.getMetadata());
        GitRepoSpec spec = gitRepo.getSpec() != null ? gitRepo.getSpec() : new GitRepoSpec();
        Optional<StatusDisplay> display = Optional.ofNullable(gitRepo.getStatus()).map(GitRepoStatus::getDisplay);
        FleetYaml fleetYaml = ctx.getFleetYaml();
        FleetYamlBackstage backstage = backstageOf(fleetYaml);

        String gitRepoName = meta.getName();
        String fleetNamespace = meta.getNamespace() != null ? meta.getNamespace() : FleetNamespaces.DEFAULT_WORKSPACE;
        String entityNamespace = EntityNames.toEntityNamespace(fleetNamespace);
        String repo = spec.getRepo();
        String branch = spec.getBranch() != null ? spec.getBranch() : DEFAULT_BRANCH;
        String status = display.map(StatusDisplay::getState).orElse(UNKNOWN_STATUS);

        Map<String, String> annotations = locationAnnotations(ctx);
        annotations.put(FleetAnnotations.REPO, nullToEmpty(repo));
        annotations.put(FleetAnnotations.BRANCH, branch);
        annotations.put(FleetAnnotations.NAMESPACE, fleetNamespace);
        annotations.put(FleetAnnotations.CLUSTER, nullToEmpty(ctx.getClusterName()));
        annotations.put(FleetAnnotations.STATUS, status);
        display.map(StatusDisplay::getReadyClusters)
                .ifPresent(ready -> annotations.put(FleetAnnotations.READY_CLUSTERS, ready));
        List<String> targets = targetNames(spec.getTargets());
        if (!targets.isEmpty()) {
            annotations.put(FleetAnnotations.TARGETS, toJsonArray(targets));
        }
        if (hasText(repo)) {
            annotations.put(FleetAnnotations.SOURCE_LOCATION, "url:" + repo);
        }
        annotations.put(FleetAnnotations.KUBERNETES_ID, nullToEmpty(gitRepoName));
        annotations.put(FleetAnnotations.KUBERNETES_NAMESPACE, resolveSystemKubernetesNamespace(gitRepo, fleetYaml));
        annotations.put(FleetAnnotations.KUBERNETES_LABEL_SELECTOR, "app.kubernetes.io/name=" + nullToEmpty(gitRepoName));
        applyOverrides(annotations, fleetYaml);

        // override 로 이미 지정된 경우 유지
        if (ctx.isAutoTechdocsRef() && hasText(repo) && !annotations.containsKey(FleetAnnotations.TECHDOCS_REF)) {
            annotations.put(FleetAnnotations.TECHDOCS_REF, techdocsRef(repo, branch));
        }

        List<EntityLink> links = new ArrayList<>();
        if (hasText(repo)) {
            links.add(new EntityLink(repo, "Git Repository"));
        }

        List<String> dependsOn = new ArrayList<>();
        if (backstage != null && backstage.getDependsOn() != null) {
            dependsOn.addAll(backstage.getDependsOn());
        }
        if (fleetYaml != null) {
            dependsOn.addAll(dependsOnRefs(fleetYaml.getDependsOn(), EntityKind.COMPONENT, entityNamespace));
        }

        List<String> providesApis = new ArrayList<>();
        List<String> consumesApis = new ArrayList<>();
        if (backstage != null) {
            if (backstage.getProvidesApis() != null) {
                for (FleetYamlApiDefinition api : backstage.getProvidesApis()) {
                    providesApis.add(EntityRef.of(EntityKind.API, entityNamespace, EntityNames.toSafeName(api.getName())));
                }
            }
            if (backstage.getConsumesApis() != null) {
                consumesApis.addAll(backstage.getConsumesApis());
            }
        }

        return entity(EntityKind.SYSTEM,
                EntityMetadata.builder()
                        .name(EntityNames.toSafeName(gitRepoName))
                        .namespace(entityNamespace)
                        .description(resolveSystemDescription(meta, backstage, repo))
                        .annotations(annotations)
                        .tags(mergeTags(List.of("fleet", "gitops"), backstage))
                        .links(links)
                        .build(),
                EntitySpec.builder()
                        .owner(resolveSystemOwner(backstage, repo))
                        .lifecycle(FleetState.toLifecycle(status))
                        .domain(EntityRef.of(EntityKind.DOMAIN, DEFAULT_NAMESPACE, EntityNames.toSafeName(ctx.getClusterName())))
                        .dependsOn(distinct(dependsOn))
                        .providesApis(distinct(providesApis))
                        .consumesApis(distinct(consumesApis))
                        .build());
    }

    // ==================== Component ====================

    /**
     * Bundle -> Component
     */
    public static CatalogEntity toComponent(Bundle bundle, MapperContext ctx) {
        ObjectMeta meta = metaOf(bundle.getMetadata());
        BundleSpec spec = bundle.getSpec() != null ? bundle.getSpec() : new BundleSpec();
        Optional<StatusDisplay> display = Optional.ofNullable(bundle.getStatus()).map(BundleStatus::getDisplay);
        Map<String, String> labels = labelsOf(meta);
        FleetYaml fleetYaml = ctx.getFleetYaml();
        FleetYamlBackstage backstage = backstageOf(fleetYaml);

        String bundleName = meta.getName();
        String fleetNamespace = meta.getNamespace() != null ? meta.getNamespace() : FleetNamespaces.DEFAULT_WORKSPACE;
        String entityNamespace = EntityNames.toEntityNamespace(fleetNamespace);
        String status = display.map(StatusDisplay::getState).orElse(UNKNOWN_STATUS);
        String repoName = labels.get(FleetResources.LABEL_REPO_NAME);
        String systemRef = repoName != null
                ? EntityRef.of(EntityKind.SYSTEM, entityNamespace, EntityNames.toSafeName(repoName))
                : null;

        Map<String, String> annotations = locationAnnotations(ctx);
        annotations.put(FleetAnnotations.STATUS, status);
        annotations.put(FleetAnnotations.CLUSTER, nullToEmpty(ctx.getClusterName()));
        if (repoName != null) {
            annotations.put(FleetAnnotations.REPO_NAME, repoName);
            annotations.put(FleetAnnotations.SOURCE_GITREPO, repoName);
        }
        String bundlePath = labels.get(FleetResources.LABEL_BUNDLE_PATH);
        if (bundlePath != null) {
            annotations.put(FleetAnnotations.BUNDLE_PATH, bundlePath);
        }
        display.map(StatusDisplay::getReadyClusters)
                .ifPresent(ready -> annotations.put(FleetAnnotations.READY_CLUSTERS, ready));
        annotations.put(FleetAnnotations.KUBERNETES_ID, nullToEmpty(bundleName));
        annotations.put(FleetAnnotations.KUBERNETES_NAMESPACE, resolveBundleTargetNamespace(spec, fleetYaml));
        String selector = resolveBundleLabelSelector(bundleName, labels, spec, fleetYaml);
        if (selector != null) {
            annotations.put(FleetAnnotations.KUBERNETES_LABEL_SELECTOR, selector);
        }
        applyOverrides(annotations, fleetYaml);
        if (systemRef != null) {
            annotations.putIfAbsent(FleetAnnotations.TECHDOCS_ENTITY, systemRef);
        }

        List<String> dependsOn = new ArrayList<>(dependsOnRefs(spec.getDependsOn(), EntityKind.RESOURCE, entityNamespace));
        if (fleetYaml != null) {
            dependsOn.addAll(dependsOnRefs(fleetYaml.getDependsOn(), EntityKind.RESOURCE, entityNamespace));
        }

        String description = backstage != null && backstage.getDescription() != null
                ? backstage.getDescription()
                : "Fleet Bundle: " + bundleName;

        return entity(EntityKind.COMPONENT,
                EntityMetadata.builder()
                        .name(EntityNames.toSafeName(bundleName))
                        .namespace(entityNamespace)
                        .description(description)
                        .annotations(annotations)
                        .tags(mergeTags(List.of("fleet", "fleet-bundle"), backstage))
                        .build(),
                EntitySpec.builder()
                        .type(backstage != null && backstage.getType() != null ? backstage.getType() : TYPE_SERVICE)
                        .lifecycle(backstage != null && backstage.getLifecycle() != null
                                ? backstage.getLifecycle()
                                : FleetState.toLifecycle(status))
                        .owner(backstageOwner(backstage))
                        .system(systemRef)
                        .dependsOn(distinct(dependsOn))
                        .build());
    }

    // ==================== Resource: BundleDeployment ====================

    /**
     * BundleDeployment -> Resource (type fleet-deployment)
     *
     * @param clusterId   다운스트림 클러스터 ID
     * @param clusterName 친숙한 이름 (없으면 clusterId 사용)
     * @param systemRef   상위 System 참조 (없으면 null)
     */
    public static CatalogEntity toDeploymentResource(BundleDeployment deployment, String clusterId,
                                                     String clusterName, String systemRef, MapperContext ctx) {
        ObjectMeta meta = metaOf(deployment.getMetadata());
        Map<String, String> labels = labelsOf(meta);
        Optional<BundleDeploymentStatus> deploymentStatus = Optional.ofNullable(deployment.getStatus());
        Optional<StatusDisplay> display = deploymentStatus.map(BundleDeploymentStatus::getDisplay);

        String deploymentName = meta.getName() != null ? meta.getName() : "fleet-bundle-deployment";
        String fleetNamespace = meta.getNamespace() != null ? meta.getNamespace() : FleetNamespaces.DEFAULT_WORKSPACE;
        String originalName = deploymentName + "-" + clusterId;
        String clusterDisplayName = clusterName != null ? clusterName : clusterId;
        String clusterResourceName = EntityNames.toSafeName(clusterDisplayName);
        String status = deploymentStateOf(deployment);

        Optional<String> workspace = FleetNamespaces.extractWorkspace(fleetNamespace);
        String clusterNamespace = EntityNames.toEntityNamespace(workspace.orElse(DEFAULT_NAMESPACE));

        Map<String, String> annotations = locationAnnotations(ctx);
        annotations.put(FleetAnnotations.STATUS, status);
        annotations.put(FleetAnnotations.CLUSTER, nullToEmpty(clusterId));
        annotations.put(FleetAnnotations.BUNDLE_DEPLOYMENT, deploymentName);
        annotations.put(FleetAnnotations.ORIGINAL_NAME, originalName);
        annotations.put(FleetAnnotations.TARGET_CLUSTER_ID, nullToEmpty(clusterId));
        display.map(StatusDisplay::getMessage)
                .filter(FleetEntityMapper::hasText)
                .ifPresent(message -> annotations.put(FleetAnnotations.MESSAGE, truncate(message, MESSAGE_MAX_LENGTH)));
        List<AppliedResource> applied = deploymentStatus.map(BundleDeploymentStatus::getResources).orElse(Collections.emptyList());
        if (!applied.isEmpty()) {
            annotations.put(FleetAnnotations.APPLIED_RESOURCES, summarizeAppliedResources(applied));
        }

        List<String> dependsOn = new ArrayList<>();
        String bundleName = labels.get(FleetResources.LABEL_BUNDLE_NAME);
        if (bundleName != null) {
            annotations.put(FleetAnnotations.SOURCE_BUNDLE, bundleName);
            String componentNamespace = EntityNames.toEntityNamespace(workspace.orElse(fleetNamespace));
            dependsOn.add(EntityRef.of(EntityKind.COMPONENT, componentNamespace, EntityNames.toSafeName(bundleName)));
            if (systemRef != null) {
                annotations.put(FleetAnnotations.TECHDOCS_ENTITY, systemRef);
            }
        }
        dependsOn.add(EntityRef.of(EntityKind.RESOURCE, clusterNamespace, clusterResourceName));
        applyOverrides(annotations, ctx.getFleetYaml());

        return entity(EntityKind.RESOURCE,
                EntityMetadata.builder()
                        .name(EntityNames.toStableSafeName(originalName, DEPLOYMENT_NAME_MAX_LENGTH))
                        .namespace(EntityNames.toEntityNamespace(fleetNamespace))
                        .description("Fleet deployment: " + deploymentName + " on cluster " + clusterDisplayName)
                        .annotations(annotations)
                        .tags(new ArrayList<>(List.of("fleet", TYPE_FLEET_DEPLOYMENT, "cluster-" + clusterResourceName)))
                        .build(),
                EntitySpec.builder()
                        .type(TYPE_FLEET_DEPLOYMENT)
                        .lifecycle(FleetState.toLifecycle(status))
                        .owner(backstageOwner(backstageOf(ctx.getFleetYaml())))
                        .dependsOn(dependsOn)
                        .build());
    }

    /**
     * 표시 상태, 없으면 ready 플래그로 판단
     */
    public static String deploymentStateOf(BundleDeployment deployment) {
        BundleDeploymentStatus status = deployment.getStatus();
        if (status == null) {
            return UNKNOWN_STATUS;
        }
        if (status.getDisplay() != null && hasText(status.getDisplay().getState())) {
            return status.getDisplay().getState();
        }
        if (Boolean.TRUE.equals(status.getReady())) {
            return FleetState.READY.getValue();
        }
        return UNKNOWN_STATUS;
    }

    // ==================== Resource: 다운스트림 클러스터 ====================

    /**
     * 다운스트림 클러스터 -> Resource (type kubernetes-cluster)
     *
     * @param workspace 이 Resource 를 둘 Fleet 워크스페이스
     * @param stats     토폴로지 통계 (없으면 null)
     * @param primary   클러스터의 주 워크스페이스 여부
     */
    public static CatalogEntity toClusterResource(String clusterId, String clusterName, String workspace,
                                                  ClusterStats stats, boolean primary, MapperContext ctx) {
        String displayName = clusterName != null ? clusterName : clusterId;

        Map<String, String> annotations = locationAnnotations(ctx);
        annotations.put(FleetAnnotations.CLUSTER, nullToEmpty(clusterId));
        annotations.put(FleetAnnotations.CLUSTER_ID, nullToEmpty(clusterId));
        annotations.put(FleetAnnotations.KUBERNETES_ID, nullToEmpty(clusterId));
        annotations.put(FleetAnnotations.WORKSPACE, nullToEmpty(workspace));
        if (primary) {
            annotations.put(FleetAnnotations.PRIMARY_WORKSPACE, "true");
        }

        List<String> tags = new ArrayList<>(List.of("fleet", TYPE_KUBERNETES_CLUSTER, clusterTag(clusterId)));
        if (stats != null) {
            putIfText(annotations, FleetAnnotations.CLUSTER_DRIVER, stats.getDriver());
            putIfText(annotations, FleetAnnotations.CLUSTER_PROVIDER, stats.getProvider());
            putIfText(annotations, FleetAnnotations.KUBERNETES_VERSION, stats.getVersion());
            putIfText(annotations, FleetAnnotations.CLUSTER_STATE, stats.getState());
            if (stats.getNodeCount() != null) {
                annotations.put(FleetAnnotations.NODE_COUNT, String.valueOf(stats.getNodeCount()));
            }
            if (stats.getMachineDeploymentCount() != null) {
                annotations.put(FleetAnnotations.MACHINE_DEPLOYMENT_COUNT, String.valueOf(stats.getMachineDeploymentCount()));
            }
            if (stats.getVirtualMachineCount() != null) {
                annotations.put(FleetAnnotations.VIRTUAL_MACHINE_COUNT, String.valueOf(stats.getVirtualMachineCount()));
            }
            if (stats.getConditions() != null && !stats.getConditions().isEmpty()) {
                annotations.put(FleetAnnotations.CLUSTER_CONDITIONS, String.join(",", stats.getConditions()));
            }
            if (hasText(stats.getDriver())) {
                tags.add(EntityNames.toSafeName(stats.getDriver()));
            }
        }
        applyOverrides(annotations, ctx.getFleetYaml());

        return entity(EntityKind.RESOURCE,
                EntityMetadata.builder()
                        .name(EntityNames.toSafeName(displayName))
                        .namespace(EntityNames.toEntityNamespace(workspace))
                        .description("Downstream Kubernetes cluster: " + displayName)
                        .annotations(annotations)
                        .tags(distinct(tags))
                        .build(),
                EntitySpec.builder()
                        .type(TYPE_KUBERNETES_CLUSTER)
                        .owner(PLATFORM_OWNER)
                        .build());
    }

    /**
     * 클러스터 Resource 조회용 태그
     */
    public static String clusterTag(String clusterId) {
        return EntityNames.toSafeName(CLUSTER_TAG_PREFIX + clusterId);
    }

    // ==================== Resource: 인벤토리 ====================

    /**
     * 노드/MachineDeployment/VM -> Resource, 소속 클러스터 Resource 에 의존
     */
    public static CatalogEntity toInventoryResource(InventoryItem item, String clusterId,
                                                    CatalogEntity clusterResource, MapperContext ctx) {
        String clusterResourceName = clusterResource.getMetadata().getName();
        String namespace = clusterResource.getMetadata().getNamespace();
        String qualified = item.getNamespace() != null
                ? clusterResourceName + "-" + item.getNamespace() + "-" + item.getName()
                : clusterResourceName + "-" + item.getName();

        Map<String, String> annotations = locationAnnotations(ctx);
        annotations.put(FleetAnnotations.CLUSTER, nullToEmpty(clusterId));
        annotations.put(FleetAnnotations.ORIGINAL_NAME, nullToEmpty(item.getName()));
        putIfText(annotations, FleetAnnotations.NAMESPACE, item.getNamespace());
        item.getDetails().forEach((key, value) -> {
            if (value != null) {
                annotations.put(FleetAnnotations.INVENTORY_PREFIX + key, value);
            }
        });
        applyOverrides(annotations, ctx.getFleetYaml());

        return entity(EntityKind.RESOURCE,
                EntityMetadata.builder()
                        .name(EntityNames.toStableSafeName(qualified, EntityNames.MAX_NAME_LENGTH))
                        .namespace(namespace)
                        .description(item.getType() + " " + item.getName() + " on cluster " + clusterResourceName)
                        .annotations(annotations)
                        .tags(new ArrayList<>(List.of("fleet", item.getType(), "cluster-" + clusterResourceName)))
                        .build(),
                EntitySpec.builder()
                        .type(item.getType())
                        .owner(PLATFORM_OWNER)
                        .dependsOn(new ArrayList<>(List.of(clusterResource.getRef())))
                        .build());
    }

    // ==================== API ====================

    /**
     * fleet.yaml providesApis 항목 -> API. GitRepo 와 같은 네임스페이스에 둔다
     */
    public static CatalogEntity toApi(FleetYamlApiDefinition api, GitRepo gitRepo, MapperContext ctx) {
        ObjectMeta meta = metaOf(gitRepo.getMetadata());
        String gitRepoName = meta.getName();
        String entityNamespace = EntityNames.toEntityNamespace(
                meta.getNamespace() != null ? meta.getNamespace() : FleetNamespaces.DEFAULT_WORKSPACE);

        Map<String, String> annotations = locationAnnotations(ctx);
        annotations.put(FleetAnnotations.SOURCE_GITREPO, nullToEmpty(gitRepoName));
        putIfText(annotations, FleetAnnotations.DEFINITION_URL, api.getDefinitionUrl());
        applyOverrides(annotations, ctx.getFleetYaml());

        String definition;
        if (hasText(api.getDefinition())) {
            definition = api.getDefinition();
        } else if (hasText(api.getDefinitionUrl())) {
            definition = "# API definition from: " + api.getDefinitionUrl();
        } else {
            definition = "# No definition provided for " + api.getName();
        }

        String description = api.getDescription() != null
                ? api.getDescription()
                : "API " + api.getName() + " provided by " + gitRepoName;

        return entity(EntityKind.API,
                EntityMetadata.builder()
                        .name(EntityNames.toSafeName(api.getName()))
                        .namespace(entityNamespace)
                        .description(description)
                        .annotations(annotations)
                        .tags(new ArrayList<>(List.of("fleet", "fleet-api")))
                        .build(),
                EntitySpec.builder()
                        .type(api.getType() != null ? api.getType() : DEFAULT_API_TYPE)
                        .lifecycle(FleetState.toLifecycle(null))
                        .owner(backstageOwner(backstageOf(ctx.getFleetYaml())))
                        .system(gitRepoName != null
                                ? EntityRef.of(EntityKind.SYSTEM, entityNamespace, EntityNames.toSafeName(gitRepoName))
                                : null)
                        .definition(definition)
                        .build());
    }

    // ==================== 해석 규칙 ====================

    static String resolveSystemDescription(ObjectMeta meta, FleetYamlBackstage backstage, String repo) {
        if (backstage != null && backstage.getDescription() != null) {
            return backstage.getDescription();
        }
        Map<String, String> annotations = meta.getAnnotations() != null ? meta.getAnnotations() : Collections.emptyMap();
        if (annotations.get(FleetAnnotations.FIELD_DESCRIPTION) != null) {
            return annotations.get(FleetAnnotations.FIELD_DESCRIPTION);
        }
        if (annotations.get(FleetAnnotations.DESCRIPTION) != null) {
            return annotations.get(FleetAnnotations.DESCRIPTION);
        }
        return "Fleet GitRepo: " + (repo != null ? repo : "unknown");
    }

    /**
     * fleet.yaml owner -> 저장소 URL 첫 경로 세그먼트 그룹 -> group:default/default
     */
    static String resolveSystemOwner(FleetYamlBackstage backstage, String repo) {
        if (backstage != null && hasText(backstage.getOwner())) {
            return backstage.getOwner();
        }
        return firstPathSegment(repo)
                .map(segment -> "group:default/" + EntityNames.toSafeName(segment))
                .orElse(FALLBACK_GROUP_OWNER);
    }

    /**
     * 상태 리소스 네임스페이스 -> fleet.yaml -> GitRepo 네임스페이스 -> default
     */
    static String resolveSystemKubernetesNamespace(GitRepo gitRepo, FleetYaml fleetYaml) {
        List<AppliedResource> resources = Optional.ofNullable(gitRepo.getStatus())
                .map(GitRepoStatus::getResources)
                .orElse(Collections.emptyList());
        for (AppliedResource resource : resources) {
            if (hasText(resource.getNamespace())) {
                return resource.getNamespace();
            }
        }
        if (fleetYaml != null) {
            if (hasText(fleetYaml.getDefaultNamespace())) {
                return fleetYaml.getDefaultNamespace();
            }
            if (hasText(fleetYaml.getNamespace())) {
                return fleetYaml.getNamespace();
            }
        }
        String own = gitRepo.getMetadata() != null ? gitRepo.getMetadata().getNamespace() : null;
        return hasText(own) ? own : DEFAULT_NAMESPACE;
    }

    static String resolveBundleTargetNamespace(BundleSpec spec, FleetYaml fleetYaml) {
        List<String> candidates = new ArrayList<>();
        candidates.add(spec.getTargetNamespace());
        candidates.add(spec.getDefaultNamespace());
        candidates.add(spec.getNamespace());
        if (fleetYaml != null) {
            candidates.add(fleetYaml.getTargetNamespace());
            candidates.add(fleetYaml.getDefaultNamespace());
            candidates.add(fleetYaml.getNamespace());
        }
        return candidates.stream()
                .filter(FleetEntityMapper::hasText)
                .findFirst()
                .orElse(DEFAULT_NAMESPACE);
    }

    /**
     * 릴리스 이름 기반 selector 우선, 렌더 해시 selector 는 최후 수단
     */
    static String resolveBundleLabelSelector(String bundleName, Map<String, String> labels,
                                             BundleSpec spec, FleetYaml fleetYaml) {
        String releaseName = Optional.ofNullable(fleetYaml)
                .map(FleetYaml::getHelm)
                .map(HelmOptions::getReleaseName)
                .filter(FleetEntityMapper::hasText)
                .orElse(Optional.ofNullable(spec.getHelm())
                        .map(HelmOptions::getReleaseName)
                        .filter(FleetEntityMapper::hasText)
                        .orElse(bundleName));
        if (hasText(releaseName)) {
            return "app.kubernetes.io/instance=" + releaseName;
        }
        String hash = labels.get(FleetResources.LABEL_OBJECTSET_HASH);
        return hash != null ? FleetResources.LABEL_OBJECTSET_HASH + "=" + hash : null;
    }

    static String techdocsRef(String repo, String branch) {
        String base = repo.endsWith("/") ? repo.replaceAll("/+$", "") : repo;
        return "url:" + base + "/-/tree/" + branch;
    }

    static String truncate(String value, int maxLength) {
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }

    // ==================== 공통 ====================

    private static CatalogEntity entity(EntityKind kind, EntityMetadata metadata, EntitySpec spec) {
        return CatalogEntity.builder()
                .kind(kind.getValue())
                .metadata(metadata)
                .spec(spec)
                .build();
    }

    private static Map<String, String> locationAnnotations(MapperContext ctx) {
        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put(FleetAnnotations.MANAGED_BY_LOCATION, ctx.getLocationKey());
        annotations.put(FleetAnnotations.MANAGED_BY_ORIGIN_LOCATION, ctx.getLocationKey());
        return annotations;
    }

    /**
     * fleet.yaml annotations, 그 다음 backstage.annotations 순서로 덮어쓴다
     */
    private static void applyOverrides(Map<String, String> annotations, FleetYaml fleetYaml) {
        if (fleetYaml == null) {
            return;
        }
        if (fleetYaml.getAnnotations() != null) {
            annotations.putAll(fleetYaml.getAnnotations());
        }
        FleetYamlBackstage backstage = fleetYaml.getBackstage();
        if (backstage != null && backstage.getAnnotations() != null) {
            annotations.putAll(backstage.getAnnotations());
        }
    }

    private static List<String> dependsOnRefs(List<BundleDependsOn> dependsOn, EntityKind kind, String namespace) {
        if (dependsOn == null) {
            return Collections.emptyList();
        }
        return dependsOn.stream()
                .map(BundleDependsOn::getName)
                .filter(FleetEntityMapper::hasText)
                .map(name -> EntityRef.of(kind, namespace, EntityNames.toSafeName(name)))
                .collect(Collectors.toList());
    }

    private static List<String> mergeTags(List<String> base, FleetYamlBackstage backstage) {
        Set<String> tags = new LinkedHashSet<>(base);
        if (backstage != null && backstage.getTags() != null) {
            backstage.getTags().stream().filter(FleetEntityMapper::hasText).forEach(tags::add);
        }
        return new ArrayList<>(tags);
    }

    private static List<String> targetNames(List<FleetTarget> targets) {
        if (targets == null) {
            return Collections.emptyList();
        }
        return targets.stream()
                .map(target -> target.getName() != null ? target.getName() : target.getClusterName())
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    private static String toJsonArray(List<String> values) {
        try {
            return OBJECT_MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize targets: " + e.getMessage(), e);
        }
    }

    private static String summarizeAppliedResources(List<AppliedResource> resources) {
        return resources.stream()
                .map(AppliedResource::getKind)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.joining(","));
    }

    private static Optional<String> firstPathSegment(String repo) {
        if (!hasText(repo)) {
            return Optional.empty();
        }
        try {
            String path = new URI(repo).getPath();
            if (path == null) {
                return Optional.empty();
            }
            for (String segment : path.split("/")) {
                if (!segment.isEmpty()) {
                    return Optional.of(segment);
                }
            }
            return Optional.empty();
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    private static String hostOf(String url) {
        if (url == null) {
            return "unknown";
        }
        try {
            String host = new URI(url).getHost();
            return host != null ? host : url;
        } catch (URISyntaxException e) {
            return url;
        }
    }

    private static FleetYamlBackstage backstageOf(FleetYaml fleetYaml) {
        return fleetYaml != null ? fleetYaml.getBackstage() : null;
    }

    private static String backstageOwner(FleetYamlBackstage backstage) {
        return backstage != null && hasText(backstage.getOwner()) ? backstage.getOwner() : UNKNOWN_OWNER;
    }

    private static ObjectMeta metaOf(ObjectMeta meta) {
        return meta != null ? meta : new ObjectMeta();
    }

    private static Map<String, String> labelsOf(ObjectMeta meta) {
        return meta.getLabels() != null ? meta.getLabels() : Collections.emptyMap();
    }

    private static List<String> distinct(List<String> values) {
        return new ArrayList<>(new LinkedHashSet<>(values));
    }

    private static void putIfText(Map<String, String> annotations, String key, String value) {
        if (hasText(value)) {
            annotations.put(key, value);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
