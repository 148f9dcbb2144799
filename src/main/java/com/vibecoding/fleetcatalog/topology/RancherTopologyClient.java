package com.vibecoding.fleetcatalog.topology;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.fleetcatalog.client.KubernetesClientFactory;
import com.vibecoding.fleetcatalog.config.FleetLocatorProperties;
import com.vibecoding.fleetcatalog.exception.FleetApiException;
import com.vibecoding.fleetcatalog.model.FetchResult;
import com.vibecoding.fleetcatalog.model.topology.ClusterItems;
import com.vibecoding.fleetcatalog.model.topology.ClusterVersion;
import com.vibecoding.fleetcatalog.model.topology.InventoryItem;
import com.vibecoding.fleetcatalog.model.topology.RancherCluster;
import com.vibecoding.fleetcatalog.model.topology.RancherNode;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeAddress;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.NodeSystemInfo;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rancher 관리 API 기반 토폴로지 클라이언트
 *
 * 클러스터 목록은 /v3 API, 클러스터 내부 리소스는 /k8s/clusters/{id} 프록시를 통해 fabric8 로 조회한다.
 */
@Component
public class RancherTopologyClient implements TopologyClient {

    private static final Logger log = LoggerFactory.getLogger(RancherTopologyClient.class);

    static final String CAPI_API_VERSION = "cluster.x-k8s.io/v1beta1";
    static final String KUBEVIRT_API_VERSION = "kubevirt.io/v1";
    private static final String NODE_ROLE_PREFIX = "node-role.kubernetes.io/";

    private final FleetLocatorProperties properties;
    private final RestTemplate restTemplate;
    private final KubernetesClientFactory clientFactory;
    private final ObjectMapper objectMapper = new ObjectMapper();

    // 클러스터 ID -> 프록시 클라이언트
    private final Map<String, KubernetesClient> proxyClients = new ConcurrentHashMap<>();

    public RancherTopologyClient(FleetLocatorProperties properties,
                                 @Qualifier("rancherRestTemplate") RestTemplate restTemplate,
                                 KubernetesClientFactory clientFactory) {
        this.properties = properties;
        this.restTemplate = restTemplate;
        this.clientFactory = clientFactory;
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    // ========== /v3 API ==========

    @Override
    public FetchResult<List<RancherCluster>> listClusterDetails() {
        if (!isEnabled()) {
            return FetchResult.failure(new FleetApiException("Fleet k8s locator is disabled"));
        }
        try {
            JsonNode root = getJson("/v3/clusters");
            List<RancherCluster> clusters = new ArrayList<>();
            for (JsonNode item : root.path("data")) {
                RancherCluster cluster = objectMapper.treeToValue(item, RancherCluster.class);
                if (cluster.getId() == null) {
                    continue;
                }
                if ("local".equals(cluster.getId()) && !properties.isIncludeLocal()) {
                    continue;
                }
                clusters.add(cluster);
            }
            log.debug("Listed {} clusters from Rancher", clusters.size());
            return FetchResult.success(clusters);
        } catch (RestClientException | JsonProcessingException e) {
            log.warn("Failed to list Rancher clusters: {}", e.getMessage());
            return FetchResult.failure(e);
        }
    }

    @Override
    public FetchResult<List<RancherNode>> listClusterNodes(String clusterId) {
        if (!isEnabled()) {
            return FetchResult.failure(new FleetApiException("Fleet k8s locator is disabled"));
        }
        try {
            JsonNode root = getJson("/v3/clusters/" + clusterId + "/nodes");
            List<RancherNode> nodes = new ArrayList<>();
            for (JsonNode item : root.path("data")) {
                nodes.add(objectMapper.treeToValue(item, RancherNode.class));
            }
            return FetchResult.success(nodes);
        } catch (RestClientException | JsonProcessingException e) {
            log.warn("Failed to list Rancher nodes for cluster {}: {}", clusterId, e.getMessage());
            return FetchResult.failure(e);
        }
    }

    // ========== /k8s/clusters/{id} 프록시 ==========

    @Override
    public FetchResult<List<ClusterItems<InventoryItem>>> listNodesDetailed(List<RancherCluster> clusters) {
        return perCluster("nodes", clusters, client -> client.nodes().list().getItems().stream()
                .map(RancherTopologyClient::toNodeItem)
                .collect(Collectors.toList()));
    }

    @Override
    public FetchResult<List<ClusterItems<InventoryItem>>> listMachineDeploymentGroups(List<RancherCluster> clusters) {
        return perCluster("MachineDeployments", clusters, client -> client
                .genericKubernetesResources(CAPI_API_VERSION, "MachineDeployment")
                .inAnyNamespace()
                .list()
                .getItems().stream()
                .map(RancherTopologyClient::toMachineDeploymentItem)
                .collect(Collectors.toList()));
    }

    @Override
    public FetchResult<List<ClusterVersion>> listClusterVersions(List<RancherCluster> clusters) {
        if (!isEnabled()) {
            return FetchResult.failure(new FleetApiException("Fleet k8s locator is disabled"));
        }
        List<ClusterVersion> versions = new ArrayList<>();
        for (RancherCluster cluster : clusters) {
            try {
                String version = proxyClient(cluster).getKubernetesVersion().getGitVersion();
                versions.add(new ClusterVersion(cluster.getId(), cluster.getName(), version));
            } catch (KubernetesClientException | FleetApiException e) {
                log.warn("Failed to fetch version for cluster {}: {}", cluster.getId(), e.getMessage());
            }
        }
        return FetchResult.success(versions);
    }

    @Override
    public FetchResult<List<ClusterItems<InventoryItem>>> listVirtualMachineGroups(List<RancherCluster> clusters) {
        List<RancherCluster> harvesterClusters = clusters.stream()
                .filter(RancherCluster::isHarvester)
                .collect(Collectors.toList());
        return perCluster("VirtualMachines", harvesterClusters, client -> client
                .genericKubernetesResources(KUBEVIRT_API_VERSION, "VirtualMachine")
                .inAnyNamespace()
                .list()
                .getItems().stream()
                .map(RancherTopologyClient::toVirtualMachineItem)
                .collect(Collectors.toList()));
    }

    @PreDestroy
    public void close() {
        proxyClients.values().forEach(KubernetesClient::close);
        proxyClients.clear();
    }

    private FetchResult<List<ClusterItems<InventoryItem>>> perCluster(
            String what, List<RancherCluster> clusters, Function<KubernetesClient, List<InventoryItem>> call) {
        if (!isEnabled()) {
            return FetchResult.failure(new FleetApiException("Fleet k8s locator is disabled"));
        }
        List<ClusterItems<InventoryItem>> results = new ArrayList<>();
        for (RancherCluster cluster : clusters) {
            try {
                List<InventoryItem> items = call.apply(proxyClient(cluster));
                results.add(new ClusterItems<>(cluster.getId(), cluster.getName(), items));
            } catch (KubernetesClientException | FleetApiException e) {
                // CRD 가 없는 클러스터는 404
                log.warn("Failed to fetch {} for cluster {}: {}", what, cluster.getId(), e.getMessage());
            }
        }
        return FetchResult.success(results);
    }

    private KubernetesClient proxyClient(RancherCluster cluster) {
        return proxyClients.computeIfAbsent(cluster.getId(), id -> clientFactory.createClient(
                properties.getRancherUrl() + "/k8s/clusters/" + id,
                properties.getRancherToken(),
                null,
                properties.isSkipTlsVerify()));
    }

    private JsonNode getJson(String path) throws JsonProcessingException {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.getRancherToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response = restTemplate.exchange(
                properties.getRancherUrl() + path,
                HttpMethod.GET,
                new HttpEntity<>(headers),
                String.class
        );
        return objectMapper.readTree(response.getBody() != null ? response.getBody() : "{}");
    }

    // ========== 변환 ==========

    static InventoryItem toNodeItem(Node node) {
        InventoryItem item = InventoryItem.builder()
                .type(InventoryItem.TYPE_NODE)
                .name(node.getMetadata().getName())
                .build();
        Map<String, String> details = item.getDetails();

        Map<String, String> labels = node.getMetadata().getLabels() != null
                ? node.getMetadata().getLabels()
                : Collections.emptyMap();
        String roles = labels.keySet().stream()
                .filter(key -> key.startsWith(NODE_ROLE_PREFIX))
                .map(key -> key.substring(NODE_ROLE_PREFIX.length()))
                .sorted()
                .collect(Collectors.joining(","));
        if (!roles.isEmpty()) {
            details.put("node-roles", roles);
        }

        if (node.getStatus() != null) {
            NodeSystemInfo info = node.getStatus().getNodeInfo();
            if (info != null) {
                putIfNotNull(details, "kubelet-version", info.getKubeletVersion());
                putIfNotNull(details, "os-image", info.getOsImage());
                putIfNotNull(details, "architecture", info.getArchitecture());
            }
            if (node.getStatus().getConditions() != null) {
                for (NodeCondition condition : node.getStatus().getConditions()) {
                    if ("Ready".equals(condition.getType())) {
                        details.put("node-ready", condition.getStatus());
                    }
                }
            }
            if (node.getStatus().getAddresses() != null) {
                for (NodeAddress address : node.getStatus().getAddresses()) {
                    if ("InternalIP".equals(address.getType())) {
                        details.put("internal-ip", address.getAddress());
                        break;
                    }
                }
            }
        }
        return item;
    }

    static InventoryItem toMachineDeploymentItem(GenericKubernetesResource resource) {
        InventoryItem item = InventoryItem.builder()
                .type(InventoryItem.TYPE_MACHINE_DEPLOYMENT)
                .name(resource.getMetadata().getName())
                .namespace(resource.getMetadata().getNamespace())
                .build();
        Map<String, Object> props = resource.getAdditionalProperties();
        putIfNotNull(item.getDetails(), "replicas", nested(props, "spec", "replicas"));
        putIfNotNull(item.getDetails(), "ready-replicas", nested(props, "status", "readyReplicas"));
        putIfNotNull(item.getDetails(), "available-replicas", nested(props, "status", "availableReplicas"));
        return item;
    }

    static InventoryItem toVirtualMachineItem(GenericKubernetesResource resource) {
        InventoryItem item = InventoryItem.builder()
                .type(InventoryItem.TYPE_VIRTUAL_MACHINE)
                .name(resource.getMetadata().getName())
                .namespace(resource.getMetadata().getNamespace())
                .build();
        Map<String, Object> props = resource.getAdditionalProperties();
        putIfNotNull(item.getDetails(), "vm-status", nested(props, "status", "printableStatus"));
        putIfNotNull(item.getDetails(), "vm-ready", nested(props, "status", "ready"));
        putIfNotNull(item.getDetails(), "run-strategy", nested(props, "spec", "runStrategy"));
        putIfNotNull(item.getDetails(), "cpu-cores", nested(props, "spec", "template", "spec", "domain", "cpu", "cores"));
        return item;
    }

    private static String nested(Map<String, Object> root, String... path) {
        Object current = root;
        for (String key : path) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(key);
        }
        return current != null ? String.valueOf(current) : null;
    }

    private static void putIfNotNull(Map<String, String> details, String key, String value) {
        if (value != null) {
            details.put(key, value);
        }
    }
}
