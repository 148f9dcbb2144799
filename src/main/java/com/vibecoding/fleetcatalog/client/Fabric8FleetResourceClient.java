package com.vibecoding.fleetcatalog.client;

import com.vibecoding.fleetcatalog.model.FetchResult;
import com.vibecoding.fleetcatalog.model.fleet.Bundle;
import com.vibecoding.fleetcatalog.model.fleet.BundleDeployment;
import com.vibecoding.fleetcatalog.model.fleet.FleetCluster;
import com.vibecoding.fleetcatalog.model.fleet.FleetResources;
import com.vibecoding.fleetcatalog.model.fleet.GitRepo;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ListOptions;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * fabric8 기반 Fleet CRD 클라이언트
 */
public class Fabric8FleetResourceClient implements FleetResourceClient {

    private static final Logger log = LoggerFactory.getLogger(Fabric8FleetResourceClient.class);

    private final String clusterName;
    private final KubernetesClient client;

    public Fabric8FleetResourceClient(String clusterName, KubernetesClient client) {
        this.clusterName = clusterName;
        this.client = client;
    }

    // ========== GitRepo ==========

    @Override
    public FetchResult<List<GitRepo>> listGitRepos(String namespace, String labelSelector) {
        return list("GitRepos in " + namespace, () -> client.resources(GitRepo.class)
                .inNamespace(namespace)
                .list(listOptions(labelSelector))
                .getItems());
    }

    @Override
    public FetchResult<Optional<GitRepo>> getGitRepo(String namespace, String name) {
        return get("GitRepo " + namespace + "/" + name, () -> client.resources(GitRepo.class)
                .inNamespace(namespace)
                .withName(name)
                .get());
    }

    // ========== Bundle ==========

    @Override
    public FetchResult<List<Bundle>> listBundlesForGitRepo(String namespace, String gitRepoName) {
        String selector = FleetResources.LABEL_REPO_NAME + "=" + gitRepoName;
        return list("Bundles of GitRepo " + namespace + "/" + gitRepoName, () -> client.resources(Bundle.class)
                .inNamespace(namespace)
                .list(listOptions(selector))
                .getItems());
    }

    @Override
    public FetchResult<Optional<Bundle>> getBundle(String namespace, String name) {
        return get("Bundle " + namespace + "/" + name, () -> client.resources(Bundle.class)
                .inNamespace(namespace)
                .withName(name)
                .get());
    }

    // ========== BundleDeployment ==========

    @Override
    public FetchResult<List<BundleDeployment>> listBundleDeploymentsForBundle(String bundleName) {
        String selector = FleetResources.LABEL_BUNDLE_NAME + "=" + bundleName;
        return list("BundleDeployments of Bundle " + bundleName, () -> client.resources(BundleDeployment.class)
                .inAnyNamespace()
                .list(listOptions(selector))
                .getItems());
    }

    @Override
    public FetchResult<Optional<BundleDeployment>> getBundleDeployment(String namespace, String name) {
        return get("BundleDeployment " + namespace + "/" + name, () -> client.resources(BundleDeployment.class)
                .inNamespace(namespace)
                .withName(name)
                .get());
    }

    // ========== Cluster ==========

    @Override
    public FetchResult<List<FleetCluster>> listClusters(String namespace) {
        return list("Clusters in " + namespace, () -> client.resources(FleetCluster.class)
                .inNamespace(namespace)
                .list()
                .getItems());
    }

    @Override
    public void close() {
        client.close();
    }

    private <T extends HasMetadata> FetchResult<List<T>> list(String what, Supplier<List<T>> call) {
        try {
            List<T> items = call.get();
            log.debug("Listed {} {} from cluster {}", items.size(), what, clusterName);
            return FetchResult.success(items);
        } catch (KubernetesClientException e) {
            log.warn("Failed to list {} from cluster {}: {}", what, clusterName, e.getMessage());
            return FetchResult.failure(e);
        }
    }

    private <T extends HasMetadata> FetchResult<Optional<T>> get(String what, Supplier<T> call) {
        try {
            return FetchResult.success(Optional.ofNullable(call.get()));
        } catch (KubernetesClientException e) {
            log.warn("Failed to get {} from cluster {}: {}", what, clusterName, e.getMessage());
            return FetchResult.failure(e);
        }
    }

    private static ListOptions listOptions(String labelSelector) {
        ListOptionsBuilder builder = new ListOptionsBuilder();
        if (labelSelector != null && !labelSelector.isBlank()) {
            builder.withLabelSelector(labelSelector);
        }
        return builder.build();
    }
}
