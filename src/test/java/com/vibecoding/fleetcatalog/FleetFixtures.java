package com.vibecoding.fleetcatalog;

import com.vibecoding.fleetcatalog.model.FleetClusterConfig;
import com.vibecoding.fleetcatalog.model.FleetNamespaceConfig;
import com.vibecoding.fleetcatalog.model.fleet.Bundle;
import com.vibecoding.fleetcatalog.model.fleet.BundleDeployment;
import com.vibecoding.fleetcatalog.model.fleet.BundleDeploymentStatus;
import com.vibecoding.fleetcatalog.model.fleet.BundleSpec;
import com.vibecoding.fleetcatalog.model.fleet.BundleStatus;
import com.vibecoding.fleetcatalog.model.fleet.FleetResources;
import com.vibecoding.fleetcatalog.model.fleet.GitRepo;
import com.vibecoding.fleetcatalog.model.fleet.GitRepoSpec;
import com.vibecoding.fleetcatalog.model.fleet.GitRepoStatus;
import com.vibecoding.fleetcatalog.model.fleet.StatusDisplay;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * 테스트용 Fleet 리소스 생성
 */
public final class FleetFixtures {

    private FleetFixtures() {
    }

    public static FleetClusterConfig cluster(String name, String... namespaces) {
        List<FleetNamespaceConfig> configs = new ArrayList<>();
        for (String namespace : namespaces) {
            configs.add(FleetNamespaceConfig.of(namespace));
        }
        return FleetClusterConfig.builder()
                .name(name)
                .url("https://rancher.example.com/k8s/clusters/local")
                .token("token")
                .namespaces(configs)
                .build();
    }

    public static GitRepo gitRepo(String namespace, String name, String repo, String state) {
        GitRepo gitRepo = new GitRepo();
        gitRepo.setMetadata(new ObjectMetaBuilder().withNamespace(namespace).withName(name).build());
        gitRepo.setSpec(GitRepoSpec.builder().repo(repo).branch("main").build());
        if (state != null) {
            gitRepo.setStatus(GitRepoStatus.builder()
                    .display(StatusDisplay.builder().state(state).readyClusters("1/1").build())
                    .build());
        }
        return gitRepo;
    }

    public static Bundle bundle(String namespace, String name, String repoName, String state) {
        Bundle bundle = new Bundle();
        bundle.setMetadata(new ObjectMetaBuilder()
                .withNamespace(namespace)
                .withName(name)
                .addToLabels(FleetResources.LABEL_REPO_NAME, repoName)
                .build());
        bundle.setSpec(new BundleSpec());
        if (state != null) {
            bundle.setStatus(BundleStatus.builder()
                    .display(StatusDisplay.builder().state(state).build())
                    .build());
        }
        return bundle;
    }

    /**
     * namespace 는 cluster-fleet-&lt;workspace&gt;-&lt;clusterId&gt; 형식
     */
    public static BundleDeployment bundleDeployment(String workspaceToken, String clusterId, String bundleName,
                                                    String state) {
        BundleDeployment deployment = new BundleDeployment();
        deployment.setMetadata(new ObjectMetaBuilder()
                .withNamespace("cluster-fleet-" + workspaceToken + "-" + clusterId)
                .withName(bundleName)
                .addToLabels(FleetResources.LABEL_BUNDLE_NAME, bundleName)
                .build());
        deployment.setStatus(BundleDeploymentStatus.builder()
                .display(StatusDisplay.builder().state(state).build())
                .ready("Ready".equals(state))
                .build());
        return deployment;
    }
}
