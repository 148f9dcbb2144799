package com.vibecoding.fleetcatalog.mapper;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fleet 네임스페이스/클러스터 ID 규칙
 */
public final class FleetNamespaces {

    public static final String DEFAULT_WORKSPACE = "fleet-default";

    // cluster-fleet-<workspace>-<clusterId>
    private static final Pattern BUNDLE_DEPLOYMENT_NAMESPACE = Pattern.compile("^cluster-fleet-([^-]+)-(.+)$");

    // Fleet 가 다운스트림 클러스터 ID 뒤에 붙이는 12자리 hex
    private static final Pattern GENERATED_SUFFIX = Pattern.compile("^(.*?)-[a-f0-9]{12}$");

    private FleetNamespaces() {
    }

    public static Optional<String> extractWorkspace(String bundleDeploymentNamespace) {
        Matcher matcher = match(bundleDeploymentNamespace);
        return matcher != null ? Optional.of("fleet-" + matcher.group(1)) : Optional.empty();
    }

    public static Optional<String> extractClusterId(String bundleDeploymentNamespace) {
        Matcher matcher = match(bundleDeploymentNamespace);
        return matcher != null ? Optional.of(matcher.group(2)) : Optional.empty();
    }

    /**
     * "my-cluster-0123456789ab" -> "my-cluster"
     */
    public static Optional<String> shortName(String clusterId) {
        if (clusterId == null) {
            return Optional.empty();
        }
        Matcher matcher = GENERATED_SUFFIX.matcher(clusterId);
        if (matcher.matches() && !matcher.group(1).isEmpty()) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }

    private static Matcher match(String namespace) {
        if (namespace == null) {
            return null;
        }
        Matcher matcher = BUNDLE_DEPLOYMENT_NAMESPACE.matcher(namespace);
        return matcher.matches() ? matcher : null;
    }
}
