package com.vibecoding.fleetcatalog.model.fleet;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Fleet BundleDeployment (다운스트림 클러스터 하나에 실현된 Bundle 상태)
 * namespace 형식: cluster-fleet-&lt;workspace&gt;-&lt;clusterId&gt;
 */
@Group(FleetResources.GROUP)
@Version(FleetResources.VERSION)
@Kind("BundleDeployment")
@Plural("bundledeployments")
public class BundleDeployment extends CustomResource<BundleDeploymentSpec, BundleDeploymentStatus> implements Namespaced {
}
