package com.vibecoding.fleetcatalog.model.fleet;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Fleet Cluster (워크스페이스에 등록된 다운스트림 클러스터)
 */
@Group(FleetResources.GROUP)
@Version(FleetResources.VERSION)
@Kind("Cluster")
@Plural("clusters")
public class FleetCluster extends CustomResource<FleetClusterSpec, FleetClusterStatus> implements Namespaced {
}
