package com.vibecoding.fleetcatalog.model.fleet;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Fleet Bundle (GitRepo 경로 하나가 렌더링된 배포 단위)
 */
@Group(FleetResources.GROUP)
@Version(FleetResources.VERSION)
@Kind("Bundle")
@Plural("bundles")
public class Bundle extends CustomResource<BundleSpec, BundleStatus> implements Namespaced {
}
