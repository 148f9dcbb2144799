package com.vibecoding.fleetcatalog.model.fleet;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Fleet GitRepo (fleet.cattle.io/v1alpha1)
 */
@Group(FleetResources.GROUP)
@Version(FleetResources.VERSION)
@Kind("GitRepo")
@Plural("gitrepos")
public class GitRepo extends CustomResource<GitRepoSpec, GitRepoStatus> implements Namespaced {
}
