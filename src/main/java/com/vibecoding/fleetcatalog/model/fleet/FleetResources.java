package com.vibecoding.fleetcatalog.model.fleet;

/**
 * Fleet CRD 그룹/버전 및 공통 라벨
 */
public final class FleetResources {

    public static final String GROUP = "fleet.cattle.io";
    public static final String VERSION = "v1alpha1";

    public static final String LABEL_REPO_NAME = "fleet.cattle.io/repo-name";
    public static final String LABEL_BUNDLE_PATH = "fleet.cattle.io/bundle-path";
    public static final String LABEL_BUNDLE_NAME = "fleet.cattle.io/bundle-name";
    public static final String LABEL_CLUSTER = "fleet.cattle.io/cluster";
    public static final String LABEL_COMMIT = "fleet.cattle.io/commit";
    public static final String LABEL_OBJECTSET_HASH = "objectset.rio.cattle.io/hash";
    public static final String LABEL_CLUSTER_DISPLAY_NAME = "management.cattle.io/cluster-display-name";
    public static final String LABEL_MANAGEMENT_CLUSTER_NAME = "management.cattle.io/cluster-name";

    private FleetResources() {
    }
}
