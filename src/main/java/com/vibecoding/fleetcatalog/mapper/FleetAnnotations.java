package com.vibecoding.fleetcatalog.mapper;

/**
 * 엔티티 annotation 키
 */
public final class FleetAnnotations {

    // 카탈로그 공통
    public static final String MANAGED_BY_LOCATION = "backstage.io/managed-by-location";
    public static final String MANAGED_BY_ORIGIN_LOCATION = "backstage.io/managed-by-origin-location";
    public static final String SOURCE_LOCATION = "backstage.io/source-location";
    public static final String TECHDOCS_REF = "backstage.io/techdocs-ref";
    public static final String TECHDOCS_ENTITY = "backstage.io/techdocs-entity";
    public static final String KUBERNETES_ID = "backstage.io/kubernetes-id";
    public static final String KUBERNETES_NAMESPACE = "backstage.io/kubernetes-namespace";
    public static final String KUBERNETES_LABEL_SELECTOR = "backstage.io/kubernetes-label-selector";

    // Fleet 소스 정보
    public static final String REPO = "fleet.cattle.io/repo";
    public static final String BRANCH = "fleet.cattle.io/branch";
    public static final String NAMESPACE = "fleet.cattle.io/namespace";
    public static final String NAMESPACES = "fleet.cattle.io/namespaces";
    public static final String URL = "fleet.cattle.io/url";
    public static final String TARGETS = "fleet.cattle.io/targets";
    public static final String REPO_NAME = "fleet.cattle.io/repo-name";
    public static final String BUNDLE_PATH = "fleet.cattle.io/bundle-path";
    public static final String STATUS = "fleet.cattle.io/status";
    public static final String READY_CLUSTERS = "fleet.cattle.io/ready-clusters";
    public static final String CLUSTER = "fleet.cattle.io/cluster";
    public static final String SOURCE_GITREPO = "fleet.cattle.io/source-gitrepo";
    public static final String SOURCE_BUNDLE = "fleet.cattle.io/source-bundle";
    public static final String BUNDLE_DEPLOYMENT = "fleet.cattle.io/bundle-deployment";
    public static final String ORIGINAL_NAME = "fleet.cattle.io/original-name";
    public static final String TARGET_CLUSTER_ID = "fleet.cattle.io/target-cluster-id";
    public static final String MESSAGE = "fleet.cattle.io/message";
    public static final String DEFINITION_URL = "fleet.cattle.io/definition-url";
    public static final String DEPLOYMENT_STATUS = "fleet.cattle.io/deployment-status";
    public static final String APPLIED_RESOURCES = "fleet.cattle.io/applied-resources";

    // 다운스트림 클러스터
    public static final String CLUSTER_ID = "fleet.cattle.io/cluster-id";
    public static final String WORKSPACE = "fleet.cattle.io/workspace";
    public static final String PRIMARY_WORKSPACE = "fleet.cattle.io/primary-workspace";
    public static final String CLUSTER_DRIVER = "fleet.cattle.io/cluster-driver";
    public static final String CLUSTER_PROVIDER = "fleet.cattle.io/cluster-provider";
    public static final String KUBERNETES_VERSION = "fleet.cattle.io/kubernetes-version";
    public static final String CLUSTER_STATE = "fleet.cattle.io/cluster-state";
    public static final String CLUSTER_CONDITIONS = "fleet.cattle.io/cluster-conditions";
    public static final String NODE_COUNT = "fleet.cattle.io/node-count";
    public static final String MACHINE_DEPLOYMENT_COUNT = "fleet.cattle.io/machine-deployment-count";
    public static final String VIRTUAL_MACHINE_COUNT = "fleet.cattle.io/virtual-machine-count";
    public static final String INVENTORY_PREFIX = "fleet.cattle.io/";

    // 업스트림 리소스에 붙어 오는 값
    public static final String FLEET_YAML = "fleet.cattle.io/fleet-yaml";
    public static final String FIELD_DESCRIPTION = "field.cattle.io/description";
    public static final String DESCRIPTION = "description";

    private FleetAnnotations() {
    }
}
