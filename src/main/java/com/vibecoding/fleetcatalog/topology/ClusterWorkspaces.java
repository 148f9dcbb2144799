package com.vibecoding.fleetcatalog.topology;

import com.vibecoding.fleetcatalog.mapper.FleetNamespaces;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 클러스터 ID -> BundleDeployment 에서 관찰된 Fleet 워크스페이스
 *
 * 관리 클러스터 fetch 하나에 속하며 그 fetch 스레드만 접근한다.
 */
public class ClusterWorkspaces {

    private final Map<String, Set<String>> workspaces = new LinkedHashMap<>();

    public void observe(String clusterId, String workspace) {
        workspaces.computeIfAbsent(clusterId, id -> new LinkedHashSet<>()).add(workspace);
    }

    public List<String> clusterIds() {
        return new ArrayList<>(workspaces.keySet());
    }

    public List<String> workspacesOf(String clusterId) {
        Set<String> observed = workspaces.get(clusterId);
        return observed != null ? new ArrayList<>(observed) : new ArrayList<>();
    }

    /**
     * fleet-default 를 관찰했으면 그것, 아니면 처음 관찰된 워크스페이스
     */
    public String primaryWorkspace(String clusterId) {
        Set<String> observed = workspaces.get(clusterId);
        if (observed == null || observed.isEmpty()) {
            return null;
        }
        if (observed.contains(FleetNamespaces.DEFAULT_WORKSPACE)) {
            return FleetNamespaces.DEFAULT_WORKSPACE;
        }
        return observed.iterator().next();
    }

    public boolean isEmpty() {
        return workspaces.isEmpty();
    }
}
