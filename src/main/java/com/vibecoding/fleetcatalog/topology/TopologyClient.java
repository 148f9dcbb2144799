package com.vibecoding.fleetcatalog.topology;

import com.vibecoding.fleetcatalog.model.FetchResult;
import com.vibecoding.fleetcatalog.model.topology.ClusterItems;
import com.vibecoding.fleetcatalog.model.topology.ClusterVersion;
import com.vibecoding.fleetcatalog.model.topology.InventoryItem;
import com.vibecoding.fleetcatalog.model.topology.RancherCluster;
import com.vibecoding.fleetcatalog.model.topology.RancherNode;

import java.util.List;

/**
 * 다운스트림 클러스터 인벤토리 조회
 *
 * 클러스터별 호출 실패는 해당 클러스터만 결과에서 빠지고,
 * 호출 전체가 실패하면 failure 를 반환한다.
 */
public interface TopologyClient {

    boolean isEnabled();

    FetchResult<List<RancherCluster>> listClusterDetails();

    FetchResult<List<ClusterItems<InventoryItem>>> listNodesDetailed(List<RancherCluster> clusters);

    FetchResult<List<ClusterItems<InventoryItem>>> listMachineDeploymentGroups(List<RancherCluster> clusters);

    FetchResult<List<ClusterVersion>> listClusterVersions(List<RancherCluster> clusters);

    /**
     * Harvester 클러스터만 조회
     */
    FetchResult<List<ClusterItems<InventoryItem>>> listVirtualMachineGroups(List<RancherCluster> clusters);

    /**
     * degraded 경로용 단일 클러스터 노드 목록 (/v3/clusters/{id}/nodes)
     */
    FetchResult<List<RancherNode>> listClusterNodes(String clusterId);
}
