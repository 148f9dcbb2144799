package com.vibecoding.fleetcatalog.model.topology;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 다운스트림 클러스터별로 묶인 조회 결과
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterItems<T> {
    private String clusterId;
    private String clusterName;
    private List<T> items;
}
