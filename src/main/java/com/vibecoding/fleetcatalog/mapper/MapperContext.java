package com.vibecoding.fleetcatalog.mapper;

import com.vibecoding.fleetcatalog.model.FleetClusterConfig;
import com.vibecoding.fleetcatalog.model.fleetyaml.FleetYaml;
import lombok.Builder;
import lombok.Getter;

/**
 * 매퍼 입력 컨텍스트. GitRepo 단위로 fleetYaml 만 바꿔서 재사용한다.
 */
@Getter
@Builder(toBuilder = true)
public class MapperContext {

    private final FleetClusterConfig cluster;
    private final String locationKey;
    private final FleetYaml fleetYaml;

    @Builder.Default
    private final boolean autoTechdocsRef = true;

    public static MapperContext of(FleetClusterConfig cluster, String locationKey) {
        return MapperContext.builder()
                .cluster(cluster)
                .locationKey(locationKey)
                .autoTechdocsRef(cluster.isAutoTechdocsRef())
                .build();
    }

    public MapperContext withFleetYaml(FleetYaml fleetYaml) {
        return toBuilder().fleetYaml(fleetYaml).build();
    }

    public String getClusterName() {
        return cluster != null ? cluster.getName() : null;
    }
}
