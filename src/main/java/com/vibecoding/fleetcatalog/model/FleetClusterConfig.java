package com.vibecoding.fleetcatalog.model;

import io.fabric8.kubernetes.api.model.LabelSelector;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Fleet 관리 클러스터 연결 설정
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FleetClusterConfig {
    private String name;                        // 클러스터 이름 (Domain 이름)
    private String url;                         // API 서버 URL
    private String token;                       // Bearer 토큰
    private String caData;                      // base64 CA (선택적)

    @Builder.Default
    private boolean skipTlsVerify = false;

    @Builder.Default
    private List<FleetNamespaceConfig> namespaces = new ArrayList<>();

    @Builder.Default
    private boolean includeBundles = true;

    @Builder.Default
    private boolean includeBundleDeployments = false;

    @Builder.Default
    private boolean generateApis = false;

    @Builder.Default
    private boolean fetchFleetYaml = false;

    @Builder.Default
    private boolean autoTechdocsRef = true;

    private LabelSelector gitRepoSelector;      // 설정 시 네임스페이스별 selector 보다 우선
}
