package com.vibecoding.fleetcatalog.model.topology;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 노드/워크로드 인벤토리 항목 (kubernetes-node, kubernetes-machine-deployment, virtual-machine)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryItem {

    public static final String TYPE_NODE = "kubernetes-node";
    public static final String TYPE_MACHINE_DEPLOYMENT = "kubernetes-machine-deployment";
    public static final String TYPE_VIRTUAL_MACHINE = "virtual-machine";

    private String type;
    private String name;
    private String namespace;       // 다운스트림 네임스페이스 (노드는 없음)

    @Builder.Default
    private Map<String, String> details = new LinkedHashMap<>();
}
