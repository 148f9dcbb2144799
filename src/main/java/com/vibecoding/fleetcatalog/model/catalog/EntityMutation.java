package com.vibecoding.fleetcatalog.model.catalog;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 카탈로그 변경 요청. FULL 은 같은 위치 식별자로 이전에 보낸 엔티티 전체를 대체한다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EntityMutation {

    public enum Type {
        FULL
    }

    private Type type;
    private List<DeferredEntity> entities;

    public static EntityMutation full(List<DeferredEntity> entities) {
        return new EntityMutation(Type.FULL, entities);
    }
}
