package com.vibecoding.fleetcatalog.sync;

import com.vibecoding.fleetcatalog.model.catalog.EntityMutation;

/**
 * provider 가 동기화 결과를 내보내는 출력 채널
 */
@FunctionalInterface
public interface EntityProviderConnection {

    void applyMutation(EntityMutation mutation);
}
