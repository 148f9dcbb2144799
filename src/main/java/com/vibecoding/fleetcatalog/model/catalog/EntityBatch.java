package com.vibecoding.fleetcatalog.model.catalog;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 동기화 중 누적되는 종류별 엔티티 목록
 */
@Getter
public class EntityBatch {

    private final List<CatalogEntity> domains = new ArrayList<>();
    private final List<CatalogEntity> systems = new ArrayList<>();
    private final List<CatalogEntity> components = new ArrayList<>();
    private final List<CatalogEntity> resources = new ArrayList<>();
    private final List<CatalogEntity> apis = new ArrayList<>();

    public void add(CatalogEntity entity) {
        switch (EntityKind.fromValue(entity.getKind())) {
            case DOMAIN:
                domains.add(entity);
                break;
            case SYSTEM:
                systems.add(entity);
                break;
            case COMPONENT:
                components.add(entity);
                break;
            case RESOURCE:
                resources.add(entity);
                break;
            case API:
                apis.add(entity);
                break;
            default:
                throw new IllegalArgumentException("Unsupported entity kind: " + entity.getKind());
        }
    }

    public void addAll(EntityBatch other) {
        domains.addAll(other.domains);
        systems.addAll(other.systems);
        components.addAll(other.components);
        resources.addAll(other.resources);
        apis.addAll(other.apis);
    }

    /**
     * Domain, System, Component, Resource, API 순서로 펼친다
     */
    public List<CatalogEntity> flatten() {
        List<CatalogEntity> all = new ArrayList<>(size());
        all.addAll(domains);
        all.addAll(systems);
        all.addAll(components);
        all.addAll(resources);
        all.addAll(apis);
        return all;
    }

    public int size() {
        return domains.size() + systems.size() + components.size() + resources.size() + apis.size();
    }
}
