package com.vibecoding.fleetcatalog.model.catalog;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 위치 식별자와 함께 내보내는 엔티티
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeferredEntity {
    private CatalogEntity entity;
    private String locationKey;
}
