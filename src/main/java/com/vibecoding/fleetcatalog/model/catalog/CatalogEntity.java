package com.vibecoding.fleetcatalog.model.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 카탈로그로 내보내는 엔티티
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CatalogEntity {

    public static final String API_VERSION = "backstage.io/v1alpha1";

    @Builder.Default
    private String apiVersion = API_VERSION;

    private String kind;
    private EntityMetadata metadata;
    private EntitySpec spec;

    /**
     * 중복 제거 키이자 다른 엔티티가 가리키는 참조
     */
    @JsonIgnore
    public String getRef() {
        return EntityRef.of(kind, metadata.getNamespace(), metadata.getName());
    }
}
