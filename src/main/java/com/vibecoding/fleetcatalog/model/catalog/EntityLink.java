package com.vibecoding.fleetcatalog.model.catalog;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EntityLink {
    private String url;
    private String title;
}
