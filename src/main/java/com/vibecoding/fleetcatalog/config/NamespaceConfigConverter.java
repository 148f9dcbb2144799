package com.vibecoding.fleetcatalog.config;

import com.vibecoding.fleetcatalog.model.FleetNamespaceConfig;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * namespaces: [fleet-default] 처럼 문자열로 적은 항목 변환
 */
@Component
@ConfigurationPropertiesBinding
public class NamespaceConfigConverter implements Converter<String, FleetNamespaceConfig> {

    @Override
    public FleetNamespaceConfig convert(String source) {
        return FleetNamespaceConfig.of(source.trim());
    }
}
