package com.vibecoding.fleetcatalog.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Rancher 관리 API 기반 클러스터 토폴로지 설정
 */
@Configuration
@ConfigurationProperties(prefix = "catalog.providers.fleet-k8s-locator")
@Data
public class FleetLocatorProperties {

    private static final Logger log = LoggerFactory.getLogger(FleetLocatorProperties.class);

    private boolean enabled = true;
    private String rancherUrl;
    private String rancherToken;
    private boolean skipTlsVerify = false;
    private boolean includeLocal = true;

    @PostConstruct
    public void init() {
        // .env 에서 토큰 로드 (시스템 프로퍼티 우선, 환경변수 대체)
        if (rancherToken == null || rancherToken.isBlank()) {
            rancherToken = System.getProperty("RANCHER_TOKEN");
        }
        if (rancherToken == null || rancherToken.isBlank()) {
            rancherToken = System.getenv("RANCHER_TOKEN");
        }
        if (rancherUrl == null || rancherUrl.isBlank()) {
            rancherUrl = System.getProperty("RANCHER_URL", System.getenv("RANCHER_URL"));
        }

        validateConfig();
    }

    public void validateConfig() {
        if (!enabled) {
            log.info("Fleet k8s locator disabled by configuration");
            return;
        }
        if (rancherUrl == null || rancherUrl.isBlank() || rancherToken == null || rancherToken.isBlank()) {
            log.warn("Fleet k8s locator requires rancher-url and rancher-token, topology falls back to degraded mode");
            enabled = false;
            return;
        }

        rancherUrl = rancherUrl.replaceAll("/+$", "");
        log.info("Fleet k8s locator configuration validated successfully");
        log.info("  - Rancher URL: {}", rancherUrl);
        log.info("  - Skip TLS verify: {}", skipTlsVerify);
        log.info("  - Include local: {}", includeLocal);
    }
}
