package com.vibecoding.fleetcatalog.exception;

/**
 * 등록되지 않은 provider ID 요청
 */
public class FleetProviderNotFoundException extends RuntimeException {

    public FleetProviderNotFoundException(String providerId) {
        super("Fleet provider not found: " + providerId);
    }
}
