package com.vibecoding.fleetcatalog.exception;

/**
 * connect() 전에 run() 이 호출된 경우
 */
public class FleetProviderNotConnectedException extends RuntimeException {

    private final String providerName;

    public FleetProviderNotConnectedException(String providerName) {
        super("Provider " + providerName + " is not connected");
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
