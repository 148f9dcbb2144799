package com.vibecoding.fleetcatalog.sync;

/**
 * provider 상태. SUCCEEDED/FAILED 는 마지막 패스 결과({@link FleetEntityProvider#getLastResult()})에만 쓰인다.
 */
public enum ProviderState {
    DISCONNECTED,
    CONNECTED,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isConnected() {
        return this != DISCONNECTED;
    }
}
