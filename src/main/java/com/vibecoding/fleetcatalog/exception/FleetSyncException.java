package com.vibecoding.fleetcatalog.exception;

/**
 * 동기화 패스 전체가 실패했을 때 발생하는 예외
 */
public class FleetSyncException extends RuntimeException {

    public FleetSyncException(String message) {
        super(message);
    }

    public FleetSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
