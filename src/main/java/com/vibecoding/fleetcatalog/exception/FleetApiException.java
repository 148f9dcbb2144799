package com.vibecoding.fleetcatalog.exception;

/**
 * Fleet/Rancher API 클라이언트 구성 또는 호출 중 발생하는 예외
 */
public class FleetApiException extends RuntimeException {

    public FleetApiException(String message) {
        super(message);
    }

    public FleetApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
