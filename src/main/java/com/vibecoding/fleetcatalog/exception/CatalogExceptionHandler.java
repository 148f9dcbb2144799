package com.vibecoding.fleetcatalog.exception;

import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 카탈로그 REST API 예외 처리 핸들러
 */
@RestControllerAdvice
public class CatalogExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CatalogExceptionHandler.class);

    @ExceptionHandler(FleetProviderNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleProviderNotFound(FleetProviderNotFoundException ex) {
        log.warn("Provider not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "Provider를 찾을 수 없습니다", ex.getMessage());
    }

    @ExceptionHandler(FleetProviderNotConnectedException.class)
    public ResponseEntity<Map<String, Object>> handleNotConnected(FleetProviderNotConnectedException ex) {
        log.warn("Provider not connected: {}", ex.getProviderName());
        return error(HttpStatus.CONFLICT, "Provider가 연결되지 않았습니다", ex.getMessage());
    }

    @ExceptionHandler(FleetSyncException.class)
    public ResponseEntity<Map<String, Object>> handleSyncFailure(FleetSyncException ex) {
        log.error("Sync failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "동기화 실패", ex.getMessage());
    }

    @ExceptionHandler(FleetApiException.class)
    public ResponseEntity<Map<String, Object>> handleFleetApiException(FleetApiException ex) {
        log.error("Fleet API error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "API 호출 실패", ex.getMessage());
    }

    @ExceptionHandler(KubernetesClientException.class)
    public ResponseEntity<Map<String, Object>> handleK8sClientException(KubernetesClientException ex) {
        log.error("Kubernetes client error: {}", ex.getMessage(), ex);

        String message;
        if (ex.getCode() == 401 || ex.getCode() == 403) {
            message = "Fleet 관리 클러스터 접근 권한이 없습니다.";
        } else {
            message = "Fleet 관리 클러스터에 연결할 수 없습니다: " + ex.getMessage();
        }
        return error(HttpStatus.SERVICE_UNAVAILABLE, "클러스터 연결 실패", message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "잘못된 요청", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "서버 오류", "예기치 않은 오류가 발생했습니다: " + ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String title, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", LocalDateTime.now().toString());
        body.put("status", status.value());
        body.put("title", title);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
