package com.elssolution.insteonbridge.web;

import com.elssolution.insteonbridge.exception.BridgeNotConnectedException;
import com.elssolution.insteonbridge.exception.CommandFailedException;
import com.elssolution.insteonbridge.exception.CommandUnsupportedException;
import com.elssolution.insteonbridge.exception.DeviceNotFoundException;
import com.elssolution.insteonbridge.exception.DiscoveryFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Maps bridge failures onto status codes with a {@code {"success":false,"error":...}} body. */
@Slf4j
@RestControllerAdvice
public class BridgeExceptionHandler {

    @ExceptionHandler(DeviceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(DeviceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(BridgeNotConnectedException.class)
    public ResponseEntity<Map<String, Object>> notConnected(BridgeNotConnectedException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(CommandUnsupportedException.class)
    public ResponseEntity<Map<String, Object>> unsupported(CommandUnsupportedException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "JSON body required");
    }

    @ExceptionHandler({CommandFailedException.class, DiscoveryFailedException.class})
    public ResponseEntity<Map<String, Object>> upstream(RuntimeException e) {
        log.warn("[REST] upstream failure: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
