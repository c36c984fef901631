package com.contactbook.common.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 数据库连通性检查。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final HealthMapper healthMapper;

    @GetMapping("/api/healthchecker")
    public ResponseEntity<Map<String, String>> healthchecker() {
        try {
            Integer result = healthMapper.ping();
            if (result == null) {
                return error("Database is not configured correctly");
            }
            return ResponseEntity.ok(Map.of("message", "Welcome to Contact Book!"));
        } catch (DataAccessException ex) {
            log.error("Health check failed", ex);
            return error("Error connecting to database");
        }
    }

    private static ResponseEntity<Map<String, String>> error(String message) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("message", message));
    }
}
