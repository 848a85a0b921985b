package com.flagship.payday.health;

import com.flagship.payday.eventstore.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness/readiness probe. Ready means the database answers and the
 * event log can be read; everything else is reported by the actuator health endpoint.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final EventStore eventStore;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant().toString());

        boolean databaseUp = databaseAnswers();
        body.put("database", databaseUp ? "UP" : "DOWN");

        Long head = eventLogHead();
        body.put("eventLog", head != null ? "UP" : "DOWN");
        if (head != null) {
            body.put("lastGlobalPosition", head);
        }

        boolean ready = databaseUp && head != null;
        body.put("status", ready ? "UP" : "DOWN");
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean databaseAnswers() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private Long eventLogHead() {
        try {
            return eventStore.lastGlobalPosition();
        } catch (RuntimeException e) {
            log.warn("Event log health check failed: {}", e.getMessage());
            return null;
        }
    }
}
