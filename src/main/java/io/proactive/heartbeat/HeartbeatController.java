package io.proactive.heartbeat;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Lets an operator run a heartbeat check on demand.
 */
@RestController
@RequestMapping("/api/heartbeat")
public class HeartbeatController {

    private final ObjectProvider<HeartbeatRunner> heartbeatRunner;

    public HeartbeatController(ObjectProvider<HeartbeatRunner> heartbeatRunner) {
        this.heartbeatRunner = heartbeatRunner;
    }

    @PostMapping("/run")
    public ResponseEntity<Map<String, String>> run() {
        HeartbeatRunner runner = heartbeatRunner.getIfAvailable();
        if (runner == null) {
            return ResponseEntity.status(409).body(Map.of("error", "Heartbeat runner is not enabled"));
        }
        runner.triggerNow();
        return ResponseEntity.ok(Map.of("status", "triggered"));
    }
}
