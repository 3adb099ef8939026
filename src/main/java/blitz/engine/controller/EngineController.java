package blitz.engine.controller;

import blitz.engine.dto.ApiResponse;
import blitz.engine.service.engine.BuildLogService;
import blitz.engine.service.engine.Engine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class EngineController {
    private final Engine<?, ?> engine;
    private final BuildLogService buildLogService;

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getStatus() {
        try {
            Map<String, Object> status = Map.of(
                    "mode", engine.getMode().name().toLowerCase(),
                    "state", engine.getState(),
                    "subscribers", engine.getEventBus().getSubscriberCount(),
                    "droppedEvents", engine.getEventBus().getDroppedEventCount()
            );
            return ResponseEntity.ok(ApiResponse.success(status));
        } catch (Exception e) {
            log.error("Error getting engine status", e);
            return ResponseEntity.internalServerError()
                    .body(ApiResponse.error("Failed to get engine status"));
        }
    }

    @GetMapping("/logs")
    public ResponseEntity<ApiResponse<List<String>>> getLogs() {
        return ResponseEntity.ok(ApiResponse.success(buildLogService.getHistory()));
    }
}
