package com.frontline.controller;

import com.frontline.dto.RestoreReport;
import com.frontline.dto.WorldSnapshot;
import com.frontline.service.WorldSnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin endpoints to export and restore the whole world.
 */
@RestController
@RequestMapping("/api/admin/snapshot")
@RequiredArgsConstructor
@Slf4j
public class SnapshotController {

    private final WorldSnapshotService snapshotService;

    @GetMapping
    public ResponseEntity<WorldSnapshot> exportSnapshot() {
        return ResponseEntity.ok(snapshotService.export());
    }

    @PostMapping
    public ResponseEntity<RestoreReport> restoreSnapshot(@RequestBody WorldSnapshot snapshot) {
        log.info("Restoring world snapshot taken at {}", snapshot.getTakenAt());
        return ResponseEntity.ok(snapshotService.restore(snapshot));
    }
}
