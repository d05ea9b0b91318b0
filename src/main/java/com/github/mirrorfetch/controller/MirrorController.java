package com.github.mirrorfetch.controller;

import com.github.mirrorfetch.exception.MirrorRegistryException;
import com.github.mirrorfetch.model.MirrorSite;
import com.github.mirrorfetch.service.MirrorHealthChecker;
import com.github.mirrorfetch.service.MirrorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/mirrors")
@RequiredArgsConstructor
public class MirrorController {

    private final MirrorRegistry registry;
    private final MirrorHealthChecker healthChecker;

    @GetMapping
    public ResponseEntity<List<MirrorSite>> getMirrors() {
        return ResponseEntity.ok(registry.listMirrors());
    }

    /**
     * Add a mirror or update a known one
     */
    @PostMapping
    public ResponseEntity<MirrorSite> upsertMirror(@RequestBody MirrorSite mirror) {
        if (mirror.getBaseUrl() == null || mirror.getBaseUrl().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(registry.upsertMirror(mirror));
    }

    @PutMapping("/active")
    public ResponseEntity<Void> setActive(@RequestParam String baseUrl, @RequestParam boolean active) {
        boolean updated = registry.setActive(baseUrl, active);
        return updated ? ResponseEntity.ok().build() : ResponseEntity.notFound().build();
    }

    /**
     * Write the mirror list to disk now
     */
    @PostMapping("/save")
    public ResponseEntity<Void> save() {
        try {
            registry.persist();
            return ResponseEntity.noContent().build();
        } catch (MirrorRegistryException e) {
            log.error("Explicit mirror save failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    /**
     * HEAD every mirror and update health and active flags from the replies
     */
    @PostMapping("/check")
    public ResponseEntity<Map<String, Boolean>> checkHealth() {
        return ResponseEntity.ok(healthChecker.checkAll());
    }
}
