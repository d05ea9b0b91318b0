package com.github.mirrorfetch.controller;

import com.github.mirrorfetch.service.ProgressBroadcastService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Slf4j
@RestController
@RequestMapping("/api/progress")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressBroadcastService progressBroadcastService;

    /**
     * SSE endpoint for per-chunk transfer progress
     */
    @GetMapping("/stream")
    public SseEmitter streamProgress() {
        SseEmitter emitter = progressBroadcastService.createEmitter();
        log.info("New SSE connection established ({} active)", progressBroadcastService.getActiveConnections());
        return emitter;
    }
}
