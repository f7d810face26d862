package com.example.bridge.controller;

import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.SweepReport;
import com.example.bridge.domain.ThreadMapping;
import com.example.bridge.domain.ThreadResolution;
import com.example.bridge.dto.InboundActivity;
import com.example.bridge.service.MappingLifecycleManager;
import com.example.bridge.service.ResolutionService;
import com.example.bridge.service.ThreadMappingService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/thread-mappings")
public class ThreadMappingController {

    private final ResolutionService resolutionService;
    private final ThreadMappingService threadMappingService;
    private final MappingLifecycleManager lifecycleManager;

    public ThreadMappingController(
            ResolutionService resolutionService,
            ThreadMappingService threadMappingService,
            MappingLifecycleManager lifecycleManager) {
        this.resolutionService = resolutionService;
        this.threadMappingService = threadMappingService;
        this.lifecycleManager = lifecycleManager;
    }

    @PostMapping("/resolve")
    public ResponseEntity<ThreadResolution> resolve(@RequestBody InboundActivity activity) {
        return ResponseEntity.ok(resolutionService.resolve(activity));
    }

    @GetMapping("/{threadId}/context")
    public ResponseEntity<ConversationContext> context(@PathVariable String threadId) {
        return resolutionService.lookupContext(threadId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<List<ThreadMapping>> listActive(
            @RequestParam String tenantId,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(threadMappingService.listActive(tenantId, limit));
    }

    @PostMapping("/{threadId}/deactivate")
    public ResponseEntity<Void> deactivate(@PathVariable String threadId) {
        threadMappingService.deactivate(threadId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{threadId}")
    public ResponseEntity<Void> release(@PathVariable String threadId) {
        threadMappingService.release(threadId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/sweep")
    public ResponseEntity<SweepReport> sweep() {
        return ResponseEntity.ok(lifecycleManager.sweepWithLock());
    }
}
