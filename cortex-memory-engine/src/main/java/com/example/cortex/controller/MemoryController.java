package com.example.cortex.controller;

import com.example.cortex.domain.OperationClass;
import com.example.cortex.domain.RateLimitStatus;
import com.example.cortex.dto.EnsureSpaceRequest;
import com.example.cortex.dto.FactStoredResponse;
import com.example.cortex.dto.ImportanceRequest;
import com.example.cortex.dto.ImportanceResponse;
import com.example.cortex.dto.MemorySpaceResponse;
import com.example.cortex.dto.PreferencesResult;
import com.example.cortex.dto.PropertyInteractionRecall;
import com.example.cortex.dto.RecallResult;
import com.example.cortex.dto.RememberRequest;
import com.example.cortex.dto.RememberResult;
import com.example.cortex.dto.StorePreferenceRequest;
import com.example.cortex.service.InteractionRecorderService;
import com.example.cortex.service.MemorySpaceService;
import com.example.cortex.service.PreferenceService;
import com.example.cortex.service.RecallService;
import com.example.cortex.service.ratelimit.RateLimitIdentityResolver;
import com.example.cortex.service.ratelimit.RateLimiterService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/memory")
public class MemoryController {

    static final String SESSION_TOKEN_HEADER = "X-Session-Token";

    private final MemorySpaceService memorySpaceService;
    private final InteractionRecorderService interactionRecorderService;
    private final PreferenceService preferenceService;
    private final RecallService recallService;
    private final RateLimiterService rateLimiterService;
    private final RateLimitIdentityResolver identityResolver;

    public MemoryController(
            MemorySpaceService memorySpaceService,
            InteractionRecorderService interactionRecorderService,
            PreferenceService preferenceService,
            RecallService recallService,
            RateLimiterService rateLimiterService,
            RateLimitIdentityResolver identityResolver) {
        this.memorySpaceService = memorySpaceService;
        this.interactionRecorderService = interactionRecorderService;
        this.preferenceService = preferenceService;
        this.recallService = recallService;
        this.rateLimiterService = rateLimiterService;
        this.identityResolver = identityResolver;
    }

    @PostMapping("/spaces")
    public ResponseEntity<MemorySpaceResponse> ensureSpace(
            @Valid @RequestBody EnsureSpaceRequest request,
            @RequestHeader(name = SESSION_TOKEN_HEADER, required = false) String sessionToken) {
        String memorySpaceId = memorySpaceService.ensureSpace(request.getUserId(), sessionToken);
        return ResponseEntity.ok(MemorySpaceResponse.builder()
                .userId(request.getUserId())
                .memorySpaceId(memorySpaceId)
                .build());
    }

    @PostMapping("/interactions")
    public ResponseEntity<RememberResult> remember(
            @Valid @RequestBody RememberRequest request,
            @RequestHeader(name = SESSION_TOKEN_HEADER, required = false) String sessionToken) {
        return ResponseEntity.ok(interactionRecorderService.remember(
                request.getUserId(),
                request.getUserQuery(),
                request.getAgentResponse(),
                request.getPropertyId(),
                request.getPropertyContext(),
                sessionToken));
    }

    @PatchMapping("/memories/{memoryId}/importance")
    public ResponseEntity<ImportanceResponse> reviseImportance(
            @PathVariable String memoryId,
            @Valid @RequestBody ImportanceRequest request,
            @RequestHeader(name = SESSION_TOKEN_HEADER, required = false) String sessionToken) {
        return ResponseEntity.ok(interactionRecorderService.reviseImportance(
                request.getUserId(), memoryId, request.getImportance(), sessionToken));
    }

    @PostMapping("/preferences")
    public ResponseEntity<FactStoredResponse> storePreference(
            @Valid @RequestBody StorePreferenceRequest request,
            @RequestHeader(name = SESSION_TOKEN_HEADER, required = false) String sessionToken) {
        String factId = preferenceService.storePreference(
                request.getUserId(),
                request.getCategory(),
                request.getPreference(),
                request.getConfidence(),
                request.getMetadata(),
                sessionToken);
        return ResponseEntity.ok(FactStoredResponse.builder().factId(factId).build());
    }

    @GetMapping("/preferences")
    public ResponseEntity<PreferencesResult> getPreferences(
            @RequestParam String userId,
            @RequestParam(required = false) String category) {
        return ResponseEntity.ok(preferenceService.getPreferences(userId, category));
    }

    @GetMapping("/recall")
    public ResponseEntity<RecallResult> recall(
            @RequestParam String userId,
            @RequestParam(required = false) String query,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(recallService.recall(userId, query, limit));
    }

    @GetMapping("/property-history")
    public ResponseEntity<List<PropertyInteractionRecall>> getPropertyHistory(
            @RequestParam String userId,
            @RequestParam(required = false) String propertyId) {
        return ResponseEntity.ok(recallService.getPropertyHistory(userId, propertyId));
    }

    @GetMapping("/rate-limit")
    public ResponseEntity<RateLimitStatus> rateLimitStatus(
            @RequestParam(required = false) String userId,
            @RequestParam(defaultValue = "MEMORY_OPERATIONS") String operationClass,
            @RequestHeader(name = SESSION_TOKEN_HEADER, required = false) String sessionToken) {
        OperationClass resolvedClass;
        try {
            resolvedClass = OperationClass.valueOf(operationClass.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported operation class: " + operationClass);
        }
        String identity = identityResolver.resolve(userId, sessionToken);
        return ResponseEntity.ok(rateLimiterService.status(identity, resolvedClass));
    }
}
