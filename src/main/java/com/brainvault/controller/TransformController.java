package com.brainvault.controller;

import com.brainvault.dto.request.TransformRequest;
import com.brainvault.dto.response.TransformResponse;
import com.brainvault.service.TransformService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/v1/transform: derive content, an IP outline or tasks from one of the caller's
 * ideas. Answers 200 even when the generation provider is unavailable (local fallback text).
 */
@RestController
@RequestMapping("/api/v1/transform")
@RequiredArgsConstructor
@Slf4j
public class TransformController {

    private final TransformService transformService;

    @PostMapping
    public ResponseEntity<TransformResponse> transform(
            @Valid @RequestBody TransformRequest request,
            Authentication authentication) {

        log.info("Transform request received: ideaId={}, outputType={}, user={}",
                request.getIdeaId(), request.getOutputType(), authentication.getName());

        return ResponseEntity.ok(transformService.transform(
                request.getIdeaId(), authentication.getName(), request.getOutputType()));
    }
}
