package com.turdes.backend.modules.aidrequest.presentation;

import java.util.List;

import com.turdes.backend.global.security.JwtAuthenticationPrincipal;
import com.turdes.backend.modules.aidrequest.application.AidRequestService;
import com.turdes.backend.modules.aidrequest.presentation.dto.AidRequestResponse;
import com.turdes.backend.modules.aidrequest.presentation.dto.CreateAidRequestRequest;
import com.turdes.backend.modules.aidrequest.presentation.dto.UpdateAidRequestStatusRequest;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/aid-requests")
public class AidRequestController {

    private final AidRequestService aidRequestService;

    public AidRequestController(AidRequestService aidRequestService) {
        this.aidRequestService = aidRequestService;
    }

    @GetMapping
    public ResponseEntity<List<AidRequestResponse>> listOwn(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(aidRequestService.listOwn(principal));
    }

    @PostMapping
    public ResponseEntity<AidRequestResponse> create(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody CreateAidRequestRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(aidRequestService.create(principal, request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AidRequestResponse> get(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable Long id
    ) {
        return ResponseEntity.ok(aidRequestService.get(principal, id));
    }

    @PreAuthorize("hasRole('ADMIN')")
    @PatchMapping("/{id}/status")
    public ResponseEntity<AidRequestResponse> updateStatus(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable Long id,
            @Valid @RequestBody UpdateAidRequestStatusRequest request
    ) {
        return ResponseEntity.ok(aidRequestService.updateStatus(principal, id, request.status()));
    }

    @PreAuthorize("hasRole('ADMIN')")
    @PatchMapping("/{id}/delete")
    public ResponseEntity<Void> delete(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable Long id
    ) {
        aidRequestService.softDelete(principal, id);
        return ResponseEntity.noContent().build();
    }
}
