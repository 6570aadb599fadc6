package com.sosapp.emergency.controller;

import com.sosapp.emergency.dto.AcknowledgeEmergencyRequest;
import com.sosapp.emergency.dto.AcknowledgeEmergencyResponse;
import com.sosapp.emergency.dto.AutoTriggerRequest;
import com.sosapp.emergency.dto.CancelEmergencyRequest;
import com.sosapp.emergency.dto.EmergencyDTO;
import com.sosapp.emergency.dto.EmergencyHistoryResponse;
import com.sosapp.emergency.dto.NotificationJobDTO;
import com.sosapp.emergency.dto.ResolveEmergencyRequest;
import com.sosapp.emergency.dto.TriggerEmergencyRequest;
import com.sosapp.emergency.dto.TriggerEmergencyResponse;
import com.sosapp.emergency.exception.UnauthorizedException;
import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.EmergencyType;
import com.sosapp.emergency.security.UserPrincipal;
import com.sosapp.emergency.service.EmergencyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/emergency")
@RequiredArgsConstructor
@Tag(name = "Emergency")
public class EmergencyController {

    public static final String DEVICE_TOKEN_HEADER = "X-Device-Token";

    private final EmergencyService emergencyService;

    @PostMapping("/trigger")
    @Operation(summary = "Start an emergency countdown")
    @ApiResponse(responseCode = "201", content = @Content(schema = @Schema(implementation = TriggerEmergencyResponse.class)))
    public ResponseEntity<TriggerEmergencyResponse> trigger(@AuthenticationPrincipal UserPrincipal principal,
                                                            @Valid @RequestBody TriggerEmergencyRequest request) {
        Long userId = requireUserId(principal);
        return ResponseEntity.status(HttpStatus.CREATED).body(emergencyService.trigger(userId, request));
    }

    @PostMapping("/auto-trigger")
    @Operation(summary = "Start an emergency countdown from a paired device",
            security = @SecurityRequirement(name = "deviceToken"))
    @ApiResponse(responseCode = "201", content = @Content(schema = @Schema(implementation = TriggerEmergencyResponse.class)))
    public ResponseEntity<TriggerEmergencyResponse> autoTrigger(@RequestHeader(DEVICE_TOKEN_HEADER) String deviceToken,
                                                                @Valid @RequestBody AutoTriggerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(emergencyService.autoTrigger(deviceToken, request));
    }

    @PutMapping("/{id}/cancel")
    @Operation(summary = "Cancel an emergency during its countdown")
    public ResponseEntity<EmergencyDTO> cancel(@AuthenticationPrincipal UserPrincipal principal,
                                               @PathVariable UUID id,
                                               @Valid @RequestBody(required = false) CancelEmergencyRequest request) {
        Long userId = requireUserId(principal);
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(emergencyService.cancel(id, userId, reason));
    }

    @PutMapping("/{id}/resolve")
    @Operation(summary = "Mark an emergency as resolved")
    public ResponseEntity<EmergencyDTO> resolve(@AuthenticationPrincipal UserPrincipal principal,
                                                @PathVariable UUID id,
                                                @Valid @RequestBody(required = false) ResolveEmergencyRequest request) {
        Long userId = requireUserId(principal);
        String notes = request != null ? request.getNotes() : null;
        return ResponseEntity.ok(emergencyService.resolve(id, userId, notes));
    }

    @PostMapping("/{id}/acknowledge")
    @Operation(summary = "Acknowledge an emergency as one of the owner's contacts")
    public ResponseEntity<AcknowledgeEmergencyResponse> acknowledge(@AuthenticationPrincipal UserPrincipal principal,
                                                                    @PathVariable UUID id,
                                                                    @Valid @RequestBody(required = false) AcknowledgeEmergencyRequest request) {
        Long contactId = requireUserId(principal);
        return ResponseEntity.ok(emergencyService.acknowledge(id, contactId, request));
    }

    @GetMapping("/history")
    @Operation(summary = "Emergency history of the caller, newest first")
    public ResponseEntity<EmergencyHistoryResponse> history(
            @AuthenticationPrincipal UserPrincipal principal,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize,
            @RequestParam(required = false) EmergencyStatus status,
            @RequestParam(required = false) EmergencyType type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        Long userId = requireUserId(principal);
        return ResponseEntity.ok(emergencyService.history(userId, page, pageSize, status, type, from, to));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get an emergency with its acknowledgments and escalation progress")
    public ResponseEntity<EmergencyDTO> get(@AuthenticationPrincipal UserPrincipal principal, @PathVariable UUID id) {
        Long userId = requireUserId(principal);
        return ResponseEntity.ok(emergencyService.get(id, userId));
    }

    @GetMapping("/{id}/notifications")
    @Operation(summary = "Notification jobs of an emergency")
    public ResponseEntity<List<NotificationJobDTO>> notifications(@AuthenticationPrincipal UserPrincipal principal,
                                                                  @PathVariable UUID id) {
        Long userId = requireUserId(principal);
        return ResponseEntity.ok(emergencyService.notifications(id, userId));
    }

    private Long requireUserId(UserPrincipal principal) {
        if (principal == null || principal.getUserId() == null) {
            throw new UnauthorizedException("Missing authentication");
        }
        return principal.getUserId();
    }
}
