package com.frontline.controller;

import com.frontline.dto.BorderPushDTO;
import com.frontline.dto.DeclareWarRequest;
import com.frontline.dto.EndWarRequest;
import com.frontline.dto.StartPushRequest;
import com.frontline.dto.StopPushRequest;
import com.frontline.dto.WarDTO;
import com.frontline.model.GeoPoint;
import com.frontline.model.PushStatus;
import com.frontline.model.WarStatus;
import com.frontline.service.BorderPushService;
import com.frontline.service.WarService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for wars and border pushes. The acting player comes from the
 * {@code X-Player-Id} header set by the authentication layer.
 */
@RestController
@RequestMapping("/api/game")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class ConflictController {

    static final String PLAYER_HEADER = "X-Player-Id";

    private final WarService warService;
    private final BorderPushService borderPushService;

    /**
     * Declare war on another country (owner only).
     */
    @PostMapping("/declare-war")
    public ResponseEntity<Object> declareWar(@Valid @RequestBody DeclareWarRequest request,
                                             @RequestHeader(PLAYER_HEADER) String playerId) {
        log.info("Player {} declaring war on {}", playerId, request.getTargetCountryId());
        return OperationResponses.created(
                warService.declareWar(playerId, request.getAggressorCountryId(),
                        request.getTargetCountryId(), request.getReason()),
                WarDTO::fromWar);
    }

    /**
     * End a war (declarer only), optionally naming a winner.
     */
    @PostMapping("/end-war/{warId}")
    public ResponseEntity<Object> endWar(@PathVariable String warId,
                                         @RequestBody(required = false) EndWarRequest request,
                                         @RequestHeader(PLAYER_HEADER) String playerId) {
        String winner = request != null ? request.getWinnerCountryId() : null;
        log.info("Player {} ending war {} (winner: {})", playerId, warId, winner);
        return OperationResponses.ok(warService.endWar(warId, playerId, winner), WarDTO::fromWar);
    }

    @GetMapping("/wars")
    public ResponseEntity<List<WarDTO>> getWars(@RequestParam(required = false) WarStatus status) {
        return ResponseEntity.ok(warService.findWars(status).stream().map(WarDTO::fromWar).toList());
    }

    @GetMapping("/wars/{warId}")
    public ResponseEntity<Object> getWar(@PathVariable String warId) {
        return warService.getWar(warId)
                .<ResponseEntity<Object>>map(war -> ResponseEntity.ok(WarDTO.fromWar(war)))
                .orElseGet(() -> OperationResponses.notFound("War not found: " + warId));
    }

    /**
     * Start a border push into the war's defender.
     */
    @PostMapping("/border-push")
    public ResponseEntity<Object> startPush(@Valid @RequestBody StartPushRequest request,
                                            @RequestHeader(PLAYER_HEADER) String playerId) {
        log.info("Player {} starting border push in war {}", playerId, request.getWarId());
        return OperationResponses.created(
                borderPushService.startPush(playerId, request.getWarId(),
                        new GeoPoint(request.getLat(), request.getLng()),
                        new GeoPoint(request.getDirectionLat(), request.getDirectionLng()),
                        request.getTerrainModifier()),
                BorderPushDTO::fromPush);
    }

    @PostMapping("/border-push/{pushId}/join")
    public ResponseEntity<Object> joinPush(@PathVariable String pushId,
                                           @RequestHeader(PLAYER_HEADER) String playerId) {
        return OperationResponses.ok(borderPushService.join(pushId, playerId), BorderPushDTO::fromPush);
    }

    @PostMapping("/border-push/{pushId}/defend")
    public ResponseEntity<Object> defendPush(@PathVariable String pushId,
                                             @RequestHeader(PLAYER_HEADER) String playerId) {
        return OperationResponses.ok(borderPushService.defend(pushId, playerId), BorderPushDTO::fromPush);
    }

    /**
     * Stop the caller's own push. Defaults to CANCELLED.
     */
    @PostMapping("/border-push/{pushId}/stop")
    public ResponseEntity<Object> stopPush(@PathVariable String pushId,
                                           @RequestBody(required = false) StopPushRequest request,
                                           @RequestHeader(PLAYER_HEADER) String playerId) {
        PushStatus reason = request != null ? request.getReason() : PushStatus.CANCELLED;
        if (!reason.isTerminal()) {
            throw new IllegalArgumentException("Stop reason must be SUCCESSFUL, FAILED or CANCELLED");
        }
        log.info("Player {} stopping push {} ({})", playerId, pushId, reason);
        return OperationResponses.ok(borderPushService.stopPush(pushId, playerId, reason), BorderPushDTO::fromPush);
    }

    @GetMapping("/border-push/{pushId}/progress")
    public ResponseEntity<Object> getProgress(@PathVariable String pushId) {
        return OperationResponses.ok(borderPushService.peekProgress(pushId), progress -> progress);
    }

    @GetMapping("/border-pushes")
    public ResponseEntity<List<BorderPushDTO>> getPushes(@RequestParam(required = false) PushStatus status,
                                                         @RequestParam(required = false) String warId) {
        return ResponseEntity.ok(borderPushService.findPushes(status, warId).stream()
                .map(BorderPushDTO::fromPush)
                .toList());
    }
}
