package com.frontline.controller;

import com.frontline.dto.MoveRequest;
import com.frontline.dto.PlayerDTO;
import com.frontline.dto.RegisterPlayerRequest;
import com.frontline.service.PlayerService;
import com.frontline.service.ResourceLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API controller for players.
 */
@RestController
@RequestMapping("/api/players")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class PlayerController {

    private final PlayerService playerService;
    private final ResourceLedger ledger;

    @PostMapping
    public ResponseEntity<Object> registerPlayer(@Valid @RequestBody RegisterPlayerRequest request) {
        log.info("Registering player {}", request.getUsername());
        return OperationResponses.created(
                playerService.registerPlayer(request.getUsername(), request.getDisplayName()),
                PlayerDTO::fromPlayer);
    }

    @GetMapping("/{playerId}")
    public ResponseEntity<Object> getPlayer(@PathVariable String playerId) {
        return playerService.getPlayer(playerId)
                .<ResponseEntity<Object>>map(player -> ResponseEntity.ok(PlayerDTO.fromPlayer(player)))
                .orElseGet(() -> OperationResponses.notFound("Player not found: " + playerId));
    }

    @PostMapping("/move")
    public ResponseEntity<Object> move(@Valid @RequestBody MoveRequest request,
                                       @RequestHeader(ConflictController.PLAYER_HEADER) String playerId) {
        return OperationResponses.ok(
                playerService.move(playerId, request.getLat(), request.getLng(), request.getMovementType()),
                PlayerDTO::fromPlayer);
    }

    @GetMapping("/{playerId}/resources")
    public ResponseEntity<Object> getResources(@PathVariable String playerId) {
        return OperationResponses.ok(ledger.balanceOf(playerId),
                balance -> Map.of("playerId", playerId, "resources", balance));
    }
}
