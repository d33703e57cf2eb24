package com.frontline.service;

import com.frontline.dto.PlayerDTO;
import com.frontline.model.GeoPoint;
import com.frontline.model.MovementType;
import com.frontline.model.Player;
import com.frontline.repository.PlayerRepository;
import com.frontline.websocket.ConflictBroadcaster;
import com.frontline.websocket.ConflictBroadcaster.ConflictEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for player registration, movement and presence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlayerService {

    private final PlayerRepository playerRepository;
    private final ResourceLedger ledger;
    private final EntityLockRegistry lockRegistry;
    private final ConflictBroadcaster broadcaster;
    private final Clock clock;

    @Value("${game.player.starting-resources:100}")
    private int startingResources;

    @Value("${game.player.movement-cooldown-ms:1000}")
    private long movementCooldownMs;

    /**
     * Register a player with the starting balance. Usernames are unique ignoring case.
     */
    public OperationResult<Player> registerPlayer(String username, String displayName) {
        String key = EntityLockRegistry.USERNAME + username.toLowerCase(Locale.ROOT);
        return lockRegistry.withLock(key, () -> {
            if (playerRepository.findByUsername(username).isPresent()) {
                return OperationResult.failure(ErrorKind.CONFLICT, "Username already taken: " + username);
            }
            Player player = Player.builder()
                    .id(UUID.randomUUID().toString())
                    .username(username)
                    .displayName(displayName != null && !displayName.isBlank() ? displayName : username)
                    .resources(startingResources)
                    .createdAt(clock.instant())
                    .build();
            playerRepository.save(player);
            log.info("Registered player {} ({})", username, player.getId());
            return OperationResult.ok(player);
        });
    }

    public Optional<Player> getPlayer(String playerId) {
        return playerRepository.findById(playerId);
    }

    /**
     * Move a player inside their country. Costs resources by movement type and is
     * rate limited by the movement cooldown.
     */
    public OperationResult<Player> move(String playerId, double lat, double lng, MovementType movementType) {
        MovementType type = movementType != null ? movementType : MovementType.WALK;
        OperationResult<Player> precheck = checkMove(playerId, clock.instant());
        if (!precheck.isSuccess()) {
            return precheck;
        }

        OperationResult<Integer> debit = ledger.debit(playerId, type.getCost());
        if (!debit.isSuccess()) {
            return debit.propagate();
        }

        OperationResult<Player> moved = lockRegistry.withLock(EntityLockRegistry.PLAYER + playerId, () -> {
            Instant now = clock.instant();
            OperationResult<Player> recheck = checkMove(playerId, now);
            if (!recheck.isSuccess()) {
                return recheck;
            }
            Player updated = playerRepository.update(playerId, p -> {
                p.setPosition(new GeoPoint(lat, lng));
                p.setLastMovement(now);
            }).orElseThrow();
            return OperationResult.ok(updated);
        });

        if (!moved.isSuccess()) {
            ledger.credit(playerId, type.getCost());
            log.debug("Refunded {} to player {} after rejected move: {}", type.getCost(), playerId, moved.getMessage());
            return moved;
        }

        Player player = moved.getValue();
        broadcaster.broadcast(player.getCountryId(), ConflictEvent.playerMoved(PlayerDTO.fromPlayer(player)));
        return moved;
    }

    private OperationResult<Player> checkMove(String playerId, Instant now) {
        Optional<Player> player = playerRepository.findById(playerId);
        if (player.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Player not found: " + playerId);
        }
        if (player.get().getCountryId() == null) {
            return OperationResult.failure(ErrorKind.INVALID_STATE, "You must join a country before moving");
        }
        Instant lastMovement = player.get().getLastMovement();
        if (lastMovement != null) {
            long elapsed = Duration.between(lastMovement, now).toMillis();
            if (elapsed < movementCooldownMs) {
                return OperationResult.cooldown("Movement is on cooldown", movementCooldownMs - elapsed);
            }
        }
        return OperationResult.ok(player.get());
    }

    /**
     * Presence flag maintained by the websocket session listener.
     */
    public void markOnline(String playerId, boolean online) {
        playerRepository.update(playerId, p -> p.setOnline(online));
    }
}
