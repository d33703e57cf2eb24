package com.frontline.controller;

import com.frontline.dto.MoveRequest;
import com.frontline.dto.PlayerDTO;
import com.frontline.dto.RegisterPlayerRequest;
import com.frontline.model.MovementType;
import com.frontline.model.Player;
import com.frontline.service.ErrorKind;
import com.frontline.service.OperationResult;
import com.frontline.service.PlayerService;
import com.frontline.service.ResourceLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlayerControllerTest {

    @Mock private PlayerService playerService;
    @Mock private ResourceLedger ledger;

    @InjectMocks
    private PlayerController controller;

    @Test
    @DisplayName("POST /api/players returns 201 with the new player")
    void register() {
        Player player = Player.builder().id("p-1").username("scout").displayName("Scout").resources(100).build();
        when(playerService.registerPlayer("scout", "Scout")).thenReturn(OperationResult.ok(player));

        ResponseEntity<Object> response = controller.registerPlayer(new RegisterPlayerRequest("scout", "Scout"));

        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        assertEquals("p-1", ((PlayerDTO) response.getBody()).getId());
    }

    @Test
    @DisplayName("POST /api/players returns 409 for a taken username")
    void registerDuplicate() {
        when(playerService.registerPlayer("scout", null))
                .thenReturn(OperationResult.failure(ErrorKind.CONFLICT, "Username already taken: scout"));

        assertEquals(HttpStatus.CONFLICT,
                controller.registerPlayer(new RegisterPlayerRequest("scout", null)).getStatusCode());
    }

    @Test
    @DisplayName("POST /api/players/move defaults to walking")
    void moveDefaultsToWalk() {
        Player player = Player.builder().id("alice").countryId("FR").build();
        when(playerService.move("alice", 48.0, 2.0, MovementType.WALK)).thenReturn(OperationResult.ok(player));

        ResponseEntity<Object> response = controller.move(new MoveRequest(48.0, 2.0, null), "alice");

        assertEquals(HttpStatus.OK, response.getStatusCode());
    }

    @Test
    @DisplayName("GET /api/players/{id}/resources returns the balance")
    void resources() {
        when(ledger.balanceOf("alice")).thenReturn(OperationResult.ok(42));

        ResponseEntity<Object> response = controller.getResources("alice");

        assertEquals(Map.of("playerId", "alice", "resources", 42), response.getBody());
    }

    @Test
    @DisplayName("GET /api/players/{id}/resources returns 404 for unknown players")
    void resourcesUnknown() {
        when(ledger.balanceOf("ghost")).thenReturn(OperationResult.failure(ErrorKind.NOT_FOUND, "Account not found: ghost"));

        assertEquals(HttpStatus.NOT_FOUND, controller.getResources("ghost").getStatusCode());
    }
}
