package com.frontline.controller;

import com.frontline.dto.CountryDTO;
import com.frontline.dto.JoinCountryRequest;
import com.frontline.dto.PlayerDTO;
import com.frontline.model.GeoPoint;
import com.frontline.service.CountryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for countries and membership.
 */
@RestController
@RequestMapping("/api/countries")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class CountryController {

    private final CountryService countryService;

    @GetMapping
    public ResponseEntity<List<CountryDTO>> getCountries(
            @RequestParam(required = false, defaultValue = "false") boolean claimedOnly) {
        return ResponseEntity.ok(countryService.findCountries(claimedOnly).stream()
                .map(CountryDTO::fromCountry)
                .toList());
    }

    @GetMapping("/{countryId}")
    public ResponseEntity<Object> getCountry(@PathVariable String countryId) {
        return countryService.getCountry(countryId)
                .<ResponseEntity<Object>>map(country -> ResponseEntity.ok(CountryDTO.fromCountry(country)))
                .orElseGet(() -> OperationResponses.notFound("Country not found: " + countryId));
    }

    @GetMapping("/{countryId}/soldiers")
    public ResponseEntity<Object> getSoldiers(@PathVariable String countryId) {
        return OperationResponses.ok(countryService.findSoldiers(countryId),
                soldiers -> soldiers.stream().map(PlayerDTO::fromPlayer).toList());
    }

    /**
     * The country's timeline, newest first.
     */
    @GetMapping("/{countryId}/history")
    public ResponseEntity<Object> getHistory(@PathVariable String countryId,
                                             @RequestParam(required = false, defaultValue = "50") int limit) {
        return OperationResponses.ok(countryService.getHistory(countryId, limit), history -> history);
    }

    /**
     * Join a country as a soldier; claims it when unclaimed.
     */
    @PostMapping("/{countryId}/join")
    public ResponseEntity<Object> joinCountry(@PathVariable String countryId,
                                              @Valid @RequestBody(required = false) JoinCountryRequest request,
                                              @RequestHeader(ConflictController.PLAYER_HEADER) String playerId) {
        log.info("Player {} joining country {}", playerId, countryId);
        GeoPoint spawn = null;
        if (request != null && request.getSpawnLat() != null && request.getSpawnLng() != null) {
            spawn = new GeoPoint(request.getSpawnLat(), request.getSpawnLng());
        }
        return OperationResponses.ok(countryService.joinCountry(playerId, countryId, spawn), result -> result);
    }

    @PostMapping("/leave")
    public ResponseEntity<Object> leaveCountry(@RequestHeader(ConflictController.PLAYER_HEADER) String playerId) {
        log.info("Player {} leaving their country", playerId);
        return OperationResponses.ok(countryService.leaveCountry(playerId), result -> result);
    }
}
