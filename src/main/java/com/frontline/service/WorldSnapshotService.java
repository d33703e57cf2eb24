package com.frontline.service;

import com.frontline.dto.RestoreReport;
import com.frontline.dto.WorldSnapshot;
import com.frontline.model.BorderPush;
import com.frontline.model.Country;
import com.frontline.model.Player;
import com.frontline.model.PushStatus;
import com.frontline.model.War;
import com.frontline.repository.BorderPushRepository;
import com.frontline.repository.CountryRepository;
import com.frontline.repository.PlayerRepository;
import com.frontline.repository.WarRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Export and restore of the whole in-memory world.
 * <p>
 * Restore replaces every store and is meant for an idle world (start-up, maintenance);
 * it does not coordinate with in-flight requests.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorldSnapshotService {

    private final CountryRepository countryRepository;
    private final PlayerRepository playerRepository;
    private final WarRepository warRepository;
    private final BorderPushRepository pushRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WorldSnapshot export() {
        return WorldSnapshot.builder()
                .takenAt(clock.instant())
                .countries(new ArrayList<>(countryRepository.findAll()))
                .players(new ArrayList<>(playerRepository.findAll()))
                .wars(new ArrayList<>(warRepository.findAll()))
                .pushes(new ArrayList<>(pushRepository.findAll()))
                .build();
    }

    public String toJson(WorldSnapshot snapshot) {
        return objectMapper.writeValueAsString(snapshot);
    }

    public WorldSnapshot fromJson(String json) {
        return objectMapper.readValue(json, WorldSnapshot.class);
    }

    /**
     * Replace the world with {@code snapshot}, repairing derived data.
     *
     * @throws IllegalArgumentException if the snapshot is structurally corrupt; the
     *                                  current world is left untouched in that case
     */
    public RestoreReport restore(WorldSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot is required");
        }
        List<Country> countries = copies(snapshot.getCountries(), Country::copy);
        List<Player> players = copies(snapshot.getPlayers(), Player::copy);
        List<War> wars = copies(snapshot.getWars(), War::copy);
        List<BorderPush> pushes = copies(snapshot.getPushes(), BorderPush::copy);

        requireUniqueIds("country", countries, Country::getId);
        requireUniqueIds("player", players, Player::getId);
        requireUniqueIds("war", wars, War::getId);
        requireUniqueIds("push", pushes, BorderPush::getId);
        validateBalances(countries, players);
        validateWars(wars);

        Instant now = clock.instant();
        int pushesCancelled = repairPushes(pushes, wars, now);
        int countriesRepaired = recountWars(countries, wars);

        countryRepository.deleteAll();
        playerRepository.deleteAll();
        warRepository.deleteAll();
        pushRepository.deleteAll();
        countryRepository.saveAll(countries);
        playerRepository.saveAll(players);
        warRepository.saveAll(wars);
        pushRepository.saveAll(pushes);

        RestoreReport report = RestoreReport.builder()
                .countries(countries.size())
                .players(players.size())
                .wars(wars.size())
                .pushes(pushes.size())
                .pushesCancelled(pushesCancelled)
                .countriesRepaired(countriesRepaired)
                .build();
        log.info("Restored world snapshot taken at {}: {}", snapshot.getTakenAt(), report);
        return report;
    }

    private void validateBalances(List<Country> countries, List<Player> players) {
        for (Country country : countries) {
            if (country.getResources() < 0) {
                throw new IllegalArgumentException("Country " + country.getId() + " has a negative balance");
            }
        }
        for (Player player : players) {
            if (player.getResources() < 0) {
                throw new IllegalArgumentException("Player " + player.getId() + " has a negative balance");
            }
        }
    }

    private void validateWars(List<War> wars) {
        Set<String> activePairs = new HashSet<>();
        for (War war : wars) {
            if (war.getAggressorCountryId() == null || war.getDefenderCountryId() == null) {
                throw new IllegalArgumentException("War " + war.getId() + " is missing a belligerent");
            }
            if (war.getAggressorCountryId().equals(war.getDefenderCountryId())) {
                throw new IllegalArgumentException("War " + war.getId() + " has the same country on both sides");
            }
            if (war.getStatus() == null) {
                throw new IllegalArgumentException("War " + war.getId() + " has no status");
            }
            if (war.isActive() && !activePairs.add(war.pairKey())) {
                throw new IllegalArgumentException("More than one active war between " + war.pairKey());
            }
        }
    }

    /**
     * Cancel active pushes that can no longer progress and keep one active push per player.
     */
    private int repairPushes(List<BorderPush> pushes, List<War> wars, Instant now) {
        Map<String, War> warsById = new HashMap<>();
        wars.forEach(w -> warsById.put(w.getId(), w));

        int cancelled = 0;
        Set<String> playersWithActivePush = new HashSet<>();
        List<BorderPush> newestFirst = pushes.stream()
                .sorted(Comparator.comparing(BorderPush::getStartedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        for (BorderPush push : newestFirst) {
            if (push.getStatus() == null) {
                push.setStatus(PushStatus.CANCELLED);
            }
            if (!push.isActive()) {
                continue;
            }
            String problem = activePushProblem(push, warsById.get(push.getWarId()), playersWithActivePush);
            if (problem != null) {
                log.warn("Cancelling restored push {}: {}", push.getId(), problem);
                push.setStatus(PushStatus.CANCELLED);
                push.setEndedAt(now);
                if (push.getStartedAt() != null) {
                    push.setDurationSeconds(Duration.between(push.getStartedAt(), now).toSeconds());
                }
                cancelled++;
                continue;
            }
            if (push.getLastUpdate() == null) {
                push.setLastUpdate(push.getStartedAt() != null ? push.getStartedAt() : now);
            }
            push.setDistancePushed(Math.max(0, push.getDistancePushed()));
            push.setTerritoryGained(PushPhysics.territoryKm2(push.getDistancePushed()));
            PushPhysics.recomputeSpeed(push);
        }
        return cancelled;
    }

    private static String activePushProblem(BorderPush push, War war, Set<String> playersWithActivePush) {
        if (war == null || !war.isActive()) {
            return "war missing or not active";
        }
        if (!war.getAggressorCountryId().equals(push.getSourceCountryId())
                || !war.getDefenderCountryId().equals(push.getTargetCountryId())) {
            return "countries do not match war " + war.getId();
        }
        if (!playersWithActivePush.add(push.getPlayerId())) {
            return "player already has an active push";
        }
        return null;
    }

    private int recountWars(List<Country> countries, List<War> wars) {
        Map<String, Integer> activeWars = new HashMap<>();
        for (War war : wars) {
            if (war.isActive()) {
                activeWars.merge(war.getAggressorCountryId(), 1, Integer::sum);
                activeWars.merge(war.getDefenderCountryId(), 1, Integer::sum);
            }
        }
        int repaired = 0;
        for (Country country : countries) {
            int expected = activeWars.getOrDefault(country.getId(), 0);
            if (country.getActiveWars() != expected || country.isAtWar() != (expected > 0)) {
                log.warn("Repairing war count of country {}: {} -> {}", country.getId(), country.getActiveWars(), expected);
                repaired++;
            }
            country.setActiveWars(expected);
            country.setAtWar(expected > 0);
        }
        return repaired;
    }

    private static <T> List<T> copies(List<T> source, Function<T, T> copier) {
        if (source == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(source.stream().map(copier).toList());
    }

    private static <T> void requireUniqueIds(String kind, List<T> entities, Function<T, String> idOf) {
        Set<String> seen = new HashSet<>();
        for (T entity : entities) {
            String id = idOf.apply(entity);
            if (id == null || !seen.add(id)) {
                throw new IllegalArgumentException("Missing or duplicate " + kind + " id: " + id);
            }
        }
    }
}
