package com.frontline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A player (soldier) on the world map. Identity is issued by the authentication layer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Player implements ResourceHolder {

    private String id;

    private String username;

    private String displayName;

    @Builder.Default
    private int resources = 100;

    /** Country the player serves as a soldier, null when stateless. */
    private String countryId;

    private GeoPoint position;

    private Instant lastMovement;

    private Instant lastWarDeclaredAt;

    private Instant lastBorderPushAt;

    @Builder.Default
    private int warsDeclared = 0;

    @Builder.Default
    private boolean online = false;

    private Instant createdAt;

    public boolean belongsTo(String otherCountryId) {
        return countryId != null && countryId.equals(otherCountryId);
    }

    public Player copy() {
        return toBuilder().build();
    }
}
