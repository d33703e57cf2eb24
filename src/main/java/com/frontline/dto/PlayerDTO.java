package com.frontline.dto;

import com.frontline.model.GeoPoint;
import com.frontline.model.Player;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for player representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerDTO {

    private String id;
    private String username;
    private String displayName;
    private int resources;
    private String countryId;
    private GeoPoint position;
    private int warsDeclared;
    private boolean online;

    public static PlayerDTO fromPlayer(Player player) {
        return PlayerDTO.builder()
                .id(player.getId())
                .username(player.getUsername())
                .displayName(player.getDisplayName())
                .resources(player.getResources())
                .countryId(player.getCountryId())
                .position(player.getPosition())
                .warsDeclared(player.getWarsDeclared())
                .online(player.isOnline())
                .build();
    }
}
