package com.frontline.dto;

import com.frontline.model.BorderPush;
import com.frontline.model.Country;
import com.frontline.model.Player;
import com.frontline.model.War;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Full copy of the in-memory world, as exported and restored by the admin endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorldSnapshot {

    private Instant takenAt;

    @Builder.Default
    private List<Country> countries = new ArrayList<>();

    @Builder.Default
    private List<Player> players = new ArrayList<>();

    @Builder.Default
    private List<War> wars = new ArrayList<>();

    @Builder.Default
    private List<BorderPush> pushes = new ArrayList<>();
}
