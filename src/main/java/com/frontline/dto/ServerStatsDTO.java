package com.frontline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ServerStatsDTO {

    private int connectedObservers;
    private int activeRooms;
    private int activeWars;
    private int activePushes;
}
