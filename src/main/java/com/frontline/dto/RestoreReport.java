package com.frontline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RestoreReport {

    private int countries;
    private int players;
    private int wars;
    private int pushes;
    private int pushesCancelled;
    private int countriesRepaired;
}
