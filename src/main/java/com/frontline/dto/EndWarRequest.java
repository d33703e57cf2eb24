package com.frontline.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EndWarRequest {

    /** Optional; a war may end without a winner. */
    private String winnerCountryId;
}
