package com.frontline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of joining or leaving a country.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MembershipResult {

    private CountryDTO country;
    private boolean becameOwner;
    private boolean wasOwner;
    private boolean countryUnclaimed;
}
