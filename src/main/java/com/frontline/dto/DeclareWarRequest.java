package com.frontline.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for declaring war. The aggressor defaults to the declarer's own country.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeclareWarRequest {

    private String aggressorCountryId;

    @NotBlank(message = "Target country is required")
    private String targetCountryId;

    @Size(max = 500, message = "Reason must be at most 500 characters")
    private String reason;
}
