package com.example.oidc_rp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bearerトークンエラーレスポンス（RFC 6750）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BearerErrorResponse {

    private String error;

    @JsonProperty("error_description")
    private String errorDescription;
}
