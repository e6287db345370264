package com.stride.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogoutRequest {

    /** Optional; revoked along with the access token when present. */
    @Schema(accessMode = Schema.AccessMode.WRITE_ONLY)
    private String refreshToken;
}
