package com.lelantos.api.dto;

import com.lelantos.api.validation.SolanaAddress;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body for POST /api/v1/analysis and POST /api/v1/recurring-wallets.
 */
public record TokenListRequest(
        @NotEmpty(message = "INVALID_REQUEST")
        @Size(max = 100, message = "INVALID_REQUEST")
        List<@SolanaAddress String> tokens
) {
}
