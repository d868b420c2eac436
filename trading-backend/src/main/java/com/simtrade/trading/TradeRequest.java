package com.simtrade.trading;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

/**
 * Validated request model for a trade, checked before any price is fetched.
 */
public record TradeRequest(
    @NotBlank(message = "Symbol is required")
    @Pattern(regexp = "^[A-Z0-9][A-Z0-9.\\-]{0,9}$", message = "Symbol must be 1-10 letters or digits")
    String symbol,

    @Positive(message = "Quantity must be positive")
    double quantity,

    @NotNull(message = "Type is required")
    TransactionType type
) {
}
