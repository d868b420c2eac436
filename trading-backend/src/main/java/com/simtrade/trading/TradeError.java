package com.simtrade.trading;

import java.time.Instant;

public record TradeError(TradeErrorCode code, String message, Instant timestamp) {
}
