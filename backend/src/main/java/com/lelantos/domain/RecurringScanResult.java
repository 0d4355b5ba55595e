package com.lelantos.domain;

import java.time.Instant;
import java.util.List;

public record RecurringScanResult(
        List<RecurringWalletRecord> earlyBuyers,
        List<RecurringWalletRecord> topTraders,
        Instant timestamp
) {
}
