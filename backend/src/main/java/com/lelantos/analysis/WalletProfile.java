package com.lelantos.analysis;

import com.lelantos.domain.PnlReport;
import com.lelantos.domain.ProfileSection;
import com.lelantos.domain.WalletTrade;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Raw deep-analysis inputs for one wallet. {@code pnl} is null when the PnL endpoint failed or had nothing usable.
 */
public record WalletProfile(
        String address,
        BigDecimal portfolioValue,
        List<WalletTrade> trades,
        PnlReport pnl,
        Set<ProfileSection> unavailable
) {
}
