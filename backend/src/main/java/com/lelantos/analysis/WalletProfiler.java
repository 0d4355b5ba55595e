package com.lelantos.analysis;

import com.lelantos.domain.PnlReport;
import com.lelantos.domain.ProfileSection;
import com.lelantos.domain.WalletTrade;
import com.lelantos.tracker.TrackerException;
import com.lelantos.tracker.TrackerGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Fetches portfolio value, trades and PnL for a wallet, one after the other. Each lookup fails independently to its
 * default (zero, empty list, no PnL) and is reported in {@link WalletProfile#unavailable()}.
 */
@Component
@Slf4j
public class WalletProfiler {

    public WalletProfile profile(TrackerGateway gateway, String wallet) {
        Set<ProfileSection> unavailable = EnumSet.noneOf(ProfileSection.class);

        BigDecimal portfolioValue = BigDecimal.ZERO;
        try {
            portfolioValue = gateway.getWalletPortfolioValue(wallet);
        } catch (TrackerException e) {
            log.warn("Failed basic info for {}: {}", wallet, e.getMessage());
            unavailable.add(ProfileSection.PORTFOLIO);
        }

        List<WalletTrade> trades = List.of();
        try {
            trades = gateway.getWalletTrades(wallet);
        } catch (TrackerException e) {
            log.warn("Failed trades for {}: {}", wallet, e.getMessage());
            unavailable.add(ProfileSection.TRADES);
        }

        PnlReport pnl = null;
        try {
            pnl = gateway.getWalletPnl(wallet).orElse(null);
        } catch (TrackerException e) {
            log.warn("Failed PnL for {}: {}", wallet, e.getMessage());
            unavailable.add(ProfileSection.PNL);
        }

        return new WalletProfile(wallet, portfolioValue, trades, pnl, unavailable);
    }
}
