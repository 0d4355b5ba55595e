package com.lelantos.analysis;

import com.lelantos.domain.HolderRecord;
import com.lelantos.domain.TokenRecord;
import com.lelantos.domain.WalletOverlapRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wallet -> tokens index built from holder lists, in token insertion order. A token is recorded at most once per
 * wallet (first holder entry wins for the percentage). Not thread-safe.
 */
public class OverlapIndex {

    static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Map<String, Holdings> byWallet = new LinkedHashMap<>();

    public void add(TokenRecord token, List<HolderRecord> holders) {
        for (HolderRecord holder : holders) {
            String wallet = holder.walletAddress() != null ? holder.walletAddress().strip() : "";
            if (wallet.isEmpty()) {
                continue;
            }
            Holdings holdings = byWallet.computeIfAbsent(wallet, w -> new Holdings());
            if (holdings.tokens.add(token.address())) {
                holdings.percentages.put(token.address(), holdingPercentage(holder, token));
            }
        }
    }

    /**
     * Wallets held in two or more tokens, most tokens first.
     */
    public List<WalletOverlapRecord> overlaps() {
        List<WalletOverlapRecord> result = new ArrayList<>();
        byWallet.forEach((wallet, holdings) -> {
            if (holdings.tokens.size() >= 2) {
                result.add(new WalletOverlapRecord(wallet, new ArrayList<>(holdings.tokens), holdings.percentages));
            }
        });
        result.sort(Comparator.comparingInt(WalletOverlapRecord::getOverlapCount).reversed());
        return result;
    }

    public int walletCount() {
        return byWallet.size();
    }

    /**
     * Upstream percentage when given; otherwise {@code (amount / 10^decimals) / totalSupply * 100}, or zero without a
     * supply.
     */
    static BigDecimal holdingPercentage(HolderRecord holder, TokenRecord token) {
        if (holder.percentage() != null) {
            return holder.percentage();
        }
        BigDecimal supply = token.totalSupply();
        if (supply == null || supply.signum() <= 0 || holder.amount() == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal balance = holder.amount().movePointLeft(Math.max(0, token.decimals()));
        return balance.divide(supply, SCALE, ROUNDING).multiply(HUNDRED);
    }

    private static final class Holdings {
        private final Set<String> tokens = new LinkedHashSet<>();
        private final Map<String, BigDecimal> percentages = new LinkedHashMap<>();
    }
}
