package com.lelantos.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A wallet holding two or more of the analyzed tokens. Score, tags, portfolio and summary stay null for wallets
 * outside the deep-analysis bound.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WalletOverlapRecord {

    @EqualsAndHashCode.Include
    private String address;
    private List<String> tokens = new ArrayList<>();
    /** token address -> holding percentage of supply */
    private Map<String, BigDecimal> percentages = new LinkedHashMap<>();

    private Integer score;
    private Set<WalletTag> tags;
    private BigDecimal portfolioValue;
    /** Longest holding duration across overlapping tokens, in hours. */
    private Double maxHoldingHours;
    private boolean topTrader;
    private List<TopTraderMatch> topTraderMatches = new ArrayList<>();
    private WalletSummary walletSummary;
    private Set<ProfileSection> unavailableData = EnumSet.noneOf(ProfileSection.class);

    public WalletOverlapRecord(String address, List<String> tokens, Map<String, BigDecimal> percentages) {
        this.address = address;
        this.tokens = new ArrayList<>(tokens);
        this.percentages = new LinkedHashMap<>(percentages);
    }

    public int getOverlapCount() {
        return tokens.size();
    }

    public boolean isProfiled() {
        return score != null;
    }

    public void setTags(Set<WalletTag> tags) {
        this.tags = tags != null ? new LinkedHashSet<>(tags) : null;
    }
}
