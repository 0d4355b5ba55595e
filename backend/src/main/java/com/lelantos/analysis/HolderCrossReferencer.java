package com.lelantos.analysis;

import com.lelantos.analysis.config.AnalysisProperties;
import com.lelantos.common.TimeSource;
import com.lelantos.domain.HolderRecord;
import com.lelantos.tracker.TrackerException;
import com.lelantos.tracker.TrackerGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fetches holder lists for the overlap pass. An empty first answer is re-fetched exactly once after a short pause
 * (upstream occasionally returns zero holders for a populated token); any failure degrades to an empty list.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HolderCrossReferencer {

    private final AnalysisProperties properties;
    private final TimeSource timeSource;

    public List<HolderRecord> fetchHolders(TrackerGateway gateway, String tokenAddress) {
        try {
            List<HolderRecord> holders = gateway.getTokenHolders(tokenAddress);
            if (!holders.isEmpty()) {
                return holders;
            }
            log.warn("Received 0 holders for {}. Retrying once after {}ms", tokenAddress,
                    properties.getEmptyHolderRetryDelayMs());
            timeSource.sleep(properties.getEmptyHolderRetryDelayMs());
            return gateway.getTokenHolders(tokenAddress);
        } catch (TrackerException e) {
            log.warn("Error fetching holders for {}: {}", tokenAddress, e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackerException("Interrupted before re-fetching holders for " + tokenAddress, e);
        }
    }
}
