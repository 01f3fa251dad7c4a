package com.ridedispatch.dispatch.service;

import com.ridedispatch.dispatch.config.DispatchProperties;
import com.ridedispatch.dispatch.entity.DispatchOrder;
import com.ridedispatch.dispatch.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Polls for PENDING orders whose accept window has expired and rebroadcasts them.
 *
 * Runs on every instance. An expired window is claimed with a conditional update on
 * the lease value that was read, so exactly one instance rebroadcasts it; the claim
 * also pushes the lease forward, so a crash after claiming only delays the order by
 * one window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OfferTimeoutScheduler {

    private final OrderRepository orderRepository;
    private final DispatchOrchestrator orchestrator;
    private final DispatchProperties properties;

    @Scheduled(fixedDelayString = "${dispatch.search.sweep-interval-ms:5000}")
    public void sweep() {
        try {
            int handled = sweepExpiredSearches(Instant.now());
            if (handled > 0) {
                log.info("Timeout sweep rebroadcast {} orders", handled);
            }
        } catch (DataAccessException e) {
            log.warn("Timeout sweep failed, retrying next cycle: {}", e.getMessage());
        }
    }

    /**
     * @return number of expired windows this instance claimed
     */
    public int sweepExpiredSearches(Instant now) {
        DispatchProperties.Search search = properties.getSearch();
        List<DispatchOrder> expired = orderRepository.findExpiredSearches(now, PageRequest.of(0, search.getSweepBatchSize()));

        int claimed = 0;
        for (DispatchOrder order : expired) {
            Instant next = now.plus(search.getOfferTimeout()).truncatedTo(ChronoUnit.MILLIS);
            if (orderRepository.claimExpiredSearch(order.getId(), order.getSearchExpiresAt(), next) == 0) {
                log.debug("Expired window of order {} already claimed elsewhere", order.getId());
                continue;
            }
            claimed++;
            try {
                orchestrator.handleSearchTimeout(order.getId());
            } catch (RuntimeException e) {
                log.warn("Rebroadcast of order {} after timeout failed: {}", order.getId(), e.getMessage());
            }
        }
        return claimed;
    }
}
