package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.ReferralEdge;
import com.acdm.market.acdm_market.events.UserRegistered;
import com.acdm.market.acdm_market.exception.ValidationException;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Sponsor edges. Every participant may name one sponsor, once, and only a
 * sponsor that is registered itself. The root is registered from the start as
 * its own sponsor, so every chain ends there.
 */
@Slf4j
public class ReferralRegistry {

    public ReferralEdge register(MarketTransaction tx, String sponsor) {
        String referee = tx.caller();
        if (sponsor == null || sponsor.isBlank() || sponsor.equals(referee)) {
            throw new ValidationException("Not valid referrer address");
        }
        if (tx.sponsorOf(sponsor).isEmpty()) {
            throw new ValidationException("Referrer should be registered");
        }
        if (tx.sponsorOf(referee).isPresent()) {
            throw new ValidationException("Reference already exists");
        }

        ReferralEdge edge = ReferralEdge.builder()
                .referee(referee)
                .sponsor(sponsor)
                .registeredAt(tx.now())
                .build();
        tx.addEdge(edge);
        tx.emit(new UserRegistered(referee, sponsor));

        log.info("User registered: referee={}, sponsor={}", referee, sponsor);
        return edge;
    }

    /**
     * The two sponsors above {@code principal}, or an empty chain for an unregistered principal.
     */
    public ReferralChain chainOf(ReferralGraph graph, String principal) {
        Optional<String> l1 = graph.sponsorOf(principal);
        if (l1.isEmpty()) {
            return ReferralChain.none();
        }
        String l2 = graph.sponsorOf(l1.get())
                .orElseThrow(() -> new IllegalStateException("Sponsor without upstream edge: " + l1.get()));
        return ReferralChain.of(l1.get(), l2);
    }
}
