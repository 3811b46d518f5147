package com.acdm.market.acdm_market.events;

/**
 * Marker for everything the engine emits. Events are published only after the
 * call that produced them has committed.
 */
public interface MarketEvent {
}
