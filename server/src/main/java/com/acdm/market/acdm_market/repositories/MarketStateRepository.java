package com.acdm.market.acdm_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.acdm.market.acdm_market.entity.MarketState;

@Repository
public interface MarketStateRepository extends MongoRepository<MarketState, String> {
}
