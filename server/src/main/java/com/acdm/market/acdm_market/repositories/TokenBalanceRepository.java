package com.acdm.market.acdm_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.acdm.market.acdm_market.entity.TokenBalance;

@Repository
public interface TokenBalanceRepository extends MongoRepository<TokenBalance, String> {
}
