package com.acdm.market.acdm_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.acdm.market.acdm_market.entity.ReferralEdge;

import java.util.List;

@Repository
public interface ReferralEdgeRepository extends MongoRepository<ReferralEdge, String> {

    List<ReferralEdge> findBySponsor(String sponsor);
}
