package com.acdm.market.acdm_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.acdm.market.acdm_market.entity.Order;

import java.util.List;

/**
 * Persisted copy of the order table. The engine's in-memory table is authoritative
 * while the process runs; this collection is what it is rebuilt from.
 */
@Repository
public interface OrderRepository extends MongoRepository<Order, Long> {

    List<Order> findByOwnerOrderByIdAsc(String owner);
}
