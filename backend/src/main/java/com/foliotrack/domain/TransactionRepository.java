package com.foliotrack.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Read path for the engine snapshot. Results come back in insertion order so same-day ties stay stable.
 */
public interface TransactionRepository extends MongoRepository<Transaction, String> {

    List<Transaction> findByPortfolioIdInOrderByCreatedAtAsc(List<String> portfolioIds);
}
