package com.foliotrack.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface ValuationRepository extends MongoRepository<Valuation, String> {

    List<Valuation> findByAssetIdInOrderByCreatedAtAsc(Collection<String> assetIds);
}
