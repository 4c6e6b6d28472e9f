package com.foliotrack.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface AssetRepository extends MongoRepository<Asset, String> {

    List<Asset> findByIdIn(Collection<String> ids);
}
