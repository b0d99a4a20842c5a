package com.stablemint.repo;

import com.stablemint.model.EngineEventDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface EngineEventRepo extends MongoRepository<EngineEventDocument, String> {

    List<EngineEventDocument> findByFromAddressOrderByTsAsc(String fromAddress);

    List<EngineEventDocument> findByAssetAndTypeOrderByTsAsc(String asset, String type);
}
