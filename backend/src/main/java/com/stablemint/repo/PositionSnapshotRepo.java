package com.stablemint.repo;

import com.stablemint.model.PositionSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface PositionSnapshotRepo extends MongoRepository<PositionSnapshot, String> {

    List<PositionSnapshot> findByActorAndTsBetweenOrderByTsAsc(String actor, Instant from, Instant to);

    PositionSnapshot findTopByActorOrderByTsDesc(String actor);
}
