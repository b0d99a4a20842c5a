package com.stablemint.api;

import com.stablemint.exception.EngineException;
import com.stablemint.exception.ErrorCode;
import com.stablemint.model.PositionSnapshot;
import com.stablemint.repo.PositionSnapshotRepo;
import com.stablemint.service.PositionMonitorService;
import com.stablemint.util.AddressUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only endpoints to query position snapshots (time series).
 */
@RestController
@RequestMapping("/api/v1/position-snapshots")
@RequiredArgsConstructor
public class PositionSnapshotController {

    private final PositionSnapshotRepo repo;
    private final PositionMonitorService monitorService;

    @GetMapping("/latest")
    public PositionSnapshot latest(@RequestParam String actor) {
        String a = AddressUtil.normalize(actor);
        PositionSnapshot latest = repo.findTopByActorOrderByTsDesc(a);
        if (latest == null) {
            throw new EngineException(ErrorCode.NOT_FOUND, "No position snapshot for " + a, Map.of("actor", a));
        }
        return latest;
    }

    /** Time range for an actor (inclusive). ISO-8601 instants. */
    @GetMapping
    public List<PositionSnapshot> range(
            @RequestParam String actor,
            @RequestParam Instant from,
            @RequestParam Instant to
    ) {
        return repo.findByActorAndTsBetweenOrderByTsAsc(AddressUtil.normalize(actor), from, to);
    }

    @PostMapping("/poll")
    public List<PositionSnapshot> poll() {
        return monitorService.pollPositions();
    }
}
