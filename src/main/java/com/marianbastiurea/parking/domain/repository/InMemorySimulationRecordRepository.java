package com.marianbastiurea.parking.domain.repository;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.model.SimulationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/** Archive used when DynamoDB is disabled. Keeps the latest runs of each strategy. */
@Repository
@ConditionalOnProperty(name = "app.dynamo.enabled", havingValue = "false", matchIfMissing = true)
public class InMemorySimulationRecordRepository implements SimulationRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemorySimulationRecordRepository.class);

    static final int MAX_PER_STRATEGY = 100;

    private final Map<PolicyKind, Deque<SimulationRecord>> runs = new EnumMap<>(PolicyKind.class);

    @Override
    public synchronized String save(SimulationRecord record) {
        Deque<SimulationRecord> q = runs.computeIfAbsent(record.strategy(), k -> new ArrayDeque<>());
        q.addFirst(record);
        while (q.size() > MAX_PER_STRATEGY) {
            q.removeLast();
        }
        String key = "RUN#" + record.executedAt();
        log.debug("simulation.archive | strategy={} key={}", record.strategy(), key);
        return key;
    }

    @Override
    public synchronized List<SimulationRecord> recent(PolicyKind strategy, int limit) {
        Deque<SimulationRecord> q = runs.get(strategy);
        if (q == null || limit <= 0) {
            return List.of();
        }
        List<SimulationRecord> out = new ArrayList<>(Math.min(limit, q.size()));
        Iterator<SimulationRecord> it = q.iterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }
}
