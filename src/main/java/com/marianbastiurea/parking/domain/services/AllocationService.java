package com.marianbastiurea.parking.domain.services;

import com.marianbastiurea.parking.domain.enums.ExpiryPolicy;
import com.marianbastiurea.parking.domain.enums.Ledger;
import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.errors.AllocationNotFoundException;
import com.marianbastiurea.parking.domain.errors.ConflictException;
import com.marianbastiurea.parking.domain.errors.InvalidRequestException;
import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.*;
import com.marianbastiurea.parking.domain.policy.AllocationPolicy;
import com.marianbastiurea.parking.domain.policy.PolicyFactory;
import com.marianbastiurea.parking.domain.repo.AllocationLogRepo;
import com.marianbastiurea.parking.domain.repo.AllocationStore;
import com.marianbastiurea.parking.domain.repository.SimulationRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.util.Objects.requireNonNull;

/**
 * Entry point for live allocations, ledger queries and simulations.
 * <p>
 * The live grid mirrors the active MAIN records. Every read-decide-occupy
 * sequence on it runs under the write lock; status snapshots take the read lock.
 * Writes that belong together (a record and its log row, or a whole simulation
 * ledger) commit in one transaction.
 */
@Service
public class AllocationService {

    private static final Logger log = LoggerFactory.getLogger(AllocationService.class);

    private final AllocationStore store;
    private final AllocationLogRepo processingLog;
    private final SimulationRecordRepository archive;
    private final TransactionOperations tx;
    private final PolicyFactory policies;
    private final SimulationRunner runner;
    private final Facility facility;
    private final Clock clock;
    private final double liveFillRatio;
    private final double simulationFillRatio;
    private final PolicyKind defaultPolicy;

    private final OccupancyGrid liveGrid;
    private final Map<PolicyKind, AllocationPolicy> livePolicies = new EnumMap<>(PolicyKind.class);
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public AllocationService(AllocationStore store,
                             AllocationLogRepo processingLog,
                             SimulationRecordRepository archive,
                             TransactionOperations tx,
                             PolicyFactory policies,
                             SimulationRunner runner,
                             Facility facility,
                             Clock clock,
                             @Value("${parking.grid.fill-seed:7}") long fillSeed,
                             @Value("${parking.live.initial-fill-ratio:0.0}") double liveFillRatio,
                             @Value("${parking.simulation.initial-fill-ratio:0.0}") double simulationFillRatio,
                             @Value("${parking.policy.default:learned}") String defaultPolicy) {
        this.store = requireNonNull(store, "store");
        this.processingLog = requireNonNull(processingLog, "processingLog");
        this.archive = requireNonNull(archive, "archive");
        this.tx = requireNonNull(tx, "tx");
        this.policies = requireNonNull(policies, "policies");
        this.runner = requireNonNull(runner, "runner");
        this.facility = requireNonNull(facility, "facility");
        this.clock = requireNonNull(clock, "clock");
        this.liveFillRatio = requireRatio(liveFillRatio, "parking.live.initial-fill-ratio");
        this.simulationFillRatio = requireRatio(simulationFillRatio, "parking.simulation.initial-fill-ratio");
        this.defaultPolicy = PolicyKind.fromName(defaultPolicy);
        this.liveGrid = new OccupancyGrid(facility, fillSeed, clock);
        for (PolicyKind kind : PolicyKind.values()) {
            livePolicies.put(kind, policies.create(kind));
        }
    }

    public PolicyKind defaultPolicy() {
        return defaultPolicy;
    }

    public Facility facility() {
        return facility;
    }

    /**
     * Clears the live grid, replays the active, unexpired MAIN records onto it,
     * then pre-fills only the cells they left free.
     */
    public int rebuildLiveGrid() {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            liveGrid.clear();
            int replayed = 0;
            for (AllocationRecord r : store.list(AllocationFilter.active(Ledger.MAIN))) {
                if (!r.departureTime().isAfter(now)) continue;
                try {
                    liveGrid.occupy(r.cell(), r.toReservation());
                    replayed++;
                } catch (ConflictException e) {
                    log.warn("live.rebuild.conflict id={} vehicle={} cell={} heldBy={}",
                            r.id(), r.vehicleId(), r.cell(), e.getMessage());
                }
            }
            int prefilled = liveGrid.prefill(liveFillRatio);
            log.info("live.rebuild.done replayed={} prefilled={} occupied={}/{}",
                    replayed, prefilled, liveGrid.occupiedCount(), facility.capacity());
            return replayed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------- live allocations ----------

    public LiveAllocation allocate(VehicleRequest request, PolicyKind kind) {
        requireNonNull(request, "request is required");
        PolicyKind strategy = kind == null ? defaultPolicy : kind;

        MDC.put("vehicleId", request.vehicleId());
        log.info("allocation.request strategy={} arrival={} departure={}",
                strategy, request.arrivalTime(), request.departureTime());
        long t0 = System.nanoTime();
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            liveGrid.releaseExpired(now);

            AllocationDecision decision;
            try {
                decision = livePolicies.get(strategy).decide(request, liveGrid);
            } catch (RuntimeException ex) {
                appendLog(Ledger.MAIN, AllocationOutcome.failed(0, request.vehicleId(), messageOf(ex)), now);
                throw ex;
            }

            if (!decision.isAllocated()) {
                appendLog(Ledger.MAIN, AllocationOutcome.rejected(0, request.vehicleId(), decision), now);
                log.info("allocation.rejected reason={}", decision.reason());
                return new LiveAllocation(decision, null);
            }

            Cell cell = decision.cell();
            liveGrid.occupy(cell, request.toReservation());
            AllocationRecord pending = AllocationRecord.of(Ledger.MAIN, request, decision);
            AllocationRecord record;
            try {
                record = tx.execute(status -> {
                    AllocationRecord stored = pending.withId(store.create(pending));
                    appendLog(Ledger.MAIN, AllocationOutcome.allocated(0, request.vehicleId(), decision), now);
                    return stored;
                });
            } catch (RuntimeException ex) {
                liveGrid.release(cell);
                log.error("allocation.persist.failure cell={}", cell, ex);
                throw ex;
            }

            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("allocation.ok id={} bay={} slot={} score={} tookMs={}",
                    record.id(), decision.bayAssigned(), decision.slotAssigned(), decision.score(), tookMs);
            return new LiveAllocation(decision, record);
        } finally {
            lock.writeLock().unlock();
            MDC.remove("vehicleId");
        }
    }

    /**
     * Allocates each request in order. The result has one entry per request:
     * the stored record, or null when the request was rejected or failed.
     */
    public List<AllocationRecord> allocateBulk(List<VehicleRequest> requests, PolicyKind kind) {
        requireNonNull(requests, "requests is required");
        log.info("allocation.bulk.start size={} strategy={}", requests.size(), kind == null ? defaultPolicy : kind);
        List<AllocationRecord> out = new ArrayList<>(requests.size());
        int ok = 0;
        for (VehicleRequest request : requests) {
            AllocationRecord record = null;
            try {
                LiveAllocation result = allocate(request, kind);
                record = result.record();
            } catch (RuntimeException ex) {
                log.warn("allocation.bulk.item_failed vehicle={} error={}",
                        request == null ? null : request.vehicleId(), messageOf(ex));
            }
            if (record != null) ok++;
            out.add(record);
        }
        log.info("allocation.bulk.done size={} allocated={}", requests.size(), ok);
        return out;
    }

    public AllocationRecord get(long id) {
        return store.get(id).orElseThrow(() -> new AllocationNotFoundException(id));
    }

    public List<AllocationRecord> list(AllocationFilter filter) {
        requireNonNull(filter, "filter is required");
        return store.list(filter);
    }

    /**
     * Applies a partial update. For MAIN records the live grid follows the
     * change: a new departure re-books the cell and deactivation frees it.
     */
    public AllocationRecord update(long id, AllocationPatch patch) {
        requireNonNull(patch, "patch is required");
        if (patch.isEmpty()) {
            throw new InvalidRequestException("Nothing to update for allocation " + id);
        }
        lock.writeLock().lock();
        try {
            AllocationRecord before = get(id);
            if (patch.departureTime() != null && !patch.departureTime().isAfter(before.arrivalTime())) {
                throw new InvalidRequestException("Departure " + patch.departureTime()
                        + " must be after arrival " + before.arrivalTime());
            }
            AllocationRecord after = store.update(id, patch);
            if (before.ledger() == Ledger.MAIN) {
                rebookLive(before, after, clock.instant());
            }
            log.info("allocation.update.ok id={} active={} departure={}", id, after.active(), after.departureTime());
            return after;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Marks the allocation inactive and frees its live cell. */
    public AllocationRecord end(long id) {
        log.info("allocation.end.request id={}", id);
        return update(id, AllocationPatch.deactivate());
    }

    private void rebookLive(AllocationRecord before, AllocationRecord after, Instant now) {
        Cell cell = before.cell();
        boolean heldByThis = liveGrid.reservationAt(cell)
                .map(r -> r.vehicleId().equals(before.vehicleId()))
                .orElse(false);
        if (heldByThis) {
            liveGrid.release(cell);
        }
        if (after.active() && after.departureTime().isAfter(now) && liveGrid.isFree(cell)) {
            liveGrid.occupy(cell, after.toReservation());
        }
        if (log.isDebugEnabled()) {
            log.debug("live.rebook id={} cell={} released={} occupiedNow={}",
                    after.id(), cell, heldByThis, !liveGrid.isFree(cell));
        }
    }

    // ---------- status ----------

    public FacilityStatus liveStatus() {
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            return FacilityStatusRenderer.render(facility, liveGrid.snapshot(), now, ExpiryPolicy.FILTER_ON_READ);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Status built from a ledger's active, unexpired records on a throwaway grid. */
    public FacilityStatus ledgerStatus(Ledger ledger) {
        requireNonNull(ledger, "ledger is required");
        if (ledger == Ledger.MAIN) {
            return liveStatus();
        }
        Instant now = clock.instant();
        OccupancyGrid grid = new OccupancyGrid(facility, 0L, clock);
        for (AllocationRecord r : store.list(AllocationFilter.active(ledger))) {
            if (!r.departureTime().isAfter(now) || !grid.isFree(r.cell())) continue;
            grid.occupy(r.cell(), r.toReservation());
        }
        return FacilityStatusRenderer.render(facility, grid.snapshot(), now, ExpiryPolicy.FILTER_ON_READ);
    }

    // ---------- simulations ----------

    /**
     * Runs one strategy on a private grid, replaces the strategy's ledger with
     * the successful outcomes and archives the run summary. The ledger
     * replacement and its log rows commit together; on failure the previous
     * ledger is kept and nothing is archived.
     */
    public SimulationResult simulate(List<VehicleRequest> requests, PolicyKind kind, Double initialFillRatio) {
        requireNonNull(requests, "requests is required");
        PolicyKind strategy = kind == null ? defaultPolicy : kind;
        double ratio = initialFillRatio == null
                ? simulationFillRatio
                : requireRatio(initialFillRatio, "initialFillRatio");
        Ledger ledger = Ledger.forPolicy(strategy);

        log.info("simulation.request strategy={} vehicles={} fillRatio={}", strategy, requests.size(), ratio);
        SimulationReport report = runner.run(requests, policies.create(strategy), facility, ratio);
        Instant now = clock.instant();

        try {
            tx.executeWithoutResult(status -> {
                int removed = store.clear(ledger);
                for (AllocationOutcome outcome : report.outcomes()) {
                    if (outcome.success()) {
                        VehicleRequest request = requests.get(outcome.index());
                        store.create(AllocationRecord.of(ledger, request, outcome.decision()));
                    }
                    appendLog(ledger, outcome, now);
                }
                log.debug("simulation.ledger.replaced ledger={} removed={} written={}",
                        ledger, removed, report.successful());
            });
        } catch (RuntimeException ex) {
            log.error("simulation.persist.failure strategy={} ledger={}", strategy, ledger, ex);
            throw ex;
        }

        String key = archive.save(SimulationRecord.of(report, now));
        log.info("simulation.done strategy={} success={} failed={} archiveKey={}",
                strategy, report.successful(), report.failed(), key);

        FacilityStatus finalStatus = FacilityStatusRenderer.render(
                facility, report.finalOccupancy(), now, ExpiryPolicy.TRUST_GRID);
        return new SimulationResult(report, finalStatus);
    }

    /** Simulates every strategy on the same input. A failing strategy does not stop the others. */
    public ComparisonResult compare(List<VehicleRequest> requests, Double initialFillRatio) {
        requireNonNull(requests, "requests is required");
        Map<PolicyKind, SimulationResult> results = new EnumMap<>(PolicyKind.class);
        Map<PolicyKind, String> errors = new EnumMap<>(PolicyKind.class);
        for (PolicyKind kind : PolicyKind.values()) {
            try {
                results.put(kind, simulate(requests, kind, initialFillRatio));
            } catch (InvalidRequestException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                log.error("simulation.compare.failure strategy={}", kind, ex);
                errors.put(kind, messageOf(ex));
            }
        }
        log.info("simulation.compare.done ok={} failed={}", results.keySet(), errors.keySet());
        return new ComparisonResult(results, errors);
    }

    public List<SimulationRecord> simulationHistory(PolicyKind kind, int limit) {
        requireNonNull(kind, "kind is required");
        return archive.recent(kind, limit);
    }

    // ---------- maintenance ----------

    /** Deletes a ledger's records. Clearing MAIN also resets the live grid. */
    public int clear(Ledger ledger) {
        requireNonNull(ledger, "ledger is required");
        int removed = store.clear(ledger);
        if (ledger == Ledger.MAIN) {
            rebuildLiveGrid();
        }
        log.info("ledger.clear ledger={} removed={}", ledger, removed);
        return removed;
    }

    public int clearSimulations() {
        int removed = 0;
        for (PolicyKind kind : PolicyKind.values()) {
            removed += clear(Ledger.forPolicy(kind));
        }
        return removed;
    }

    public List<AllocationLogEntry> processingLog(Ledger ledger, int limit) {
        requireNonNull(ledger, "ledger is required");
        return processingLog.findRecent(ledger, limit);
    }

    private void appendLog(Ledger ledger, AllocationOutcome outcome, Instant at) {
        try {
            processingLog.insert(AllocationLogEntry.of(ledger, outcome, at));
        } catch (RuntimeException ex) {
            log.error("processing_log.insert.failure ledger={} vehicle={}", ledger, outcome.vehicleId(), ex);
            throw ex;
        }
    }

    private static double requireRatio(double ratio, String name) {
        if (Double.isNaN(ratio) || ratio < 0.0 || ratio > 1.0) {
            throw new InvalidRequestException(name + " must be in [0,1], got " + ratio);
        }
        return ratio;
    }

    private static String messageOf(RuntimeException ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
