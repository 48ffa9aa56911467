package com.marianbastiurea.parking.api.controller;

import com.marianbastiurea.parking.api.dto.ClearResult;
import com.marianbastiurea.parking.api.dto.SimulationRequestDto;
import com.marianbastiurea.parking.api.dto.UpdateAllocationRequest;
import com.marianbastiurea.parking.api.dto.VehicleRequestDto;
import com.marianbastiurea.parking.domain.enums.Ledger;
import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.errors.InvalidRequestException;
import com.marianbastiurea.parking.domain.model.*;
import com.marianbastiurea.parking.domain.services.AllocationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/parking")
public class ParkingController {

    private static final Logger log = LoggerFactory.getLogger(ParkingController.class);

    private final AllocationService service;

    public ParkingController(AllocationService service) {
        this.service = service;
    }

    @GetMapping("/status")
    public FacilityStatus status() {
        return service.liveStatus();
    }

    @GetMapping("/status/{ledger}")
    public FacilityStatus ledgerStatus(@PathVariable String ledger) {
        return service.ledgerStatus(ledger(ledger));
    }

    /** 201 with the stored record, or 409 with the rejected decision when the facility is full. */
    @PostMapping("/allocate")
    public ResponseEntity<?> allocate(@RequestBody VehicleRequestDto body,
                                      @RequestParam(required = false) String strategy) {
        if (body == null) throw new InvalidRequestException("Request body is required");
        LiveAllocation result = service.allocate(body.toDomain(), strategy(strategy));
        if (!result.allocated()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(result.decision());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(result.record());
    }

    @PostMapping("/allocate/bulk")
    public List<AllocationRecord> allocateBulk(@RequestBody List<VehicleRequestDto> body,
                                               @RequestParam(required = false) String strategy) {
        if (body == null) throw new InvalidRequestException("Request body is required");
        PolicyKind kind = strategy(strategy);
        long t0 = System.nanoTime();
        List<VehicleRequest> requests = new ArrayList<>(body.size());
        for (VehicleRequestDto dto : body) {
            requests.add(toDomainOrNull(dto));
        }
        List<AllocationRecord> out = service.allocateBulk(requests, kind);
        log.info("allocation.bulk.response size={} tookMs={}", out.size(), (System.nanoTime() - t0) / 1_000_000);
        return out;
    }

    @GetMapping("/allocation/{id}")
    public AllocationRecord get(@PathVariable long id) {
        return service.get(id);
    }

    @PutMapping("/allocation/{id}")
    public AllocationRecord update(@PathVariable long id, @RequestBody UpdateAllocationRequest body) {
        if (body == null) throw new InvalidRequestException("Request body is required");
        return service.update(id, body.toPatch());
    }

    @DeleteMapping("/allocation/{id}")
    public AllocationRecord end(@PathVariable long id) {
        return service.end(id);
    }

    @GetMapping("/allocations")
    public List<AllocationRecord> list(@RequestParam(defaultValue = "false") boolean activeOnly,
                                       @RequestParam(required = false) String vehicleId) {
        String vid = vehicleId == null || vehicleId.isBlank() ? null : vehicleId.trim();
        return service.list(new AllocationFilter(Ledger.MAIN, activeOnly, vid));
    }

    @GetMapping("/metrics/{ledger}")
    public List<AllocationRecord> metrics(@PathVariable String ledger) {
        return service.list(AllocationFilter.all(ledger(ledger)));
    }

    @GetMapping("/log/{ledger}")
    public List<AllocationLogEntry> processingLog(@PathVariable String ledger,
                                                  @RequestParam(defaultValue = "50") int limit) {
        return service.processingLog(ledger(ledger), limit);
    }

    @PostMapping("/simulate")
    public SimulationResult simulate(@RequestBody SimulationRequestDto body) {
        List<VehicleRequest> requests = vehicles(body);
        return service.simulate(requests, strategy(body.strategy()), body.initialFillRatio());
    }

    @PostMapping("/compare")
    public ComparisonResult compare(@RequestBody SimulationRequestDto body) {
        List<VehicleRequest> requests = vehicles(body);
        return service.compare(requests, body.initialFillRatio());
    }

    @GetMapping("/simulations/{strategy}")
    public List<SimulationRecord> simulations(@PathVariable String strategy,
                                              @RequestParam(defaultValue = "20") int limit) {
        return service.simulationHistory(strategy(strategy), limit);
    }

    /** {@code all} clears every simulation ledger; MAIN must be named explicitly. */
    @DeleteMapping("/clear/{target}")
    public ClearResult clear(@PathVariable String target) {
        if ("all".equalsIgnoreCase(target.trim())) {
            return new ClearResult("all", service.clearSimulations());
        }
        Ledger ledger = ledger(target);
        return new ClearResult(ledger.name(), service.clear(ledger));
    }

    private PolicyKind strategy(String name) {
        if (name == null || name.isBlank()) {
            return service.defaultPolicy();
        }
        try {
            return PolicyKind.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }

    private static Ledger ledger(String name) {
        try {
            return Ledger.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }

    /** Simulations keep malformed entries as null so the runner reports them as failed outcomes. */
    private static List<VehicleRequest> vehicles(SimulationRequestDto body) {
        if (body == null || body.vehicles() == null) {
            throw new InvalidRequestException("vehicles is required");
        }
        List<VehicleRequest> requests = new ArrayList<>(body.vehicles().size());
        for (VehicleRequestDto dto : body.vehicles()) {
            requests.add(toDomainOrNull(dto));
        }
        return requests;
    }

    private static VehicleRequest toDomainOrNull(VehicleRequestDto dto) {
        if (dto == null) return null;
        try {
            return dto.toDomain();
        } catch (InvalidRequestException e) {
            log.warn("vehicle.request.invalid vehicle={} error={}", dto.vehicleId(), e.getMessage());
            return null;
        }
    }
}
