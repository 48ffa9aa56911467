package com.marianbastiurea.parking.persistence.sql;

import com.marianbastiurea.parking.domain.enums.Ledger;
import com.marianbastiurea.parking.domain.enums.PlateType;
import com.marianbastiurea.parking.domain.enums.VehicleClass;
import com.marianbastiurea.parking.domain.model.AllocationRecord;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "allocations")
public class AllocationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "ledger", nullable = false, length = 16)
    private Ledger ledger;

    @Column(name = "vehicle_id", nullable = false, length = 64)
    private String vehicleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "plate_type", nullable = false, length = 16)
    private PlateType plateType;

    @Enumerated(EnumType.STRING)
    @Column(name = "vehicle_class", nullable = false, length = 16)
    private VehicleClass vehicleClass;

    @Column(name = "bay_assigned", nullable = false)
    private int bayAssigned;

    @Column(name = "slot_assigned", nullable = false)
    private int slotAssigned;

    @Column(name = "allocation_score", nullable = false)
    private double allocationScore;

    @Column(name = "allocation_time", nullable = false)
    private Instant allocationTime;

    @Column(name = "arrival_time", nullable = false)
    private Instant arrivalTime;

    @Column(name = "departure_time", nullable = false)
    private Instant departureTime;

    @Column(name = "priority_level", nullable = false)
    private int priorityLevel;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    // JPA
    protected AllocationEntity() {}

    public static AllocationEntity of(AllocationRecord r) {
        AllocationEntity e = new AllocationEntity();
        e.ledger = r.ledger();
        e.vehicleId = r.vehicleId();
        e.plateType = r.plateType();
        e.vehicleClass = r.vehicleClass();
        e.bayAssigned = r.bayAssigned();
        e.slotAssigned = r.slotAssigned();
        e.allocationScore = r.allocationScore();
        e.allocationTime = r.allocationTime();
        e.arrivalTime = r.arrivalTime();
        e.departureTime = r.departureTime();
        e.priorityLevel = r.priorityLevel();
        e.active = r.active();
        return e;
    }

    public AllocationRecord toDomain() {
        return new AllocationRecord(id, ledger, vehicleId, plateType, vehicleClass, bayAssigned, slotAssigned,
                allocationScore, allocationTime, arrivalTime, departureTime, priorityLevel, active);
    }

    public Long getId() {
        return id;
    }

    public Ledger getLedger() {
        return ledger;
    }

    public String getVehicleId() {
        return vehicleId;
    }

    public Instant getDepartureTime() {
        return departureTime;
    }

    public void setDepartureTime(Instant departureTime) {
        this.departureTime = departureTime;
    }

    public int getPriorityLevel() {
        return priorityLevel;
    }

    public void setPriorityLevel(int priorityLevel) {
        this.priorityLevel = priorityLevel;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
