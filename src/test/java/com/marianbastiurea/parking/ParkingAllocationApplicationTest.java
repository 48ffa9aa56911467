package com.marianbastiurea.parking;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "parking.facility.num-bays=4",
        "parking.facility.slots-per-bay=10",
        "parking.scoring.timeout-ms=2000"
})
@AutoConfigureMockMvc
class ParkingAllocationApplicationTest {

    private static final String VEHICLE = """
            {"vehicleId": "%s", "arrivalTime": "2099-01-05T09:00:00Z",
             "departureTime": "2099-01-05T11:00:00Z", "priorityLevel": 1}
            """;

    @Autowired
    private MockMvc mvc;

    @Test
    void liveAllocationShowsUpInStatusAndCanBeEnded() throws Exception {
        String body = mvc.perform(post("/api/parking/allocate").param("strategy", "sequential")
                        .contentType(MediaType.APPLICATION_JSON).content(VEHICLE.formatted("IT-1")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.bayAssigned").value(1))
                .andExpect(jsonPath("$.slotAssigned").value(1))
                .andReturn().getResponse().getContentAsString();
        long id = Long.parseLong(body.replaceAll(".*\"id\":(\\d+).*", "$1"));

        mvc.perform(get("/api/parking/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.occupiedSlots").value(1))
                .andExpect(jsonPath("$.bays[0].slots[0].reservation.vehicleId").value("IT-1"));

        mvc.perform(delete("/api/parking/allocation/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mvc.perform(get("/api/parking/status"))
                .andExpect(jsonPath("$.occupiedSlots").value(0));
        mvc.perform(get("/api/parking/log/main"))
                .andExpect(jsonPath("$[0].status").value("ALLOCATED"));
    }

    @Test
    void simulateWithLearnedModelFillsLedger() throws Exception {
        String vehicles = String.join(",",
                VEHICLE.formatted("S-1"), VEHICLE.formatted("S-2"), VEHICLE.formatted("S-3"));

        mvc.perform(post("/api/parking/simulate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"strategy\": \"algorithm\", \"vehicles\": [" + vehicles + "]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.strategy").value("LEARNED"))
                .andExpect(jsonPath("$.report.successful").value(3))
                .andExpect(jsonPath("$.report.successRate").value(1.0))
                .andExpect(jsonPath("$.finalStatus.occupiedSlots").value(3));

        mvc.perform(get("/api/parking/metrics/learned"))
                .andExpect(jsonPath("$", hasSize(3)));
        mvc.perform(get("/api/parking/simulations/learned"))
                .andExpect(jsonPath("$[0].successful").value(3));
    }

    @Test
    void overlongVehicleIdFailsAloneInSimulation() throws Exception {
        String vehicles = String.join(",",
                VEHICLE.formatted("OK-1"), VEHICLE.formatted("L".repeat(70)), VEHICLE.formatted("OK-3"));

        mvc.perform(post("/api/parking/simulate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"strategy\": \"sequential\", \"vehicles\": [" + vehicles + "]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.successful").value(2))
                .andExpect(jsonPath("$.report.failed").value(1))
                .andExpect(jsonPath("$.report.outcomes[1].vehicleId").value("#1"))
                .andExpect(jsonPath("$.report.outcomes[1].errorMessage").value("Vehicle #1: malformed request"));

        mvc.perform(get("/api/parking/metrics/sequential"))
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].vehicleId").value("OK-1"))
                .andExpect(jsonPath("$[1].vehicleId").value("OK-3"));
        mvc.perform(get("/api/parking/simulations/sequential"))
                .andExpect(jsonPath("$[0].totalVehicles").value(3));
    }

    @Test
    void overlongVehicleIdIsBadRequestForLiveAllocation() throws Exception {
        mvc.perform(post("/api/parking/allocate").param("strategy", "sequential")
                        .contentType(MediaType.APPLICATION_JSON).content(VEHICLE.formatted("X".repeat(65))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("vehicleId exceeds 64 characters"));
    }
}
