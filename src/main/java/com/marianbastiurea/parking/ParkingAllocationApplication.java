package com.marianbastiurea.parking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.time.ZoneOffset;
import java.util.TimeZone;

@SpringBootApplication
public class ParkingAllocationApplication {

    private static final Logger log = LoggerFactory.getLogger(ParkingAllocationApplication.class);

    public static void main(String[] args) {
        // reservation times are stored and logged in UTC
        TimeZone.setDefault(TimeZone.getTimeZone(ZoneOffset.UTC));

        SpringApplication.run(ParkingAllocationApplication.class, args);
        log.info("Parking allocation service started");
    }
}
