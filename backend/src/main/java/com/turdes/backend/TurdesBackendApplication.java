package com.turdes.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TurdesBackendApplication {

    public static void main(String[] args) {
        // Token expiries and audit timestamps are all compared in UTC.
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(TurdesBackendApplication.class, args);
    }
}
