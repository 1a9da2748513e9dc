package com.marketsim.emulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MarketSimEmulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketSimEmulatorApplication.class, args);
    }

}
