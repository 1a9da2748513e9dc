package com.marketsim.emulator.config;

import com.marketsim.emulator.core.support.DefaultRandomSource;
import com.marketsim.emulator.core.support.RandomSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomSource randomSource(EmulatorProperties properties) {
        Long seed = properties.getEngine().getRandomSeed();
        if (seed != null) {
            log.info("Using seeded random source, seed={}", seed);
            return new DefaultRandomSource(seed);
        }
        return new DefaultRandomSource();
    }
}
