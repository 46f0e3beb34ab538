package com.ourfarm.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

@Configuration
public class GameConfig {

    /** Shared by the tick thread only, so an unsynchronized generator is enough. */
    @Bean
    public RandomGenerator gameRandom() {
        return new SplittableRandom();
    }
}
