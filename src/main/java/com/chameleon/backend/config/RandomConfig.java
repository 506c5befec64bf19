package com.chameleon.backend.config;

import com.chameleon.backend.service.RandomSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Slf4j
@Configuration
public class RandomConfig {

    @Bean
    public RandomSource randomSource(GameProperties properties) {
        Long seed = properties.getRandom().getSeed();
        Random random;
        if (seed != null) {
            log.info("Using fixed random seed {}", seed);
            random = new Random(seed);
        } else {
            random = new Random();
        }
        return random::nextInt;
    }
}
