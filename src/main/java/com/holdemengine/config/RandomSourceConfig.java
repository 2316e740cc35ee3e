package com.holdemengine.config;

import com.holdemengine.rng.RandomSource;
import com.holdemengine.rng.SecureRandomSource;
import com.holdemengine.rng.SeededRandomSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class RandomSourceConfig {

    @Bean
    public RandomSource randomSource(TableSettings settings) {
        if (settings.getRngSeed() != null) {
            log.warn("Using seeded random source (seed {}); not for real play", settings.getRngSeed());
            return new SeededRandomSource(settings.getRngSeed());
        }
        return new SecureRandomSource();
    }
}
