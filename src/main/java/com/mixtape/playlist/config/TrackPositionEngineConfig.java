package com.mixtape.playlist.config;

import com.mixtape.playlist.core.position.CapacityGuard;
import com.mixtape.playlist.core.position.DuplicateGuard;
import com.mixtape.playlist.core.position.PositionAllocator;
import com.mixtape.playlist.core.position.ReorderValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the framework-free position engine components as beans.
 */
@Configuration
public class TrackPositionEngineConfig {

    @Bean
    public PositionAllocator positionAllocator() {
        return new PositionAllocator();
    }

    @Bean
    public CapacityGuard capacityGuard() {
        return new CapacityGuard();
    }

    @Bean
    public DuplicateGuard duplicateGuard() {
        return new DuplicateGuard();
    }

    @Bean
    public ReorderValidator reorderValidator() {
        return new ReorderValidator();
    }
}
