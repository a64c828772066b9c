package me.golemcore.robots.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.robots.domain.model.Position;
import me.golemcore.robots.domain.model.RobotOperationException;
import me.golemcore.robots.domain.service.RobotRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application wiring and startup seeding.
 *
 * <p>
 * On startup this configuration:
 * <ul>
 * <li>Logs the effective movement and attack rules</li>
 * <li>Registers the seed robots from {@code robots.provisioning.seeds}</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RobotProperties properties;
    private final RobotRegistry robotRegistry;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @PostConstruct
    public void init() {
        log.info("Robot Service starting...");
        log.info("Move cost: {}, attack cost: {}, attack damage: {} (same tile only: {})",
                robotRegistry.getMoveCost(),
                robotRegistry.getAttackCost(),
                robotRegistry.getAttackDamage(),
                properties.getAttack().isRequireSameTile());
        log.info("Auto-create robots: {}", properties.getProvisioning().isAutoCreate());

        int seeded = 0;
        for (RobotProperties.SeedRobot seed : properties.getProvisioning().getSeeds()) {
            if (seed.getId() == null || seed.getId().isBlank()) {
                log.warn("Skipping seed robot without id");
                continue;
            }
            try {
                robotRegistry.register(seed.getId(), new Position(seed.getX(), seed.getY()), seed.getEnergy());
                seeded++;
            } catch (RobotOperationException e) {
                log.warn("Skipping seed robot {}: {}", seed.getId(), e.getMessage());
            }
        }

        log.info("Robot Service started with {} seeded robot(s)", seeded);
    }
}
