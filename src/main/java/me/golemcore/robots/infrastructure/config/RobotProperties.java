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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Robot service configuration, bound from application.properties under the
 * {@code robots.*} prefix.
 *
 * <ul>
 * <li>{@link MovementProperties} - energy cost of a unit step</li>
 * <li>{@link AttackProperties} - attack cost and damage rule</li>
 * <li>{@link ProvisioningProperties} - seed robots and lazy creation</li>
 * <li>{@link ActionsProperties} - action log paging limits</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "robots")
@Data
public class RobotProperties {

    private MovementProperties movement = new MovementProperties();
    private AttackProperties attack = new AttackProperties();
    private ProvisioningProperties provisioning = new ProvisioningProperties();
    private ActionsProperties actions = new ActionsProperties();

    @Data
    public static class MovementProperties {
        private int cost = 5;
    }

    @Data
    public static class AttackProperties {
        private int cost = 5;
        private int damage = 10;
        /** When true, damage is dealt only if attacker and target share a tile. */
        private boolean requireSameTile = true;
    }

    @Data
    public static class ProvisioningProperties {
        /** Create unknown robots on first reference instead of failing. */
        private boolean autoCreate = false;
        private int spawnX = 0;
        private int spawnY = 0;
        private int spawnEnergy = 100;
        private List<SeedRobot> seeds = new ArrayList<>();
    }

    @Data
    public static class SeedRobot {
        private String id;
        private int x;
        private int y;
        private int energy = 100;
    }

    @Data
    public static class ActionsProperties {
        private int defaultPageSize = 5;
        private int maxPageSize = 100;
    }
}
