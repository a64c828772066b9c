package me.golemcore.robots.domain.service;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.robots.domain.model.ActionPage;
import me.golemcore.robots.domain.model.AttackResult;
import me.golemcore.robots.domain.model.Direction;
import me.golemcore.robots.domain.model.Position;
import me.golemcore.robots.domain.model.Robot;
import me.golemcore.robots.domain.model.RobotFailureKind;
import me.golemcore.robots.domain.model.RobotOperationException;
import me.golemcore.robots.domain.model.RobotSnapshot;
import me.golemcore.robots.domain.model.StatePatch;
import me.golemcore.robots.infrastructure.config.RobotProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Owns every robot and is the single entry point for robot operations.
 *
 * <p>
 * Locking rules:
 * <ul>
 * <li>Each robot's state is read and written only under its own monitor
 * ({@link Robot#getLock()}), so snapshots are never torn.</li>
 * <li>{@link #attack(String, String)} takes both robot monitors in ascending
 * id order. Two attacks in opposite directions therefore cannot deadlock.</li>
 * <li>Item ownership lives in one registry-wide table guarded by
 * {@code itemLock}. It is always taken after the robot monitor, never before,
 * and never while holding two robot monitors.</li>
 * </ul>
 *
 * <p>
 * All checks happen before the first mutation; a rejected operation leaves
 * every robot and the ownership table unchanged.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class RobotRegistry {

    private final Map<String, Robot> robots = new ConcurrentHashMap<>();
    private final Object itemLock = new Object();
    // item id -> owning robot id, guarded by itemLock
    private final Map<String, String> itemOwners = new HashMap<>();

    private final Clock clock;
    private final int moveCost;
    private final int attackCost;
    private final int attackDamage;
    private final boolean attackRequiresSameTile;
    private final boolean autoCreate;
    private final Position spawnPosition;
    private final int spawnEnergy;

    public RobotRegistry(RobotProperties properties, Clock clock) {
        this.clock = clock;
        this.moveCost = normalizePositive(properties.getMovement().getCost(), 5);
        this.attackCost = Math.max(0, properties.getAttack().getCost());
        this.attackDamage = Math.max(0, properties.getAttack().getDamage());
        this.attackRequiresSameTile = properties.getAttack().isRequireSameTile();
        RobotProperties.ProvisioningProperties provisioning = properties.getProvisioning();
        this.autoCreate = provisioning.isAutoCreate();
        this.spawnPosition = new Position(provisioning.getSpawnX(), provisioning.getSpawnY());
        this.spawnEnergy = Robot.clampEnergy(provisioning.getSpawnEnergy());
    }

    // ==================== Provisioning ====================

    public RobotSnapshot register(String id, Position position, int energy) {
        requireId(id, "robot id");
        Objects.requireNonNull(position, "position");
        Robot robot = new Robot(id, position, energy);
        if (robots.putIfAbsent(id, robot) != null) {
            throw new RobotOperationException(RobotFailureKind.CONFLICT, "Robot already exists: " + id);
        }
        log.info("[Robots] Registered {} at ({}, {}) with energy {}", id, position.x(), position.y(),
                robot.getEnergy());
        synchronized (robot.getLock()) {
            return robot.snapshot();
        }
    }

    /**
     * Removes a robot and frees every item it held.
     */
    public RobotSnapshot remove(String id) {
        return withRobot(id, robot -> {
            robots.remove(id, robot);
            RobotSnapshot last = robot.snapshot();
            List<String> released = robot.retire();
            synchronized (itemLock) {
                released.forEach(itemOwners::remove);
            }
            log.info("[Robots] Removed {} (released {} item(s))", id, released.size());
            return last;
        });
    }

    public List<RobotSnapshot> listRobots() {
        return robots.values().stream()
                .sorted(Comparator.comparing(Robot::getId))
                .map(robot -> {
                    synchronized (robot.getLock()) {
                        return robot.isRemoved() ? null : robot.snapshot();
                    }
                })
                .filter(Objects::nonNull)
                .toList();
    }

    public boolean contains(String id) {
        return id != null && robots.containsKey(id);
    }

    // ==================== Operations ====================

    public RobotSnapshot get(String id) {
        return withRobot(id, Robot::snapshot);
    }

    public RobotSnapshot move(String id, Direction direction) {
        Objects.requireNonNull(direction, "direction");
        return withRobot(id, robot -> {
            robot.move(direction, moveCost, now());
            log.debug("[Robots] {} moved {} to {}", id, direction.value(), robot.getPosition());
            return robot.snapshot();
        });
    }

    public RobotSnapshot patchState(String id, StatePatch patch) {
        Objects.requireNonNull(patch, "patch");
        return withRobot(id, robot -> {
            boolean changed = robot.applyPatch(patch, now());
            if (changed) {
                log.debug("[Robots] {} patched: energy={}, position={}", id, robot.getEnergy(),
                        robot.getPosition());
            }
            return robot.snapshot();
        });
    }

    public RobotSnapshot pickup(String id, String itemId) {
        requireId(itemId, "item id");
        return withRobot(id, robot -> {
            robot.ensureActive();
            synchronized (itemLock) {
                String owner = itemOwners.get(itemId);
                if (owner != null) {
                    String holder = owner.equals(id) ? "this robot" : "robot " + owner;
                    throw new RobotOperationException(RobotFailureKind.CONFLICT,
                            "Item " + itemId + " is already held by " + holder);
                }
                robot.pickup(itemId, now());
                itemOwners.put(itemId, id);
            }
            log.debug("[Robots] {} picked up {}", id, itemId);
            return robot.snapshot();
        });
    }

    public RobotSnapshot putdown(String id, String itemId) {
        requireId(itemId, "item id");
        return withRobot(id, robot -> {
            synchronized (itemLock) {
                robot.putdown(itemId, now());
                itemOwners.remove(itemId, id);
            }
            log.debug("[Robots] {} put down {}", id, itemId);
            return robot.snapshot();
        });
    }

    public AttackResult attack(String attackerId, String targetId) {
        requireId(attackerId, "attacker id");
        requireId(targetId, "target id");
        if (attackerId.equals(targetId)) {
            throw RobotOperationException.invalidArgument("Robot " + attackerId + " cannot attack itself");
        }

        Robot attacker = resolve(attackerId);
        Robot target = resolve(targetId);
        Robot first = attackerId.compareTo(targetId) < 0 ? attacker : target;
        Robot second = first == attacker ? target : attacker;

        synchronized (first.getLock()) {
            synchronized (second.getLock()) {
                if (attacker.isRemoved()) {
                    throw RobotOperationException.notFound(attackerId);
                }
                if (target.isRemoved()) {
                    throw RobotOperationException.notFound(targetId);
                }

                int damage = resolveDamage(attacker, target);
                int dealt = attacker.attack(target, attackCost, damage, now());
                log.info("[Robots] {} attacked {} for {} damage (target energy {})", attackerId, targetId, dealt,
                        target.getEnergy());
                return AttackResult.builder()
                        .attacker(attacker.snapshot())
                        .target(target.snapshot())
                        .damage(dealt)
                        .build();
            }
        }
    }

    public ActionPage listActions(String id, int page, int size) {
        if (page < 1) {
            throw RobotOperationException.invalidArgument("page must be >= 1, got: " + page);
        }
        if (size < 1) {
            throw RobotOperationException.invalidArgument("size must be >= 1, got: " + size);
        }
        return withRobot(id, robot -> robot.actions(page, size));
    }

    public int getMoveCost() {
        return moveCost;
    }

    public int getAttackCost() {
        return attackCost;
    }

    public int getAttackDamage() {
        return attackDamage;
    }

    @PreDestroy
    public void shutdown() {
        log.info("[Robots] Registry shutting down, dropping {} robot(s)", robots.size());
        robots.clear();
        synchronized (itemLock) {
            itemOwners.clear();
        }
    }

    // ==================== Internals ====================

    private int resolveDamage(Robot attacker, Robot target) {
        if (attackRequiresSameTile && !attacker.getPosition().equals(target.getPosition())) {
            return 0;
        }
        return attackDamage;
    }

    private <T> T withRobot(String id, Function<Robot, T> action) {
        Robot robot = resolve(id);
        synchronized (robot.getLock()) {
            if (robot.isRemoved()) {
                throw RobotOperationException.notFound(id);
            }
            return action.apply(robot);
        }
    }

    private Robot resolve(String id) {
        requireId(id, "robot id");
        Robot robot = robots.get(id);
        if (robot != null) {
            return robot;
        }
        if (!autoCreate) {
            throw RobotOperationException.notFound(id);
        }
        return robots.computeIfAbsent(id, key -> {
            log.info("[Robots] Auto-created {} at ({}, {})", key, spawnPosition.x(), spawnPosition.y());
            return new Robot(key, spawnPosition, spawnEnergy);
        });
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw RobotOperationException.invalidArgument(name + " must not be blank");
        }
    }

    private static int normalizePositive(int value, int fallback) {
        return value > 0 ? value : fallback;
    }
}
