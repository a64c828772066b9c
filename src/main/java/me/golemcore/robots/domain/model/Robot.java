package me.golemcore.robots.domain.model;

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

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable robot entity holding position, energy, inventory and the append-only
 * action log.
 *
 * <p>
 * Not thread-safe on its own. Every method except {@link #getId()} and
 * {@link #getLock()} must be called while holding {@link #getLock()}; the
 * {@link me.golemcore.robots.domain.service.RobotRegistry} is responsible for
 * that.
 *
 * <p>
 * Each transition validates first and mutates second, so a thrown
 * {@link RobotOperationException} leaves the robot untouched.
 *
 * @since 1.0
 */
@Slf4j
public class Robot {

    public static final int MIN_ENERGY = 0;
    public static final int MAX_ENERGY = 100;

    private final String id;
    private final Object lock = new Object();
    private final Set<String> inventory = new LinkedHashSet<>();
    private final List<ActionRecord> actionLog = new ArrayList<>();

    private Position position;
    private int energy;
    private boolean removed;

    public Robot(String id, Position position, int energy) {
        this.id = Objects.requireNonNull(id, "id");
        this.position = Objects.requireNonNull(position, "position");
        this.energy = clampEnergy(energy);
    }

    public static int clampEnergy(int value) {
        return Math.max(MIN_ENERGY, Math.min(MAX_ENERGY, value));
    }

    public String getId() {
        return id;
    }

    /**
     * Monitor guarding all mutable state of this robot.
     */
    public Object getLock() {
        return lock;
    }

    public Position getPosition() {
        return position;
    }

    public int getEnergy() {
        return energy;
    }

    public boolean isIncapacitated() {
        return energy == MIN_ENERGY;
    }

    public int getActionCount() {
        return actionLog.size();
    }

    public boolean isRemoved() {
        return removed;
    }

    /**
     * Marks the robot as no longer registered and returns the items it held.
     * The inventory is emptied; the action log is kept as is.
     */
    public List<String> retire() {
        removed = true;
        List<String> released = new ArrayList<>(inventory);
        inventory.clear();
        return released;
    }

    // ==================== Transitions ====================

    public void ensureActive() {
        if (isIncapacitated()) {
            throw new RobotOperationException(RobotFailureKind.INCAPACITATED_ACTOR,
                    "Robot " + id + " is incapacitated (energy 0)");
        }
    }

    public void move(Direction direction, int cost, Instant now) {
        Objects.requireNonNull(direction, "direction");
        ensureActive();
        if (energy < cost) {
            throw new RobotOperationException(RobotFailureKind.INSUFFICIENT_ENERGY,
                    "Robot " + id + " needs " + cost + " energy to move, has " + energy);
        }

        Position next;
        try {
            next = position.step(direction);
        } catch (ArithmeticException e) {
            throw RobotOperationException.invalidArgument(
                    "Robot " + id + " cannot move " + direction.value() + " past the edge of the grid at " + position);
        }

        position = next;
        changeEnergy(energy - cost);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("direction", direction.value());
        details.put("position", positionDetails(position));
        details.put("energy", energy);
        append(ActionKind.MOVE, details, now);
    }

    /**
     * Applies the supplied fields. Only fields whose value actually changes are
     * recorded; a patch that changes nothing leaves the log alone.
     *
     * @return {@code true} when something changed
     */
    public boolean applyPatch(StatePatch patch, Instant now) {
        Objects.requireNonNull(patch, "patch");

        Map<String, Object> changed = new LinkedHashMap<>();
        if (patch.energy() != null) {
            int clamped = clampEnergy(patch.energy());
            if (clamped != energy) {
                changeEnergy(clamped);
                changed.put("energy", energy);
            }
        }
        if (patch.position() != null && !patch.position().equals(position)) {
            position = patch.position();
            changed.put("position", positionDetails(position));
        }

        if (changed.isEmpty()) {
            return false;
        }
        append(ActionKind.PATCH, changed, now);
        return true;
    }

    /**
     * Adds an item. Registry-wide ownership is checked by the caller; this only
     * guards against a duplicate in this robot's own inventory.
     */
    public void pickup(String itemId, Instant now) {
        ensureActive();
        if (inventory.contains(itemId)) {
            throw new RobotOperationException(RobotFailureKind.CONFLICT,
                    "Item " + itemId + " is already held by " + id);
        }
        inventory.add(itemId);
        append(ActionKind.PICKUP, Map.of("itemId", itemId), now);
    }

    public void putdown(String itemId, Instant now) {
        ensureActive();
        if (!inventory.contains(itemId)) {
            throw new RobotOperationException(RobotFailureKind.NOT_HELD,
                    "Item " + itemId + " is not in the inventory of " + id);
        }
        inventory.remove(itemId);
        append(ActionKind.PUTDOWN, Map.of("itemId", itemId), now);
    }

    /**
     * Pays {@code cost} from this robot's energy and deals {@code damage} to the
     * target, recording both sides. The caller must hold both robots' locks.
     *
     * @return damage actually removed from the target's energy
     */
    public int attack(Robot target, int cost, int damage, Instant now) {
        Objects.requireNonNull(target, "target");
        if (target == this) {
            throw RobotOperationException.invalidArgument("Robot " + id + " cannot attack itself");
        }
        ensureActive();
        if (energy < cost) {
            throw new RobotOperationException(RobotFailureKind.INSUFFICIENT_ENERGY,
                    "Robot " + id + " needs " + cost + " energy to attack, has " + energy);
        }

        changeEnergy(energy - cost);
        int targetBefore = target.energy;
        target.changeEnergy(target.energy - Math.max(0, damage));
        int dealt = targetBefore - target.energy;

        Map<String, Object> outgoing = new LinkedHashMap<>();
        outgoing.put("targetId", target.id);
        outgoing.put("damage", dealt);
        outgoing.put("energyAfter", energy);
        append(ActionKind.ATTACK_OUTGOING, outgoing, now);

        Map<String, Object> incoming = new LinkedHashMap<>();
        incoming.put("attackerId", id);
        incoming.put("damage", dealt);
        incoming.put("energyAfter", target.energy);
        target.append(ActionKind.ATTACK_INCOMING, incoming, now);
        return dealt;
    }

    // ==================== Reads ====================

    public RobotSnapshot snapshot() {
        return RobotSnapshot.builder()
                .id(id)
                .position(position)
                .energy(energy)
                .inventory(List.copyOf(inventory))
                .build();
    }

    /**
     * Returns the slice {@code [(page-1)*size, page*size)} of the log. Arguments
     * are validated by the caller.
     */
    public ActionPage actions(int page, int size) {
        int total = actionLog.size();
        long start = (long) (page - 1) * size;
        long end = Math.min(start + size, total);

        List<ActionRecord> items = start >= total
                ? List.of()
                : List.copyOf(actionLog.subList((int) start, (int) end));
        int totalPages = Math.max(1, (int) ((total + (long) size - 1) / size));

        return ActionPage.builder()
                .page(page)
                .size(size)
                .items(items)
                .totalActions(total)
                .totalPages(totalPages)
                .build();
    }

    // ==================== Internals ====================

    private void changeEnergy(int value) {
        boolean wasIncapacitated = isIncapacitated();
        energy = clampEnergy(value);
        if (!wasIncapacitated && isIncapacitated()) {
            log.info("[Robots] {} is incapacitated", id);
        } else if (wasIncapacitated && !isIncapacitated()) {
            log.info("[Robots] {} is active again (energy {})", id, energy);
        }
    }

    private void append(ActionKind kind, Map<String, Object> details, Instant now) {
        Instant timestamp = now;
        if (!actionLog.isEmpty()) {
            Instant last = actionLog.get(actionLog.size() - 1).getTimestamp();
            if (timestamp.isBefore(last)) {
                // wall clock stepped back; keep the log non-decreasing
                timestamp = last;
            }
        }
        actionLog.add(ActionRecord.builder()
                .sequence(actionLog.size() + 1L)
                .kind(kind)
                .details(Collections.unmodifiableMap(new LinkedHashMap<>(details)))
                .timestamp(timestamp)
                .build());
    }

    private static Map<String, Object> positionDetails(Position position) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("x", position.x());
        details.put("y", position.y());
        return Collections.unmodifiableMap(details);
    }
}
