package me.golemcore.robots.domain.service;

import me.golemcore.robots.domain.model.ActionKind;
import me.golemcore.robots.domain.model.ActionPage;
import me.golemcore.robots.domain.model.ActionRecord;
import me.golemcore.robots.domain.model.AttackResult;
import me.golemcore.robots.domain.model.Direction;
import me.golemcore.robots.domain.model.Position;
import me.golemcore.robots.domain.model.RobotFailureKind;
import me.golemcore.robots.domain.model.RobotOperationException;
import me.golemcore.robots.domain.model.RobotSnapshot;
import me.golemcore.robots.domain.model.StatePatch;
import me.golemcore.robots.infrastructure.config.RobotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RobotRegistryTest {

    private static final Instant FIXED_INSTANT = Instant.parse("2026-03-01T10:00:00Z");
    private static final String R1 = "r1";
    private static final String R2 = "r2";
    private static final String ITEM = "item42";

    private RobotProperties properties;
    private RobotRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new RobotProperties();
        registry = new RobotRegistry(properties, Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC));
        registry.register(R1, Position.ORIGIN, 100);
        registry.register(R2, new Position(1, 0), 100);
    }

    private static void assertFailure(RobotFailureKind expected, Executable executable) {
        RobotOperationException ex = assertThrows(RobotOperationException.class, executable);
        assertEquals(expected, ex.getKind());
    }

    // ==================== Provisioning ====================

    @Test
    void shouldRejectDuplicateAndBlankRegistrations() {
        assertFailure(RobotFailureKind.CONFLICT, () -> registry.register(R1, Position.ORIGIN, 50));
        assertFailure(RobotFailureKind.INVALID_ARGUMENT, () -> registry.register(" ", Position.ORIGIN, 50));
        assertEquals(100, registry.get(R1).getEnergy());
    }

    @Test
    void shouldListRobotsOrderedById() {
        registry.register("a0", Position.ORIGIN, 10);

        List<String> ids = registry.listRobots().stream().map(RobotSnapshot::getId).toList();

        assertEquals(List.of("a0", R1, R2), ids);
    }

    @Test
    void getShouldFailForUnknownRobot() {
        assertFailure(RobotFailureKind.NOT_FOUND, () -> registry.get("ghost"));
    }

    @Test
    void shouldAutoCreateUnknownRobotsWhenEnabled() {
        properties.getProvisioning().setAutoCreate(true);
        properties.getProvisioning().setSpawnX(3);
        properties.getProvisioning().setSpawnEnergy(40);
        RobotRegistry lazy = new RobotRegistry(properties, Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC));

        RobotSnapshot snapshot = lazy.get("newbie");

        assertEquals(new Position(3, 0), snapshot.getPosition());
        assertEquals(40, snapshot.getEnergy());
        assertTrue(lazy.contains("newbie"));
    }

    @Test
    void removeShouldReleaseHeldItems() {
        registry.pickup(R1, ITEM);

        registry.remove(R1);

        assertFalse(registry.contains(R1));
        assertFailure(RobotFailureKind.NOT_FOUND, () -> registry.get(R1));
        assertEquals(List.of(ITEM), registry.pickup(R2, ITEM).getInventory());
    }

    // ==================== Move ====================

    @Test
    void moveUpShouldCostEnergyAndStepY() {
        RobotSnapshot snapshot = registry.move(R1, Direction.UP);

        assertEquals(new Position(0, 1), snapshot.getPosition());
        assertEquals(95, snapshot.getEnergy());
    }

    @Test
    void moveShouldFailWithInsufficientEnergyWithoutMutation() {
        registry.patchState(R1, StatePatch.energy(4));

        assertFailure(RobotFailureKind.INSUFFICIENT_ENERGY, () -> registry.move(R1, Direction.UP));

        RobotSnapshot snapshot = registry.get(R1);
        assertEquals(Position.ORIGIN, snapshot.getPosition());
        assertEquals(4, snapshot.getEnergy());
        assertEquals(1, registry.listActions(R1, 1, 10).getTotalActions());
    }

    @Test
    void moveThenPatchBackShouldRestorePriorSnapshot() {
        registry.patchState(R1, StatePatch.energy(80));
        RobotSnapshot before = registry.get(R1);

        registry.move(R1, Direction.LEFT);
        RobotSnapshot restored = registry.patchState(R1,
                new StatePatch(before.getEnergy(), before.getPosition()));

        assertEquals(before, restored);
    }

    @Test
    void shouldUseConfiguredMoveCost() {
        properties.getMovement().setCost(12);
        RobotRegistry custom = new RobotRegistry(properties, Clock.systemUTC());
        custom.register(R1, Position.ORIGIN, 100);

        assertEquals(88, custom.move(R1, Direction.DOWN).getEnergy());
    }

    @Test
    void nonPositiveMoveCostShouldFallBackToDefault() {
        properties.getMovement().setCost(0);
        RobotRegistry custom = new RobotRegistry(properties, Clock.systemUTC());

        assertEquals(5, custom.getMoveCost());
    }

    @Test
    void negativeAttackSettingsShouldBeTreatedAsZero() {
        properties.getAttack().setCost(-4);
        properties.getAttack().setDamage(-10);
        RobotRegistry custom = new RobotRegistry(properties, Clock.systemUTC());
        custom.register(R1, Position.ORIGIN, 100);
        custom.register(R2, Position.ORIGIN, 100);

        assertEquals(0, custom.getAttackCost());
        assertEquals(0, custom.getAttackDamage());

        AttackResult result = custom.attack(R1, R2);
        assertEquals(0, result.getDamage());
        assertEquals(100, result.getAttacker().getEnergy());
        assertEquals(100, result.getTarget().getEnergy());
    }

    // ==================== Patch ====================

    @Test
    void patchShouldApplyOnlySuppliedFieldsAndClamp() {
        RobotSnapshot snapshot = registry.patchState(R1, StatePatch.energy(150));
        assertEquals(100, snapshot.getEnergy());
        assertEquals(0, registry.listActions(R1, 1, 10).getTotalActions());

        snapshot = registry.patchState(R1, StatePatch.position(new Position(5, 5)));
        assertEquals(new Position(5, 5), snapshot.getPosition());
        assertEquals(100, snapshot.getEnergy());

        ActionRecord record = registry.listActions(R1, 1, 10).getItems().get(0);
        assertEquals(ActionKind.PATCH, record.getKind());
        assertFalse(record.getDetails().containsKey("energy"));
    }

    @Test
    void patchShouldFailForUnknownRobot() {
        assertFailure(RobotFailureKind.NOT_FOUND, () -> registry.patchState("ghost", StatePatch.energy(5)));
    }

    // ==================== Inventory ====================

    @Test
    void itemShouldBeHeldByOneRobotAtATime() {
        registry.pickup(R1, ITEM);

        assertFailure(RobotFailureKind.CONFLICT, () -> registry.pickup(R2, ITEM));
        assertFailure(RobotFailureKind.CONFLICT, () -> registry.pickup(R1, ITEM));

        registry.putdown(R1, ITEM);
        RobotSnapshot r2 = registry.pickup(R2, ITEM);

        assertEquals(List.of(ITEM), r2.getInventory());
        assertTrue(registry.get(R1).getInventory().isEmpty());
    }

    @Test
    void putdownShouldFailWhenItemHeldByAnotherRobot() {
        registry.pickup(R2, ITEM);

        assertFailure(RobotFailureKind.NOT_HELD, () -> registry.putdown(R1, ITEM));
        assertEquals(List.of(ITEM), registry.get(R2).getInventory());
    }

    @Test
    void pickupShouldRejectBlankItem() {
        assertFailure(RobotFailureKind.INVALID_ARGUMENT, () -> registry.pickup(R1, ""));
    }

    @Test
    void incapacitatedRobotShouldNotHandleItems() {
        registry.pickup(R1, ITEM);
        registry.patchState(R1, StatePatch.energy(0));

        assertFailure(RobotFailureKind.INCAPACITATED_ACTOR, () -> registry.pickup(R1, "other"));
        assertFailure(RobotFailureKind.INCAPACITATED_ACTOR, () -> registry.putdown(R1, ITEM));
        assertFailure(RobotFailureKind.CONFLICT, () -> registry.pickup(R2, ITEM));

        // a failed pickup must not claim the item
        registry.pickup(R2, "other");
    }

    // ==================== Attack ====================

    @Test
    void attackOnSameTileShouldDealDamage() {
        registry.patchState(R2, StatePatch.position(Position.ORIGIN));

        AttackResult result = registry.attack(R1, R2);

        assertEquals(10, result.getDamage());
        assertEquals(95, result.getAttacker().getEnergy());
        assertEquals(90, result.getTarget().getEnergy());
        assertEquals(ActionKind.ATTACK_OUTGOING, lastAction(R1).getKind());
        assertEquals(ActionKind.ATTACK_INCOMING, lastAction(R2).getKind());
    }

    @Test
    void attackOnDifferentTileShouldOnlyChargeAttacker() {
        AttackResult result = registry.attack(R1, R2);

        assertEquals(0, result.getDamage());
        assertEquals(95, result.getAttacker().getEnergy());
        assertEquals(100, result.getTarget().getEnergy());
    }

    @Test
    void attackShouldIgnoreDistanceWhenSameTileNotRequired() {
        properties.getAttack().setRequireSameTile(false);
        RobotRegistry ranged = new RobotRegistry(properties, Clock.systemUTC());
        ranged.register(R1, Position.ORIGIN, 100);
        ranged.register(R2, new Position(50, 50), 100);

        assertEquals(90, ranged.attack(R1, R2).getTarget().getEnergy());
    }

    @Test
    void attackValidationFailures() {
        assertFailure(RobotFailureKind.INVALID_ARGUMENT, () -> registry.attack(R1, R1));
        assertFailure(RobotFailureKind.NOT_FOUND, () -> registry.attack(R1, "ghost"));
        assertFailure(RobotFailureKind.NOT_FOUND, () -> registry.attack("ghost", R1));

        registry.patchState(R1, StatePatch.energy(0));
        assertFailure(RobotFailureKind.INCAPACITATED_ACTOR, () -> registry.attack(R1, R2));

        registry.patchState(R1, StatePatch.energy(3));
        assertFailure(RobotFailureKind.INSUFFICIENT_ENERGY, () -> registry.attack(R1, R2));

        assertEquals(100, registry.get(R2).getEnergy());
        assertEquals(0, registry.listActions(R2, 1, 10).getTotalActions());
    }

    @Test
    void attackingIncapacitatedTargetShouldSucceed() {
        registry.patchState(R2, new StatePatch(0, Position.ORIGIN));

        AttackResult result = registry.attack(R1, R2);

        assertEquals(0, result.getTarget().getEnergy());
        assertEquals(0, result.getDamage());
        assertTrue(result.getTarget().isIncapacitated());
        assertEquals(R2, registry.get(R2).getId());
    }

    @Test
    void incapacitatedTargetCannotActUntilPatched() {
        registry.patchState(R2, new StatePatch(10, Position.ORIGIN));
        registry.attack(R1, R2);

        assertFailure(RobotFailureKind.INCAPACITATED_ACTOR, () -> registry.move(R2, Direction.UP));
        assertFailure(RobotFailureKind.INCAPACITATED_ACTOR, () -> registry.attack(R2, R1));

        registry.patchState(R2, StatePatch.energy(50));
        assertEquals(45, registry.move(R2, Direction.UP).getEnergy());
    }

    // ==================== Actions ====================

    @Test
    void listActionsShouldPageThroughLog() {
        registry.move(R1, Direction.UP);
        registry.move(R1, Direction.RIGHT);
        registry.pickup(R1, ITEM);

        ActionPage first = registry.listActions(R1, 1, 2);
        assertEquals(List.of(ActionKind.MOVE, ActionKind.MOVE),
                first.getItems().stream().map(ActionRecord::getKind).toList());
        assertEquals(3, first.getTotalActions());
        assertTrue(first.hasNext());

        ActionPage second = registry.listActions(R1, 2, 2);
        assertEquals(1, second.getItems().size());
        assertEquals(ActionKind.PICKUP, second.getItems().get(0).getKind());
        assertFalse(second.hasNext());

        assertTrue(registry.listActions(R1, 3, 2).getItems().isEmpty());
    }

    @Test
    void listActionsShouldValidatePaging() {
        assertFailure(RobotFailureKind.INVALID_ARGUMENT, () -> registry.listActions(R1, 0, 5));
        assertFailure(RobotFailureKind.INVALID_ARGUMENT, () -> registry.listActions(R1, 1, 0));
        assertFailure(RobotFailureKind.INVALID_ARGUMENT, () -> registry.listActions(R1, -1, -1));
        assertFailure(RobotFailureKind.NOT_FOUND, () -> registry.listActions("ghost", 1, 5));
    }

    @Test
    void concatenatedPagesShouldReproduceFullLog() {
        Random random = new Random(7);
        Direction[] directions = Direction.values();
        for (int i = 0; i < 23; i++) {
            registry.move(R1, directions[random.nextInt(directions.length)]);
        }

        for (int size = 1; size <= 7; size++) {
            List<Long> sequences = new ArrayList<>();
            ActionPage page;
            int pageNumber = 1;
            do {
                page = registry.listActions(R1, pageNumber++, size);
                page.getItems().forEach(record -> sequences.add(record.getSequence()));
            } while (page.hasNext());

            assertEquals(23, sequences.size(), "size " + size);
            for (int i = 0; i < sequences.size(); i++) {
                assertEquals(i + 1L, sequences.get(i));
            }
        }
    }

    @Test
    void energyShouldStayInRangeAcrossRandomOperations() {
        Random random = new Random(42);
        Direction[] directions = Direction.values();
        List<String> ids = List.of(R1, R2);

        for (int i = 0; i < 500; i++) {
            String id = ids.get(random.nextInt(2));
            String other = id.equals(R1) ? R2 : R1;
            try {
                switch (random.nextInt(4)) {
                case 0 -> registry.move(id, directions[random.nextInt(directions.length)]);
                case 1 -> registry.patchState(id, StatePatch.energy(random.nextInt(300) - 100));
                case 2 -> registry.attack(id, other);
                default -> registry.patchState(id, StatePatch.position(registry.get(other).getPosition()));
                }
            } catch (RobotOperationException e) {
                // rejected operations are expected
            }
            for (RobotSnapshot snapshot : registry.listRobots()) {
                assertTrue(snapshot.getEnergy() >= 0 && snapshot.getEnergy() <= 100);
            }
        }
    }

    @Test
    void shutdownShouldDropAllRobots() {
        registry.shutdown();

        assertTrue(registry.listRobots().isEmpty());
    }

    private ActionRecord lastAction(String id) {
        ActionPage all = registry.listActions(id, 1, 100);
        return all.getItems().get(all.getItems().size() - 1);
    }
}
