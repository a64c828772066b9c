package me.golemcore.robots.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.robots.adapter.inbound.web.RobotLinks;
import me.golemcore.robots.adapter.inbound.web.dto.ActionDto;
import me.golemcore.robots.adapter.inbound.web.dto.ActionsPageResponse;
import me.golemcore.robots.adapter.inbound.web.dto.AttackResponse;
import me.golemcore.robots.adapter.inbound.web.dto.MoveRequest;
import me.golemcore.robots.adapter.inbound.web.dto.PositionDto;
import me.golemcore.robots.adapter.inbound.web.dto.RobotDto;
import me.golemcore.robots.adapter.inbound.web.dto.StatePatchRequest;
import me.golemcore.robots.domain.model.ActionPage;
import me.golemcore.robots.domain.model.ActionRecord;
import me.golemcore.robots.domain.model.AttackResult;
import me.golemcore.robots.domain.model.Direction;
import me.golemcore.robots.domain.model.Position;
import me.golemcore.robots.domain.model.RobotOperationException;
import me.golemcore.robots.domain.model.RobotSnapshot;
import me.golemcore.robots.domain.model.StatePatch;
import me.golemcore.robots.domain.service.RobotRegistry;
import me.golemcore.robots.infrastructure.config.RobotProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST endpoints for robots. Every handler is a direct call into
 * {@link RobotRegistry}; failures are mapped by
 * {@link me.golemcore.robots.adapter.inbound.web.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/robots")
@RequiredArgsConstructor
public class RobotsController {

    private final RobotRegistry robotRegistry;
    private final RobotProperties properties;

    @GetMapping
    public Mono<ResponseEntity<List<RobotDto>>> listRobots() {
        List<RobotDto> robots = robotRegistry.listRobots().stream()
                .map(this::toDtoWithLinks)
                .toList();
        return Mono.just(ResponseEntity.ok(robots));
    }

    @GetMapping("/{robotId}/status")
    public Mono<ResponseEntity<RobotDto>> getStatus(@PathVariable String robotId) {
        return Mono.just(ResponseEntity.ok(toDtoWithLinks(robotRegistry.get(robotId))));
    }

    @PostMapping("/{robotId}/move")
    public Mono<ResponseEntity<RobotDto>> move(@PathVariable String robotId, @RequestBody MoveRequest request) {
        Direction direction = Direction.fromValue(request.getDirection());
        return Mono.just(ResponseEntity.ok(toDtoWithLinks(robotRegistry.move(robotId, direction))));
    }

    @PatchMapping("/{robotId}/state")
    public Mono<ResponseEntity<RobotDto>> updateState(@PathVariable String robotId,
            @RequestBody StatePatchRequest request) {
        StatePatch patch = new StatePatch(request.getEnergy(), toPosition(request.getPosition()));
        return Mono.just(ResponseEntity.ok(toDtoWithLinks(robotRegistry.patchState(robotId, patch))));
    }

    @PostMapping("/{robotId}/pickup/{itemId}")
    public Mono<ResponseEntity<RobotDto>> pickup(@PathVariable String robotId, @PathVariable String itemId) {
        return Mono.just(ResponseEntity.ok(toDtoWithLinks(robotRegistry.pickup(robotId, itemId))));
    }

    @PostMapping("/{robotId}/putdown/{itemId}")
    public Mono<ResponseEntity<RobotDto>> putdown(@PathVariable String robotId, @PathVariable String itemId) {
        return Mono.just(ResponseEntity.ok(toDtoWithLinks(robotRegistry.putdown(robotId, itemId))));
    }

    @PostMapping("/{robotId}/attack/{targetId}")
    public Mono<ResponseEntity<AttackResponse>> attack(@PathVariable String robotId,
            @PathVariable String targetId) {
        AttackResult result = robotRegistry.attack(robotId, targetId);
        AttackResponse response = AttackResponse.builder()
                .message("attack executed")
                .attacker(toDto(result.getAttacker()))
                .target(toDto(result.getTarget()))
                .damage(result.getDamage())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/{robotId}/actions")
    public Mono<ResponseEntity<ActionsPageResponse>> listActions(@PathVariable String robotId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer size) {
        int pageSize = size != null ? size : properties.getActions().getDefaultPageSize();
        int maxPageSize = properties.getActions().getMaxPageSize();
        if (pageSize > maxPageSize) {
            throw RobotOperationException.invalidArgument("size must be <= " + maxPageSize + ", got: " + pageSize);
        }

        ActionPage actionPage = robotRegistry.listActions(robotId, page, pageSize);
        List<ActionDto> items = actionPage.getItems().stream()
                .map(RobotsController::toActionDto)
                .toList();
        ActionsPageResponse response = ActionsPageResponse.builder()
                .page(actionPage.getPage())
                .size(actionPage.getSize())
                .totalActions(actionPage.getTotalActions())
                .totalPages(actionPage.getTotalPages())
                .hasMore(actionPage.hasNext())
                .links(RobotLinks.actions(robotId, actionPage))
                .items(items)
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    private RobotDto toDtoWithLinks(RobotSnapshot snapshot) {
        RobotDto dto = toDto(snapshot);
        dto.setLinks(RobotLinks.status(snapshot.getId(), properties.getActions().getDefaultPageSize()));
        return dto;
    }

    private static RobotDto toDto(RobotSnapshot snapshot) {
        return RobotDto.builder()
                .id(snapshot.getId())
                .position(new PositionDto(snapshot.getPosition().x(), snapshot.getPosition().y()))
                .energy(snapshot.getEnergy())
                .inventory(snapshot.getInventory())
                .incapacitated(snapshot.isIncapacitated())
                .build();
    }

    private static ActionDto toActionDto(ActionRecord record) {
        return ActionDto.builder()
                .sequence(record.getSequence())
                .timestamp(record.getTimestamp().toString())
                .type(record.getKind().getValue())
                .details(record.getDetails())
                .build();
    }

    private static Position toPosition(PositionDto dto) {
        if (dto == null) {
            return null;
        }
        if (dto.getX() == null || dto.getY() == null) {
            throw RobotOperationException.invalidArgument("position requires both x and y");
        }
        return new Position(dto.getX(), dto.getY());
    }
}
