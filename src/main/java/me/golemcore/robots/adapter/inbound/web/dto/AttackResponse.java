package me.golemcore.robots.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttackResponse {
    private String message;
    private RobotDto attacker;
    private RobotDto target;
    private int damage;
}
