package me.golemcore.robots.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code PATCH /robots/{id}/state}. Absent fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatePatchRequest {
    private Integer energy;
    private PositionDto position;
}
