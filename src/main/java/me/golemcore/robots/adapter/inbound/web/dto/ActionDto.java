package me.golemcore.robots.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionDto {
    private long sequence;
    private String timestamp;
    private String type;
    private Map<String, Object> details;
}
