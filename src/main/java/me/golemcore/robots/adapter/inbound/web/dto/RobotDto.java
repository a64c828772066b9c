package me.golemcore.robots.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RobotDto {
    private String id;
    private PositionDto position;
    private int energy;
    private List<String> inventory;
    private boolean incapacitated;

    @JsonProperty("_links")
    private Map<String, LinkDto> links;
}
