package me.golemcore.robots.adapter.inbound.web.dto;

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
public class ActionsPageResponse {
    private int page;
    private int size;

    @JsonProperty("total_actions")
    private int totalActions;

    @JsonProperty("total_pages")
    private int totalPages;

    @JsonProperty("has_more")
    private boolean hasMore;

    @JsonProperty("_links")
    private Map<String, LinkDto> links;

    private List<ActionDto> items;
}
