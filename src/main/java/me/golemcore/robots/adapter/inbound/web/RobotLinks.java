package me.golemcore.robots.adapter.inbound.web;

import me.golemcore.robots.adapter.inbound.web.dto.LinkDto;
import me.golemcore.robots.domain.model.ActionPage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the {@code _links} sections of robot responses.
 */
public final class RobotLinks {

    private static final String BASE = "/robots/";

    private RobotLinks() {
    }

    public static Map<String, LinkDto> status(String robotId, int defaultPageSize) {
        String base = BASE + robotId;
        Map<String, LinkDto> links = new LinkedHashMap<>();
        links.put("self", link(base + "/status", null, null));
        links.put("actions", link(base + "/actions?page=1&size=" + defaultPageSize, null, null));
        links.put("move", link(base + "/move", "POST", null));
        links.put("pickup", link(base + "/pickup/{itemId}", "POST", true));
        links.put("putdown", link(base + "/putdown/{itemId}", "POST", true));
        links.put("attack", link(base + "/attack/{targetId}", "POST", true));
        links.put("update_state", link(base + "/state", "PATCH", null));
        return links;
    }

    public static Map<String, LinkDto> actions(String robotId, ActionPage page) {
        Map<String, LinkDto> links = new LinkedHashMap<>();
        links.put("self", link(actionsHref(robotId, page.getPage(), page.getSize()), null, null));
        if (page.hasNext()) {
            links.put("next", link(actionsHref(robotId, page.getPage() + 1, page.getSize()), null, null));
        }
        if (page.hasPrevious()) {
            links.put("prev", link(actionsHref(robotId, page.getPage() - 1, page.getSize()), null, null));
        }
        return links;
    }

    private static String actionsHref(String robotId, int page, int size) {
        return BASE + robotId + "/actions?page=" + page + "&size=" + size;
    }

    private static LinkDto link(String href, String method, Boolean templated) {
        return LinkDto.builder()
                .href(href)
                .method(method)
                .templated(templated)
                .build();
    }
}
