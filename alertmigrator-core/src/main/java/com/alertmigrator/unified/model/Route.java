package com.alertmigrator.unified.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** A node of the notification policy tree. {@code repeatInterval} uses Prometheus duration notation. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Route(
        @JsonProperty("receiver") String receiver,
        @JsonProperty("group_by") List<String> groupBy,
        @JsonProperty("object_matchers") List<ObjectMatcher> objectMatchers,
        @JsonProperty("continue") boolean continueMatching,
        @JsonProperty("repeat_interval") String repeatInterval,
        @JsonProperty("routes") List<Route> routes) {

    public Route {
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        objectMatchers = objectMatchers == null ? List.of() : List.copyOf(objectMatchers);
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    public Route withRoutes(List<Route> children) {
        return new Route(receiver, groupBy, objectMatchers, continueMatching, repeatInterval, children);
    }
}
