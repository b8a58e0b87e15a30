package com.formatrouter.router;

import com.formatrouter.split.Split;

import java.util.List;
import java.util.Objects;

/**
 * A named entry of the rule table.
 */
public final class Rule {

    /**
     * The candidate splits of a matched pair, or {@code null} when the rule
     * does not match it.
     */
    @FunctionalInterface
    public interface Body {
        List<Split> route(RouteContext ctx);
    }

    private final String name;
    private final Body body;

    public Rule(String name, Body body) {
        this.name = Objects.requireNonNull(name, "name");
        this.body = Objects.requireNonNull(body, "body");
    }

    public String getName() {
        return name;
    }

    public List<Split> route(RouteContext ctx) {
        return body.route(ctx);
    }

    @Override
    public String toString() {
        return name;
    }
}
