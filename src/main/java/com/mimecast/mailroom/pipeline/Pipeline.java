package com.mimecast.mailroom.pipeline;

import java.util.List;

/**
 * Named, ordered sequence of handlers.
 */
public final class Pipeline {

    private final String name;
    private final List<Handler> handlers;

    public Pipeline(String name, List<Handler> handlers) {
        this.name = name;
        this.handlers = List.copyOf(handlers);
    }

    public String getName() {
        return name;
    }

    public List<Handler> getHandlers() {
        return handlers;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('[');
        for (int i = 0; i < handlers.size(); i++) {
            sb.append(i > 0 ? ", " : "").append(handlers.get(i).getName());
        }
        return sb.append(']').toString();
    }
}
