package com.mimecast.mailroom.rules;

import java.util.Collections;
import java.util.List;

/**
 * Named, ordered sequence of chain links.
 */
public final class Chain {

    private final String name;
    private final List<ChainLink> links;

    /**
     * Constructs a new Chain.
     *
     * @param name  Chain name.
     * @param links Links in evaluation order.
     */
    public Chain(String name, List<ChainLink> links) {
        this.name = name;
        this.links = Collections.unmodifiableList(List.copyOf(links));
    }

    public String getName() {
        return name;
    }

    public List<ChainLink> getLinks() {
        return links;
    }

    @Override
    public String toString() {
        return name + links;
    }
}
