package com.mimecast.mailroom.rules;

/**
 * One (rule, on-hit action) pair of a chain.
 */
public final class ChainLink {

    private final Rule rule;
    private final ChainAction action;

    public ChainLink(Rule rule, ChainAction action) {
        this.rule = rule;
        this.action = action;
    }

    public Rule getRule() {
        return rule;
    }

    public ChainAction getAction() {
        return action;
    }

    @Override
    public String toString() {
        return rule.getName() + "->" + action;
    }
}
