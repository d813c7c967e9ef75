package com.mimecast.mailroom.rules;

import org.junit.jupiter.api.Test;

import javax.naming.ConfigurationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleRegistryTest {

    private final RuleRegistry registry = RuleRegistry.withBuiltins();

    @Test
    void builtinsAreRegistered() {
        for (String name : List.of("emergency", "loop", "administrivia", "implicit-dest", "max-recipients",
                "max-size", "no-subject", "suspicious-header", "header-match", "spam-check", "banned-address",
                "member-moderation", "nonmember-moderation", "any", "truth")) {
            assertTrue(registry.get(name).isPresent(), "missing rule " + name);
        }
        assertEquals(15, registry.getRules().size());
    }

    @Test
    void buildsChainFromMapsAndShorthand() throws ConfigurationException {
        Chain chain = registry.buildChain("custom", List.of(
                Map.of("rule", "loop", "action", "discard"),
                Map.of("rule", "administrivia"),
                "truth:accept-immediately"));

        assertEquals(3, chain.getLinks().size());
        assertEquals(ChainAction.DISCARD, chain.getLinks().get(0).getAction());
        assertEquals(ChainAction.DEFER, chain.getLinks().get(1).getAction());
        assertEquals("truth", chain.getLinks().get(2).getRule().getName());
        assertEquals(ChainAction.ACCEPT, chain.getLinks().get(2).getAction());
    }

    @Test
    void unknownRuleOrActionIsConfigurationError() {
        assertThrows(ConfigurationException.class, () -> registry.buildChain("bad", List.of("nope:hold")));
        assertThrows(ConfigurationException.class, () -> registry.buildChain("bad", List.of("loop:explode")));
        assertThrows(ConfigurationException.class, () -> registry.buildChain("bad", List.of("loop")));
        assertThrows(ConfigurationException.class, () -> registry.buildChain("bad", "loop:hold"));
    }

    @Test
    void buildChainsSkipsInvalidAndAddsDefaults() {
        Map<String, Object> config = new HashMap<>();
        config.put("good", List.of("truth:accept"));
        config.put("bad", List.of("nope:hold"));

        Map<String, Chain> chains = registry.buildChains(config);

        assertTrue(chains.containsKey("good"));
        assertFalse(chains.containsKey("bad"));
        assertTrue(chains.containsKey(RuleRegistry.DEFAULT_POSTING_CHAIN_NAME));
        assertTrue(chains.containsKey(RuleRegistry.DEFAULT_OWNER_CHAIN_NAME));
    }

    @Test
    void defaultPostingChainOrder() {
        Chain chain = registry.buildChains(Map.of()).get(RuleRegistry.DEFAULT_POSTING_CHAIN_NAME);

        assertEquals("emergency", chain.getLinks().get(0).getRule().getName());
        assertEquals("loop", chain.getLinks().get(1).getRule().getName());
        ChainLink last = chain.getLinks().get(chain.getLinks().size() - 1);
        assertEquals("truth", last.getRule().getName());
        assertEquals(ChainAction.ACCEPT, last.getAction());
    }

    @Test
    void defaultOwnerChainAcceptsEverything() {
        Chain chain = registry.buildChains(Map.of()).get(RuleRegistry.DEFAULT_OWNER_CHAIN_NAME);

        assertEquals(1, chain.getLinks().size());
        assertEquals("truth", chain.getLinks().get(0).getRule().getName());
        assertEquals(ChainAction.ACCEPT, chain.getLinks().get(0).getAction());
    }

    @Test
    void configuredDefaultOverridesBuiltin() {
        Map<String, Chain> chains = registry.buildChains(Map.of(RuleRegistry.DEFAULT_POSTING_CHAIN_NAME, List.of("truth:accept")));

        assertEquals(1, chains.get(RuleRegistry.DEFAULT_POSTING_CHAIN_NAME).getLinks().size());
    }

    @Test
    void actionParsing() {
        assertEquals(ChainAction.DEFER, ChainAction.fromString("defer-to-next"));
        assertEquals(ChainAction.ACCEPT, ChainAction.fromString("Accept"));
        assertEquals(ChainAction.MODERATION, ChainAction.fromString("moderation"));
        assertThrows(IllegalArgumentException.class, () -> ChainAction.fromString("bounce"));
        assertThrows(IllegalArgumentException.class, () -> ChainAction.fromString(null));
    }
}
