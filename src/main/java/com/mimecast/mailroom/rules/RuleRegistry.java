package com.mimecast.mailroom.rules;

import com.mimecast.mailroom.rules.builtin.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of named rules.
 *
 * <p>Built once at startup and handed to whoever builds chains; there is no runtime discovery.
 */
public class RuleRegistry {
    private static final Logger log = LogManager.getLogger(RuleRegistry.class);

    public static final String DEFAULT_POSTING_CHAIN_NAME = "default-posting-chain";
    public static final String DEFAULT_OWNER_CHAIN_NAME = "default-owner-chain";

    /**
     * Default posting chain definition, used when no chain of that name is configured.
     */
    private static final List<String[]> DEFAULT_POSTING_CHAIN = List.of(
            new String[]{"emergency", "hold"},
            new String[]{"loop", "discard"},
            new String[]{"banned-address", "discard"},
            new String[]{"member-moderation", "moderation"},
            new String[]{"nonmember-moderation", "moderation"},
            new String[]{"administrivia", "hold"},
            new String[]{"implicit-dest", "hold"},
            new String[]{"max-recipients", "hold"},
            new String[]{"max-size", "hold"},
            new String[]{"no-subject", "hold"},
            new String[]{"suspicious-header", "hold"},
            new String[]{"header-match", "moderation"},
            new String[]{"truth", "accept"}
    );

    /**
     * Owner messages skip moderation.
     */
    private static final List<String[]> DEFAULT_OWNER_CHAIN = Collections.singletonList(
            new String[]{"truth", "accept"}
    );

    private final Map<String, Rule> rules = new LinkedHashMap<>();

    /**
     * Builds a registry holding every builtin rule.
     *
     * @return RuleRegistry instance.
     */
    public static RuleRegistry withBuiltins() {
        return new RuleRegistry()
                .register(new EmergencyRule())
                .register(new LoopRule())
                .register(new AdministriviaRule())
                .register(new ImplicitDestinationRule())
                .register(new MaxRecipientsRule())
                .register(new MaxSizeRule())
                .register(new NoSubjectRule())
                .register(new SuspiciousHeaderRule())
                .register(new HeaderMatchRule())
                .register(new SpamCheckRule())
                .register(new BannedAddressRule())
                .register(new MemberModerationRule())
                .register(new NonmemberModerationRule())
                .register(new AnyRule())
                .register(new TruthRule());
    }

    /**
     * Registers a rule, replacing any rule of the same name.
     *
     * @param rule Rule instance.
     * @return Self.
     */
    public RuleRegistry register(Rule rule) {
        rules.put(rule.getName(), rule);
        return this;
    }

    public Optional<Rule> get(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public Map<String, Rule> getRules() {
        return Collections.unmodifiableMap(rules);
    }

    /**
     * Builds all configured chains plus the default posting and owner chains when not configured.
     *
     * @param config Map of chain name to link list.
     * @return Map of chain name to Chain.
     */
    public Map<String, Chain> buildChains(Map<String, Object> config) {
        Map<String, Chain> chains = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : config.entrySet()) {
            try {
                chains.put(entry.getKey(), buildChain(entry.getKey(), entry.getValue()));
            } catch (ConfigurationException e) {
                log.error("Invalid chain definition skipped, lists using it are disabled: {}", e.getExplanation());
            }
        }
        chains.putIfAbsent(DEFAULT_POSTING_CHAIN_NAME, defaultChain(DEFAULT_POSTING_CHAIN_NAME, DEFAULT_POSTING_CHAIN));
        chains.putIfAbsent(DEFAULT_OWNER_CHAIN_NAME, defaultChain(DEFAULT_OWNER_CHAIN_NAME, DEFAULT_OWNER_CHAIN));
        return chains;
    }

    private Chain defaultChain(String name, List<String[]> definition) {
        List<ChainLink> links = new ArrayList<>();
        for (String[] link : definition) {
            if (rules.containsKey(link[0])) {
                links.add(new ChainLink(rules.get(link[0]), ChainAction.fromString(link[1])));
            } else {
                log.warn("Default chain {} rule {} not registered", name, link[0]);
            }
        }
        return new Chain(name, links);
    }

    /**
     * Builds one chain.
     * <p>Each link is either a map {@code {rule: "name", action: "hold"}} or a {@code "name:action"} string.
     *
     * @param name       Chain name.
     * @param definition Raw link list.
     * @return Chain.
     * @throws ConfigurationException Unknown rule or action, or malformed definition.
     */
    public Chain buildChain(String name, Object definition) throws ConfigurationException {
        if (!(definition instanceof List)) {
            throw new ConfigurationException("Chain " + name + " must be a list of links");
        }
        List<ChainLink> links = new ArrayList<>();
        for (Object raw : (List<?>) definition) {
            String ruleName;
            String action;
            if (raw instanceof Map) {
                Object r = ((Map<?, ?>) raw).get("rule");
                Object a = ((Map<?, ?>) raw).get("action");
                ruleName = r != null ? String.valueOf(r) : null;
                action = a != null ? String.valueOf(a) : "defer";
            } else if (raw instanceof String && ((String) raw).contains(":")) {
                String[] parts = ((String) raw).split(":", 2);
                ruleName = parts[0].trim();
                action = parts[1].trim();
            } else {
                throw new ConfigurationException("Chain " + name + " has a malformed link: " + raw);
            }

            Rule rule = ruleName != null ? rules.get(ruleName) : null;
            if (rule == null) {
                throw new ConfigurationException("Chain " + name + " references unknown rule: " + ruleName);
            }
            try {
                links.add(new ChainLink(rule, ChainAction.fromString(action)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Chain " + name + ": " + e.getMessage());
            }
        }
        return new Chain(name, links);
    }
}
