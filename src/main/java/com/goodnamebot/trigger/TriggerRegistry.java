/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.trigger;

import com.goodnamebot.config.ConfigurationException;
import com.goodnamebot.config.TriggerConfig;
import com.goodnamebot.session.InboundMessage;
import com.goodnamebot.session.MessageSender;
import com.goodnamebot.store.GoodNameStore;
import com.goodnamebot.trigger.actions.AddGoodNameAction;
import com.goodnamebot.trigger.actions.GoodNameAlertAction;
import com.goodnamebot.trigger.actions.MissingAction;
import com.goodnamebot.utils.BotLogger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered set of trigger bindings, built once from configuration.
 *
 * <p>Every binding is evaluated against every message: triggers may overlap,
 * and all of the matching ones fire, in the order they were configured. A
 * failing action is logged and does not stop the bindings after it.
 *
 * <p><b>Usage:</b>
 * <pre>
 * TriggerRegistry registry = new TriggerRegistry(config.getActions(),
 *         TriggerRegistry.defaultActions(store, session, logger), logger);
 * for (InboundMessage message : session.receiveBatch()) {
 *     registry.dispatch(message);
 * }
 * </pre>
 */
public class TriggerRegistry {

    private static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final List<TriggerBinding> bindings;
    private final BotLogger logger;

    /**
     * Compiles the configured triggers and resolves their actions.
     *
     * <p>Action names that do not resolve are bound to the
     * {@link ActionType#MISSING_ACTION} action instead of failing.
     *
     * @param triggers configured triggers, in dispatch order
     * @param actions  action implementations by type; must contain {@code MISSING_ACTION}
     * @param logger   parent logger
     * @throws ConfigurationException if a trigger is missing or is not a valid regex
     */
    public TriggerRegistry(List<TriggerConfig> triggers, Map<ActionType, TriggerAction> actions, BotLogger logger) {
        if (!actions.containsKey(ActionType.MISSING_ACTION)) {
            throw new IllegalArgumentException("Actions must include " + ActionType.MISSING_ACTION);
        }
        this.logger = logger.named("TriggerRegistry");

        List<TriggerBinding> compiled = new ArrayList<>();
        for (TriggerConfig config : triggers) {
            compiled.add(bind(config, actions));
        }
        this.bindings = List.copyOf(compiled);
        this.logger.info("Registered " + bindings.size() + " trigger(s)");
    }

    /**
     * Builds the built-in action set.
     */
    public static Map<ActionType, TriggerAction> defaultActions(GoodNameStore store, MessageSender sender,
                                                                BotLogger logger) {
        Map<ActionType, TriggerAction> actions = new EnumMap<>(ActionType.class);
        actions.put(ActionType.POST_GOOD_NAME_ALERT, new GoodNameAlertAction(store, sender, logger));
        actions.put(ActionType.ADD_GOOD_NAME, new AddGoodNameAction(store, sender, logger));
        actions.put(ActionType.MISSING_ACTION, new MissingAction(logger));
        return actions;
    }

    /**
     * Runs every action whose trigger matches the message text.
     *
     * @param message inbound message; its text is stripped of surrounding whitespace before matching
     * @return number of bindings that matched
     */
    public int dispatch(InboundMessage message) {
        if (message == null || message.text().isBlank()) {
            return 0;
        }
        String line = message.text().strip();

        int matched = 0;
        for (TriggerBinding binding : bindings) {
            Optional<TriggerMatch> match = binding.match(line);
            if (match.isEmpty()) {
                continue;
            }
            matched++;
            TriggerAction action = binding.getAction();
            try {
                logger.debug(() -> "Match: " + binding + " groups=" + match.get().groups());
                action.handle(message, match.get());
            } catch (Exception e) {
                logger.error("Action " + action.getType().getConfigName() + " failed for trigger '"
                        + binding.getTrigger() + "'", e);
            }
        }
        return matched;
    }

    /**
     * @return bindings in dispatch order
     */
    public List<TriggerBinding> getBindings() {
        return bindings;
    }

    private TriggerBinding bind(TriggerConfig config, Map<ActionType, TriggerAction> actions) {
        String trigger = config.getTrigger();
        if (trigger == null || trigger.isEmpty()) {
            throw new ConfigurationException("Trigger missing for action '" + config.getAction() + "'");
        }

        Pattern pattern;
        try {
            pattern = Pattern.compile(trigger, PATTERN_FLAGS);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid trigger '" + trigger + "': " + e.getDescription(), e);
        }

        ActionType type = ActionType.fromConfigName(config.getAction());
        TriggerAction action = actions.get(type);
        if (action == null) {
            action = actions.get(ActionType.MISSING_ACTION);
        }
        if (action.getType() == ActionType.MISSING_ACTION
                && !ActionType.MISSING_ACTION.getConfigName().equals(config.getAction())) {
            logger.warn("Action '" + config.getAction() + "' for trigger '" + trigger
                    + "' is not a known action");
        }

        TriggerBinding binding = new TriggerBinding(trigger, pattern, config.getAction(), action);
        logger.debug(() -> "Bound " + binding);
        return binding;
    }
}
