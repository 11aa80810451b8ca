/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot;

import com.goodnamebot.config.BotConfig;
import com.goodnamebot.config.ConfigLoader;
import com.goodnamebot.config.ConfigurationException;
import com.goodnamebot.server.PollLoop;
import com.goodnamebot.server.ReconnectPolicy;
import com.goodnamebot.session.BotSession;
import com.goodnamebot.session.BotSessionException;
import com.goodnamebot.session.SlackRtmTransport;
import com.goodnamebot.store.GoodNameStore;
import com.goodnamebot.store.impl.FileGoodNameStore;
import com.goodnamebot.trigger.TriggerRegistry;
import com.goodnamebot.utils.BotLogger;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Runs the good name alert bot against a Slack workspace.
 *
 * <pre>
 * java -jar good-name-bot.jar [-c|--config config.json]
 * </pre>
 */
public class GoodNameBotApplication {

    static final String DEFAULT_CONFIG_PATH = "config.json";

    public static void main(String[] args) {
        Path configPath;
        try {
            configPath = parseConfigPath(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: GoodNameBotApplication [-c|--config <path>]");
            System.exit(2);
            return;
        }

        BotLogger logger = BotLogger.stdout(true);
        try {
            ConfigLoader loader = new ConfigLoader();
            Properties properties = loader.loadProperties(ConfigLoader.EXTERNAL_OVERRIDES);
            BotConfig botConfig = loader.loadBotConfig(configPath);

            logger = BotLogger.stdout(Boolean.parseBoolean(properties.getProperty("log.debug", "true")));
            loader.getMessages().forEach(logger::info);

            run(botConfig, properties, logger);
        } catch (ConfigurationException e) {
            logger.error("Configuration error: " + e.getMessage());
            System.exit(1);
        } catch (BotSessionException e) {
            logger.error("Fatal session error: " + e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Interrupted, shutting down");
        }
    }

    /**
     * Wires the components, connects and polls until interrupted.
     *
     * @throws ConfigurationException if a runtime setting is malformed
     */
    static void run(BotConfig botConfig, Properties properties, BotLogger logger) throws InterruptedException {
        ReconnectPolicy reconnectPolicy = ReconnectPolicy.fromProperties(properties);
        long pollIntervalMs = ConfigLoader.longProperty(properties, "poll.interval.ms", 1000L);
        if (pollIntervalMs < 0) {
            throw new ConfigurationException("Property poll.interval.ms must be >= 0, got: " + pollIntervalMs);
        }

        GoodNameStore store = new FileGoodNameStore(
                Paths.get(properties.getProperty("store.path", "good_names.json")),
                properties.getProperty("store.season", "11"),
                logger);
        store.connect();
        if (!store.isConnected()) {
            logger.warn("Good name store unavailable; alerts and additions will be skipped");
        }

        BotSession session = new BotSession(new SlackRtmTransport(botConfig.getToken(), properties, logger), logger);
        TriggerRegistry registry = new TriggerRegistry(botConfig.getActions(),
                TriggerRegistry.defaultActions(store, session, logger), logger);

        try {
            session.connect();
            session.performDebugCalls(botConfig.getDebugCalls());

            PollLoop loop = new PollLoop(session, registry, reconnectPolicy, pollIntervalMs, logger);
            loop.run();
        } finally {
            session.close();
        }
    }

    /**
     * Reads {@code -c PATH} / {@code --config PATH}; defaults to {@code config.json}.
     *
     * @throws IllegalArgumentException on unknown arguments or a missing path
     */
    static Path parseConfigPath(String[] args) {
        String path = DEFAULT_CONFIG_PATH;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("-c".equals(arg) || "--config".equals(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + arg);
                }
                path = args[++i];
            } else if (arg.startsWith("--config=")) {
                path = arg.substring("--config=".length());
            } else {
                throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        return Paths.get(path);
    }
}
