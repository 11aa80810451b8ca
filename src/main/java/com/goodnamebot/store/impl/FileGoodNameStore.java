/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.store.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goodnamebot.store.GoodName;
import com.goodnamebot.store.GoodNameDocument;
import com.goodnamebot.store.GoodNameStore;
import com.goodnamebot.utils.BotLogger;
import com.goodnamebot.utils.JacksonConfig;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Good name store backed by a single JSON document on the local file system.
 *
 * <p>The whole document is read on {@link #connect()} and kept in memory. Each
 * new good name is written out with the full document (temp file + atomic
 * move) before it becomes visible in memory, so a failed write never leaves
 * an unpersisted name behind.
 *
 * <p>Not thread-safe; the bot drives it from its single poll loop thread.
 */
public class FileGoodNameStore implements GoodNameStore {

    private final Path documentPath;
    private final String defaultSeason;
    private final BotLogger logger;
    private final ObjectMapper objectMapper;
    private final Random random;
    private final Clock clock;

    private GoodNameDocument document;
    private final Map<String, GoodName> nameIndex = new HashMap<>();
    private final List<GoodName> names = new ArrayList<>();

    public FileGoodNameStore(Path documentPath, String defaultSeason, BotLogger logger) {
        this(documentPath, defaultSeason, logger, new Random(), Clock.systemUTC());
    }

    public FileGoodNameStore(Path documentPath, String defaultSeason, BotLogger logger,
                             Random random, Clock clock) {
        if (documentPath == null) {
            throw new IllegalArgumentException("Document path cannot be null");
        }
        if (defaultSeason == null || defaultSeason.isBlank()) {
            throw new IllegalArgumentException("Default season cannot be null or blank");
        }
        this.documentPath = documentPath.toAbsolutePath().normalize();
        this.defaultSeason = defaultSeason;
        this.logger = logger.named("FileGoodNameStore");
        this.objectMapper = JacksonConfig.prettyMapper();
        this.random = random;
        this.clock = clock;
    }

    @Override
    public void connect() {
        document = null;
        nameIndex.clear();
        names.clear();
        try {
            GoodNameDocument loaded = objectMapper.readValue(documentPath.toFile(), GoodNameDocument.class);
            for (GoodName goodName : loaded.getGoodNames()) {
                String key = GoodName.normalize(goodName.getGoodName());
                if (nameIndex.putIfAbsent(key, goodName) == null) {
                    names.add(goodName);
                } else {
                    logger.warn("Duplicate good name in document ignored: " + goodName.getGoodName());
                }
            }
            document = loaded;
            logger.info("Loaded " + names.size() + " good name(s) from " + documentPath);
        } catch (IOException | RuntimeException e) {
            nameIndex.clear();
            names.clear();
            logger.error("Got error when attempting to open file " + documentPath + ": " + e.getMessage());
        }
    }

    @Override
    public boolean isConnected() {
        return document != null;
    }

    @Override
    public Optional<GoodName> getRandomGoodName() {
        if (!isConnected()) {
            logger.debug("Could not get good name, resource not connected");
            return Optional.empty();
        }
        if (names.isEmpty()) {
            logger.debug("Could not get good name, store is empty");
            return Optional.empty();
        }
        return Optional.of(names.get(random.nextInt(names.size())));
    }

    @Override
    public Optional<String> addGoodName(String goodName, String addedBy) {
        if (!isConnected()) {
            logger.debug("Could not add good name, resource not connected");
            return Optional.empty();
        }

        String normalized = GoodName.normalize(goodName);
        if (normalized.isEmpty()) {
            logger.debug("Ignoring blank good name from " + addedBy);
            return Optional.empty();
        }
        if (nameIndex.containsKey(normalized)) {
            logger.debug(() -> "Good name already recorded: " + normalized);
            return Optional.empty();
        }

        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        GoodName created = GoodName.create(normalized, addedBy, defaultSeason, now);
        GoodNameDocument updated = document.withAppended(created);

        try {
            writeDocument(updated);
        } catch (IOException | RuntimeException e) {
            document = null;
            logger.error("Got error when attempting to dump current good names: " + e.getMessage());
            return Optional.empty();
        }

        document = updated;
        nameIndex.put(normalized, created);
        names.add(created);
        logger.info("Recorded good name '" + normalized + "' added by " + addedBy);
        return Optional.of(normalized);
    }

    @Override
    public int size() {
        return names.size();
    }

    public Path getDocumentPath() {
        return documentPath;
    }

    /**
     * Serializes the full document to a sibling temp file and moves it over
     * the backing file.
     */
    private void writeDocument(GoodNameDocument toWrite) throws IOException {
        Path directory = documentPath.getParent();
        Path tempFile = Files.createTempFile(directory, documentPath.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(tempFile.toFile(), toWrite);
            copyPermissions(documentPath, tempFile);
            try {
                Files.move(tempFile, documentPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported, falling back to plain replace");
                Files.move(tempFile, documentPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    /**
     * Carries the POSIX mode of the current document over to its replacement;
     * temp files start out owner-only. No-op on non-POSIX file systems.
     */
    private void copyPermissions(Path from, Path to) throws IOException {
        if (!Files.exists(from)) {
            return;
        }
        PosixFileAttributeView view = Files.getFileAttributeView(from, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        Set<PosixFilePermission> permissions = view.readAttributes().permissions();
        Files.setPosixFilePermissions(to, permissions);
    }
}
