/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.mailrules.api.LabelResolver;
import com.mailrules.api.exceptions.LabelDirectoryException;
import com.mailrules.infra.metrics.Counter;
import com.mailrules.infra.metrics.MetricNames;
import com.mailrules.infra.metrics.MetricsRegistry;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link LabelResolver} backed by a Caffeine cache in front of a {@link LabelDirectory}.
 *
 * <h2>Resolution</h2>
 * <ol>
 *   <li>System labels (INBOX, UNREAD, ...) resolve to themselves without a lookup.</li>
 *   <li>Cached names, positive or negative, are answered from the cache.</li>
 *   <li>Otherwise the directory is listed once and every returned label is cached.
 *   A name still missing afterwards is cached as absent.</li>
 * </ol>
 *
 * <p>Names match case-insensitively. Directory failures resolve to empty and are not
 * cached, so the next call retries.
 *
 * <h2>Thread Safety</h2>
 * <p>Directory listings are serialized by a lock and the cache is checked again after
 * acquiring it, so concurrent misses for one name produce a single listing.
 */
public final class CachingLabelResolver implements LabelResolver {

    private static final Logger logger = Logger.getLogger(CachingLabelResolver.class.getName());

    public static final List<String> SYSTEM_LABELS = List.of(
            "INBOX", "UNREAD", "IMPORTANT", "SENT", "DRAFT", "TRASH", "SPAM", "STARRED",
            "CATEGORY_PERSONAL", "CATEGORY_SOCIAL", "CATEGORY_PROMOTIONS",
            "CATEGORY_UPDATES", "CATEGORY_FORUMS");

    private static final Map<String, String> SYSTEM_BY_KEY = systemLabelTable();

    private final LabelDirectory directory;
    private final Cache<String, Optional<String>> cache;
    private final boolean statsEnabled;
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicLong directoryLookups = new AtomicLong();
    private final Counter lookupCounter;

    public CachingLabelResolver(LabelDirectory directory) {
        this(directory, LabelCacheConfig.fromEnvironment(), MetricsRegistry.getInstance());
    }

    public CachingLabelResolver(LabelDirectory directory, LabelCacheConfig config, MetricsRegistry metrics) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        this.cache = config.toCaffeineBuilder().build();
        this.statsEnabled = config.isRecordStats();
        this.lookupCounter = metrics.counter(MetricNames.LABEL_DIRECTORY_LOOKUPS);
        logger.info("CachingLabelResolver initialized: " + config);
    }

    private static Map<String, String> systemLabelTable() {
        Map<String, String> table = new HashMap<>();
        for (String label : SYSTEM_LABELS) {
            table.put(key(label), label);
        }
        return Collections.unmodifiableMap(table);
    }

    @Override
    public Optional<String> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String key = key(name);

        String system = SYSTEM_BY_KEY.get(key);
        if (system != null) {
            return Optional.of(system);
        }

        Optional<String> cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        refreshLock.lock();
        try {
            cached = cache.getIfPresent(key);
            if (cached != null) {
                return cached;
            }
            return lookup(name.trim(), key);
        } finally {
            refreshLock.unlock();
        }
    }

    private Optional<String> lookup(String name, String key) {
        Map<String, String> labels;
        try {
            labels = directory.listLabels();
        } catch (LabelDirectoryException e) {
            logger.log(Level.WARNING, "Failed to list labels while resolving '" + name + "'", e);
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Label directory failed unexpectedly while resolving '" + name + "'", e);
            return Optional.empty();
        } finally {
            directoryLookups.incrementAndGet();
            lookupCounter.increment();
        }

        Optional<String> found = Optional.empty();
        if (labels != null) {
            for (Map.Entry<String, String> entry : labels.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                String labelKey = key(entry.getKey());
                cache.put(labelKey, Optional.of(entry.getValue()));
                if (labelKey.equals(key)) {
                    found = Optional.of(entry.getValue());
                }
            }
        }

        if (found.isEmpty()) {
            logger.warning("Label '" + name + "' not found among user labels");
            cache.put(key, Optional.empty());
        } else {
            logger.fine("Resolved label '" + name + "' to " + found.get());
        }
        return found;
    }

    /** Drops every cached name. System labels are unaffected. */
    public void invalidateAll() {
        cache.invalidateAll();
        logger.info("Label cache cleared");
    }

    public LabelCacheMetrics getMetrics() {
        CacheStats stats = statsEnabled ? cache.stats() : CacheStats.empty();
        return new LabelCacheMetrics(
                stats.hitCount(),
                stats.missCount(),
                cache.estimatedSize(),
                directoryLookups.get());
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public record LabelCacheMetrics(long hits, long misses, long size, long directoryLookups) {
        public String format() {
            return String.format("Label cache: hits=%d, misses=%d, size=%d, directoryLookups=%d",
                    hits, misses, size, directoryLookups);
        }
    }
}
