/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.service.lifecycle;

import com.mailrules.api.exceptions.RuleLoadException;
import com.mailrules.cache.CachingLabelResolver;
import com.mailrules.cache.LabelCacheConfig;
import com.mailrules.cache.LabelDirectory;
import com.mailrules.compiler.RuleLoader;
import com.mailrules.infra.management.RuleSetManager;
import com.mailrules.infra.metrics.MetricsRegistry;
import com.mailrules.runtime.actions.ActionPlanner;
import com.mailrules.runtime.evaluation.RuleEvaluator;
import com.mailrules.service.config.ProcessingConfig;
import com.mailrules.service.mailbox.MailboxMutator;
import com.mailrules.service.processing.RuleProcessingService;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.time.Clock;
import java.util.logging.Logger;

/**
 * Wires the engine together and owns its lifecycle.
 *
 * <p>{@link #start} loads the rules file (failing fast if it cannot be read), starts
 * watching it for changes and builds the processing service on top of the supplied
 * mailbox collaborators. {@link #close} stops the file watcher.
 */
public final class MailRulesRuntime implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(MailRulesRuntime.class.getName());

    private final RuleSetManager ruleSetManager;
    private final CachingLabelResolver labelResolver;
    private final RuleProcessingService processingService;

    private MailRulesRuntime(RuleSetManager ruleSetManager, CachingLabelResolver labelResolver,
                             RuleProcessingService processingService) {
        this.ruleSetManager = ruleSetManager;
        this.labelResolver = labelResolver;
        this.processingService = processingService;
    }

    public static MailRulesRuntime start(ProcessingConfig config, LabelCacheConfig cacheConfig,
                                         LabelDirectory labelDirectory, MailboxMutator mutator,
                                         Tracer tracer, MetricsRegistry metrics)
            throws RuleLoadException, IOException {
        logger.info("Starting mail rules engine: " + config);

        RuleSetManager ruleSetManager = new RuleSetManager(config.getRulesFile(), tracer,
                new RuleLoader(tracer), metrics, config.getReloadInterval());
        CachingLabelResolver labelResolver = new CachingLabelResolver(labelDirectory, cacheConfig, metrics);
        RuleProcessingService service = new RuleProcessingService(
                ruleSetManager,
                new RuleEvaluator(Clock.systemUTC(), metrics),
                new ActionPlanner(labelResolver, metrics),
                mutator,
                config,
                tracer,
                metrics);

        ruleSetManager.start();
        logger.info("Mail rules engine ready with " + ruleSetManager.rules().size() + " rules");
        return new MailRulesRuntime(ruleSetManager, labelResolver, service);
    }

    public RuleProcessingService getProcessingService() {
        return processingService;
    }

    public RuleSetManager getRuleSetManager() {
        return ruleSetManager;
    }

    public CachingLabelResolver getLabelResolver() {
        return labelResolver;
    }

    @Override
    public void close() {
        logger.info("Shutting down mail rules engine");
        ruleSetManager.shutdown();
        logger.info(labelResolver.getMetrics().format());
    }
}
