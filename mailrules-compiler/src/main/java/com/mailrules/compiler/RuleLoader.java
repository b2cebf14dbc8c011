/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailrules.api.IRuleLoader;
import com.mailrules.api.exceptions.RuleLoadException;
import com.mailrules.api.model.Rule;
import com.mailrules.compiler.analysis.CompatibilityReport;
import com.mailrules.compiler.analysis.ConditionCompatibilityAnalyzer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads the JSON rules file into {@link Rule} values.
 *
 * <p>The root must be an array of rule objects. Structural problems (missing file,
 * invalid JSON, non-array root, non-array {@code conditions} or {@code actions}) fail the
 * whole load with a {@link RuleLoadException}. Conditions that are merely malformed or
 * incompatible are kept and reported as warnings; they evaluate to false at runtime.
 */
public class RuleLoader implements IRuleLoader {

    private static final Logger logger = Logger.getLogger(RuleLoader.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Tracer tracer;
    private final ConditionCompatibilityAnalyzer analyzer;

    public RuleLoader(Tracer tracer) {
        this(tracer, new ConditionCompatibilityAnalyzer());
    }

    public RuleLoader(Tracer tracer, ConditionCompatibilityAnalyzer analyzer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer cannot be null");
    }

    @Override
    public List<Rule> load(Path rulesPath) throws RuleLoadException {
        Span span = tracer.spanBuilder("load-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleFilePath", String.valueOf(rulesPath));

            List<Rule> rules = parse(read(rulesPath), rulesPath);
            span.setAttribute("ruleCount", rules.size());

            CompatibilityReport report = analyzer.analyze(rules);
            report.issues().forEach(issue -> logger.warning(issue.format()));
            span.setAttribute("compatibilityIssueCount", report.issues().size());

            logger.info(String.format("Loaded %d rules from %s (%d compatibility issues)",
                    rules.size(), rulesPath, report.issues().size()));
            return rules;
        } catch (RuleLoadException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private String read(Path rulesPath) {
        if (rulesPath == null || !Files.isRegularFile(rulesPath)) {
            throw new RuleLoadException("Rules file not found: " + rulesPath);
        }
        try {
            return Files.readString(rulesPath);
        } catch (IOException e) {
            throw new RuleLoadException("Could not read rules file " + rulesPath, e);
        }
    }

    List<Rule> parse(String content, Path source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new RuleLoadException("Invalid JSON in rules file " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new RuleLoadException("Rules file " + source + " must contain a JSON array of rules");
        }
        if (root.isEmpty()) {
            logger.warning("Rules file " + source + " contains no rules");
        }

        List<Rule> rules = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            rules.add(parseRule(root.get(i), i, source));
        }
        return List.copyOf(rules);
    }

    private Rule parseRule(JsonNode node, int index, Path source) {
        if (!node.isObject()) {
            throw new RuleLoadException("Rule at index " + index + " in " + source + " is not a JSON object");
        }
        requireArrayOrAbsent(node, "conditions", index, source);
        requireArrayOrAbsent(node, "actions", index, source);
        try {
            return objectMapper.treeToValue(node, RuleDefinition.class).toRule();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RuleLoadException("Rule at index " + index + " in " + source + " is invalid: " + e.getMessage(), e);
        }
    }

    private static void requireArrayOrAbsent(JsonNode rule, String property, int index, Path source) {
        JsonNode value = rule.get(property);
        if (value != null && !value.isNull() && !value.isArray()) {
            throw new RuleLoadException("Rule at index " + index + " in " + source
                    + " has a non-array '" + property + "'");
        }
    }
}
