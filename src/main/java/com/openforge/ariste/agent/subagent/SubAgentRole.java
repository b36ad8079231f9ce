package com.openforge.ariste.agent.subagent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The closed set of subagent roles.
 *
 * Each role carries a human-readable description, an optional fixed system
 * prompt, and whether it may be given tools at all. A role with
 * {@code usesTools == false} never gets tool definitions, whatever the caller asks.
 */
public enum SubAgentRole {

    GENERAL_PURPOSE("general-purpose",
            "General-purpose agent for complex tasks",
            null,
            true),

    EXPLORE("explore",
            "Fast agent for exploring codebases",
            "You are a codebase exploration agent. Your goal is to quickly find files, "
                    + "search code, and answer questions about the codebase structure. "
                    + "Be thorough but efficient in your exploration.",
            true),

    PLAN("plan",
            "Software architect agent for designing implementation plans",
            "You are a software architect agent. Your goal is to design implementation plans "
                    + "by exploring the codebase and providing step-by-step plans. Focus on: "
                    + "1) Understanding existing patterns, 2) Identifying critical files, "
                    + "3) Considering architectural trade-offs.",
            false),

    CODE_REVIEW("code-review",
            "Code reviewer agent for analyzing code quality",
            "You are a code reviewer agent. Your goal is to analyze code quality, "
                    + "identify potential bugs, suggest improvements, and ensure best practices. "
                    + "Focus on: correctness, performance, security, and maintainability.",
            true),

    TEST_RUNNER("test-runner",
            "Test runner agent for testing and validation",
            "You are a test runner agent. Your goal is to design and execute tests, "
                    + "validate functionality, and report issues. Be thorough in testing edge cases "
                    + "and providing actionable feedback.",
            true);

    public static final SubAgentRole DEFAULT = GENERAL_PURPOSE;

    private final String wireName;
    private final String description;
    private final String systemPrompt;
    private final boolean usesTools;

    SubAgentRole(String wireName, String description, String systemPrompt, boolean usesTools) {
        this.wireName     = wireName;
        this.description  = description;
        this.systemPrompt = systemPrompt;
        this.usesTools    = usesTools;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String description() {
        return description;
    }

    public Optional<String> systemPrompt() {
        return Optional.ofNullable(systemPrompt);
    }

    public boolean usesTools() {
        return usesTools;
    }

    /** Accepts the wire name, case-insensitively. */
    public static Optional<SubAgentRole> find(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(role -> role.wireName.equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    @JsonCreator
    public static SubAgentRole fromName(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown subagent type '%s'. Valid types are: %s"
                        .formatted(name, String.join(", ", wireNames()))));
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(SubAgentRole::wireName).toList();
    }
}
