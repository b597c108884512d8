package com.speccontext.model;

import java.util.List;

/**
 * The role a scenario method plays, decided by its name prefix.
 *
 * Roles are tested in declaration order and the first matching prefix wins.
 */
public enum MethodRole {

    /** Runs once before any example. */
    ARRANGE("before_", "given_", "arrange_"),

    /** Runs before the conditions of every example, after its pre-actions. */
    ACT("act_", "do_"),

    /** Runs once after every example. */
    TEARDOWN("after_", "finally_"),

    /** Declares one example: assigns slots and registers named conditions. */
    EXAMPLE("when_", "it_", "should_", "then_", "assert_");

    /** Separates words in scenario and method names; rendered as a space. */
    public static final String WORD_SEPARATOR = "_";

    private final List<String> prefixes;

    MethodRole(String... prefixes) {
        this.prefixes = List.of(prefixes);
    }

    public List<String> getPrefixes() {
        return prefixes;
    }

    public boolean matches(String methodName) {
        return prefixes.stream().anyMatch(methodName::startsWith);
    }

    /**
     * Returns the role for a method name, or {@code null} when no prefix matches or the
     * name does not contain the word separator.
     */
    public static MethodRole of(String methodName) {
        if (!methodName.contains(WORD_SEPARATOR)) return null;
        for (MethodRole role : values()) {
            if (role.matches(methodName)) return role;
        }
        return null;
    }

    /** {@code when_adding_numbers} becomes {@code when adding numbers}. */
    public static String normalize(String text) {
        return text.replace(WORD_SEPARATOR, " ");
    }
}
