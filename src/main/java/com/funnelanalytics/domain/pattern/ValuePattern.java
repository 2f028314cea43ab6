package com.funnelanalytics.domain.pattern;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Step value compiled for matching. {@code *} stands for any character sequence
 * (glob style, not regex); a value without it matches only itself.
 */
@Getter
@EqualsAndHashCode(of = "raw")
public final class ValuePattern {

    public static final char WILDCARD = '*';

    private final String raw;
    private final boolean wildcard;

    @Getter(lombok.AccessLevel.NONE)
    private final String[] literals;

    private ValuePattern(String raw) {
        this.raw = raw;
        this.wildcard = raw.indexOf(WILDCARD) >= 0;
        this.literals = raw.split("\\*", -1);
    }

    public static ValuePattern of(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Step value must not be null");
        }
        return new ValuePattern(raw);
    }

    public boolean matches(String candidate) {
        if (candidate == null) {
            return false;
        }
        if (!wildcard) {
            return raw.equals(candidate);
        }

        String head = literals[0];
        String tail = literals[literals.length - 1];
        if (!candidate.startsWith(head)) {
            return false;
        }

        int position = head.length();
        for (int i = 1; i < literals.length - 1; i++) {
            int found = candidate.indexOf(literals[i], position);
            if (found < 0) {
                return false;
            }
            position = found + literals[i].length();
        }

        // tail must not overlap what the middle literals consumed
        return candidate.length() - tail.length() >= position && candidate.endsWith(tail);
    }

    public String sqlOperator() {
        return wildcard ? "LIKE" : "=";
    }

    public String sqlLiteral() {
        return raw.replace(WILDCARD, '%');
    }

    @Override
    public String toString() {
        return raw;
    }
}
