package net.lavalauncher.launcher.manifests;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record Rule(
        RuleAction action,
        Map<String, Boolean> features,
        @Nullable OsCondition os
) {
    public Rule {
        Objects.requireNonNull(action);
        features = Objects.requireNonNullElseGet(features, Map::of);
    }

    public static Rule allow(@Nullable OsCondition os) {
        return new Rule(RuleAction.ALLOWED, Map.of(), os);
    }

    public static Rule disallow(@Nullable OsCondition os) {
        return new Rule(RuleAction.DISALLOWED, Map.of(), os);
    }

    /**
     * Whether the OS and feature predicates of this rule match, regardless of its action.
     */
    public boolean predicateMatches(RuleContext context) {
        if (os != null && !os.platformMatches(context)) {
            return false;
        }
        for (var feature : features.entrySet()) {
            if (context.isFeatureEnabled(feature.getKey()) != feature.getValue()) {
                return false;
            }
        }
        return true;
    }

    /**
     * An allow rule is satisfied when its predicate matches, a disallow rule when it doesn't.
     */
    public boolean isSatisfied(RuleContext context) {
        return action.isAllowed() == predicateMatches(context);
    }

    /**
     * Argument rules: every rule has to be satisfied. An empty list always matches.
     */
    public static boolean allSatisfied(List<Rule> rules, RuleContext context) {
        for (var rule : rules) {
            if (!rule.isSatisfied(context)) {
                return false;
            }
        }
        return true;
    }
}
