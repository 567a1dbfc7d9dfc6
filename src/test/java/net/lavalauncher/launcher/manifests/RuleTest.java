package net.lavalauncher.launcher.manifests;

import net.lavalauncher.launcher.utils.OsType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RuleTest {
    private static final RuleContext WINDOWS = new RuleContext(OsType.WINDOWS, "10.0", "amd64", Set.of());
    private static final RuleContext LINUX = new RuleContext(OsType.LINUX, "6.1.0", "amd64", Set.of());

    @Test
    void testEmptyRulesAlwaysMatch() {
        assertThat(Rule.allSatisfied(List.of(), WINDOWS)).isTrue();
    }

    @Test
    void testAllowOtherOsExcludes() {
        var rules = List.of(Rule.allow(new OsCondition("linux", null, null)));
        assertThat(Rule.allSatisfied(rules, WINDOWS)).isFalse();
        assertThat(Rule.allSatisfied(rules, LINUX)).isTrue();
    }

    @Test
    void testDisallowOtherOsIncludes() {
        var rules = List.of(Rule.disallow(new OsCondition("linux", null, null)));
        assertThat(Rule.allSatisfied(rules, WINDOWS)).isTrue();
        assertThat(Rule.allSatisfied(rules, LINUX)).isFalse();
    }

    @Test
    void testOsVersionAndArchAreRegularExpressions() {
        var windows10 = new OsCondition("windows", "^10\\.", null);
        assertThat(windows10.platformMatches(WINDOWS)).isTrue();
        assertThat(windows10.platformMatches(new RuleContext(OsType.WINDOWS, "6.1", "amd64", Set.of()))).isFalse();

        var x86 = new OsCondition(null, null, "x86");
        assertThat(x86.platformMatches(new RuleContext(OsType.LINUX, "", "x86", Set.of()))).isTrue();
        assertThat(x86.platformMatches(LINUX)).isFalse();
    }

    @Test
    void testFeatureRules() {
        var rule = new Rule(RuleAction.ALLOWED, Map.of("is_demo_user", true), null);
        assertThat(rule.isSatisfied(WINDOWS)).isFalse();
        assertThat(rule.isSatisfied(WINDOWS.withFeatures(Set.of("is_demo_user")))).isTrue();
    }

    @Test
    void testFeatureExpectedToBeDisabled() {
        var rule = new Rule(RuleAction.ALLOWED, Map.of("has_custom_resolution", false), null);
        assertThat(rule.isSatisfied(WINDOWS)).isTrue();
        assertThat(rule.isSatisfied(WINDOWS.withFeatures(Set.of("has_custom_resolution")))).isFalse();
    }

    @Test
    void testLibraryRulesAreFoldedInOrder() {
        // Typical "everything but osx" library
        var library = new MinecraftLibrary("org.lwjgl:lwjgl:2.9.0", null, List.of(
                Rule.allow(null),
                Rule.disallow(new OsCondition("osx", null, null))
        ), null, null);

        assertThat(library.rulesMatch(WINDOWS)).isTrue();
        assertThat(library.rulesMatch(RuleContext.of(OsType.MAC))).isFalse();
    }

    @Test
    void testLibraryOnlyForOneOs() {
        var library = new MinecraftLibrary("ca.weblite:java-objc-bridge:1.1", null, List.of(
                Rule.allow(new OsCondition("osx", null, null))
        ), null, null);

        assertThat(library.rulesMatch(WINDOWS)).isFalse();
        assertThat(library.rulesMatch(RuleContext.of(OsType.MAC))).isTrue();
    }
}
