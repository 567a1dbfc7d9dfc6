package net.lavalauncher.launcher.manifests;

import net.lavalauncher.launcher.utils.OsType;

import java.util.Set;

/**
 * The platform and feature state that library and argument rules are evaluated against.
 *
 * @param os              The current operating system family.
 * @param osVersion       Value of the {@code os.version} system property.
 * @param arch            Value of the {@code os.arch} system property.
 * @param enabledFeatures Launcher features that are switched on, such as {@code has_custom_resolution}.
 *                        Features not in this set count as disabled.
 */
public record RuleContext(OsType os, String osVersion, String arch, Set<String> enabledFeatures) {
    public RuleContext {
        enabledFeatures = Set.copyOf(enabledFeatures);
    }

    public static RuleContext current() {
        return new RuleContext(OsType.current(), System.getProperty("os.version"), System.getProperty("os.arch"), Set.of());
    }

    public static RuleContext of(OsType os) {
        return new RuleContext(os, "", "", Set.of());
    }

    public RuleContext withFeatures(Set<String> features) {
        return new RuleContext(os, osVersion, arch, features);
    }

    public boolean isFeatureEnabled(String feature) {
        return enabledFeatures.contains(feature);
    }
}
