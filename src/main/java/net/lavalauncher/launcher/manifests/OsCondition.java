package net.lavalauncher.launcher.manifests;

import org.jetbrains.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * @param name    {@code windows}, {@code linux} or {@code osx}
 * @param version Regular expression searched in the OS version.
 * @param arch    Regular expression searched in the OS architecture.
 */
public record OsCondition(@Nullable String name, @Nullable String version, @Nullable String arch) {
    public boolean nameMatches(RuleContext context) {
        return name == null || name.equalsIgnoreCase(context.os().getManifestName());
    }

    public boolean versionMatches(RuleContext context) {
        return version == null || Pattern.compile(version).matcher(context.osVersion()).find();
    }

    public boolean archMatches(RuleContext context) {
        return arch == null || Pattern.compile(arch).matcher(context.arch()).find();
    }

    public boolean platformMatches(RuleContext context) {
        return nameMatches(context) && versionMatches(context) && archMatches(context);
    }
}
