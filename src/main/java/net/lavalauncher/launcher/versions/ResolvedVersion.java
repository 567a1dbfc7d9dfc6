package net.lavalauncher.launcher.versions;

import net.lavalauncher.launcher.manifests.MinecraftVersionManifest;

/**
 * A materialized version: the detail document as downloaded, and what it resolves to on this platform.
 */
public record ResolvedVersion(MinecraftVersionManifest manifest, VersionDescriptor descriptor) {
}
