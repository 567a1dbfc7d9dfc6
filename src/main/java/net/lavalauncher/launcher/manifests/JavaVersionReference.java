package net.lavalauncher.launcher.manifests;

public record JavaVersionReference(String component, int majorVersion) {
}
