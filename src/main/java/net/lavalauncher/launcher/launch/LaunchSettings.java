package net.lavalauncher.launcher.launch;

/**
 * Heap sizes in the format of {@code -Xmx}, e.g. {@code 4G} or {@code 512M}.
 */
public record LaunchSettings(String maxMemory, String minMemory) {
    public static final LaunchSettings DEFAULT = new LaunchSettings("4G", "2G");

    public LaunchSettings {
        if (!isMemorySize(maxMemory) || !isMemorySize(minMemory)) {
            throw new IllegalArgumentException("Invalid memory size: " + maxMemory + " / " + minMemory);
        }
    }

    private static boolean isMemorySize(String value) {
        return value != null && value.matches("\\d+[kKmMgG]?");
    }
}
