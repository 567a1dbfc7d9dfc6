package net.lavalauncher.launcher.javaruntime;

import net.lavalauncher.launcher.utils.OsType;

import java.util.Locale;

/**
 * The platform identifiers as used by the Adoptium API.
 *
 * @param os               {@code windows}, {@code linux} or {@code mac}
 * @param arch             {@code x64}, {@code aarch64} or {@code arm}
 * @param archiveExtension {@code zip} on Windows, {@code tar.gz} everywhere else
 */
public record JavaPlatform(String os, String arch, String archiveExtension) {
    public static JavaPlatform current() throws UnsupportedPlatformException {
        return of(OsType.current(), System.getProperty("os.arch"));
    }

    public static JavaPlatform of(OsType osType, String osArch) throws UnsupportedPlatformException {
        var arch = mapArchitecture(osArch);
        return switch (osType) {
            case WINDOWS -> new JavaPlatform("windows", arch, "zip");
            case LINUX -> new JavaPlatform("linux", arch, "tar.gz");
            case MAC -> new JavaPlatform("mac", arch, "tar.gz");
            case UNKNOWN -> throw new UnsupportedPlatformException("Unsupported operating system: " + System.getProperty("os.name"));
        };
    }

    static String mapArchitecture(String osArch) {
        var arch = osArch.toLowerCase(Locale.ROOT);
        if (arch.equals("aarch64") || arch.equals("arm64")) {
            return "aarch64";
        } else if (arch.startsWith("arm")) {
            return "arm";
        }
        return "x64";
    }

    /**
     * Name of the folder a runtime is installed into, e.g. {@code 17-linux-x64}.
     */
    public String getInstallationName(int majorVersion) {
        return majorVersion + "-" + os + "-" + arch;
    }
}
