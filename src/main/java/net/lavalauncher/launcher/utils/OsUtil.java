package net.lavalauncher.launcher.utils;

public final class OsUtil {
    private static final OsType TYPE = OsType.fromOsName(System.getProperty("os.name"));

    private OsUtil() {
    }

    public static OsType getOsType() {
        return TYPE;
    }

    public static boolean isWindows() {
        return TYPE == OsType.WINDOWS;
    }

    public static boolean isLinux() {
        return TYPE == OsType.LINUX;
    }

    public static boolean isMac() {
        return TYPE == OsType.MAC;
    }

    /**
     * Windows 11 still reports {@code os.version} 10.0, so only the product name tells them apart.
     */
    public static boolean isWindows10() {
        return isWindows() && "Windows 10".equals(System.getProperty("os.name"));
    }
}
