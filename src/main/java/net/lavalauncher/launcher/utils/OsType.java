package net.lavalauncher.launcher.utils;

import com.google.gson.annotations.SerializedName;

/**
 * Operating system families, named the way version manifests name them.
 */
public enum OsType {
    @SerializedName("windows")
    WINDOWS("windows"),
    @SerializedName("linux")
    LINUX("linux"),
    @SerializedName("osx")
    MAC("osx"),
    UNKNOWN("unknown");

    private final String manifestName;

    OsType(String manifestName) {
        this.manifestName = manifestName;
    }

    public String getManifestName() {
        return manifestName;
    }

    public static OsType current() {
        return OsUtil.getOsType();
    }

    public static OsType fromOsName(String osName) {
        // The following matches the logic in Apache Commons Lang 3 SystemUtils
        if (osName.startsWith("Linux") || osName.startsWith("LINUX")) {
            return LINUX;
        } else if (osName.startsWith("Mac OS X")) {
            return MAC;
        } else if (osName.startsWith("Windows")) {
            return WINDOWS;
        } else {
            return UNKNOWN;
        }
    }
}
