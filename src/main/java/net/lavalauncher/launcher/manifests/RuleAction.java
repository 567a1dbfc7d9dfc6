package net.lavalauncher.launcher.manifests;

import com.google.gson.annotations.SerializedName;

public enum RuleAction {
    @SerializedName("allow")
    ALLOWED,
    @SerializedName("disallow")
    DISALLOWED;

    boolean isAllowed() {
        return ALLOWED == this;
    }
}
