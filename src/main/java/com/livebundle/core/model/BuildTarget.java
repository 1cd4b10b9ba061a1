package com.livebundle.core.model;

import java.io.Serializable;

/**
 * A compilation target: the single web bundle or one mobile platform.
 *
 * @param kind     {@code web} or {@code mobile}
 * @param platform mobile platform name, {@code null} for web
 */
public record BuildTarget(String kind, String platform) implements Serializable {

    public static final String WEB = "web";
    public static final String MOBILE = "mobile";

    public static BuildTarget web() {
        return new BuildTarget(WEB, null);
    }

    public static BuildTarget mobile(String platform) {
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("Mobile target requires a platform");
        }
        return new BuildTarget(MOBILE, platform);
    }

    public boolean isWeb() {
        return WEB.equals(kind);
    }

    /** Rendered as {@code web} or {@code mobile:<platform>}. */
    @Override
    public String toString() {
        return isWeb() ? WEB : MOBILE + ":" + platform;
    }
}
