package com.todo.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * Coarse device, browser and platform detection for the session list.
 *
 * Checks run most-specific first: Edge and Opera user agents also contain
 * "Chrome", Chrome's contains "Safari", and Android and iOS user agents mention
 * Linux and Mac OS respectively.
 */
public final class UserAgentParser {

    private UserAgentParser() {
    }

    @Getter
    @AllArgsConstructor
    public static class Parsed {

        private final String deviceType;

        private final String browser;

        private final String platform;
    }

    public static Parsed parse(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return new Parsed("Desktop", "Unknown", "Unknown");
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        return new Parsed(deviceType(ua), browser(ua), platform(ua));
    }

    private static String deviceType(String ua) {
        if (ua.contains("ipad") || ua.contains("tablet")) {
            return "Tablet";
        }
        if (ua.contains("mobile") || ua.contains("iphone")) {
            return "Mobile";
        }
        if (ua.contains("bot") || ua.contains("crawler") || ua.contains("spider")) {
            return "Bot";
        }
        return "Desktop";
    }

    private static String browser(String ua) {
        if (ua.contains("edg/") || ua.contains("edge/")) {
            return "Edge";
        }
        if (ua.contains("opr/") || ua.contains("opera")) {
            return "Opera";
        }
        if (ua.contains("chrome/") || ua.contains("crios/")) {
            return "Chrome";
        }
        if (ua.contains("firefox/") || ua.contains("fxios/")) {
            return "Firefox";
        }
        if (ua.contains("safari/")) {
            return "Safari";
        }
        if (ua.contains("msie") || ua.contains("trident/")) {
            return "Internet Explorer";
        }
        return "Unknown";
    }

    private static String platform(String ua) {
        if (ua.contains("android")) {
            return "Android";
        }
        if (ua.contains("iphone") || ua.contains("ipad") || ua.contains("ipod")) {
            return "iOS";
        }
        if (ua.contains("windows")) {
            return "Windows";
        }
        if (ua.contains("mac os") || ua.contains("macintosh")) {
            return "macOS";
        }
        if (ua.contains("linux")) {
            return "Linux";
        }
        return "Unknown";
    }
}
