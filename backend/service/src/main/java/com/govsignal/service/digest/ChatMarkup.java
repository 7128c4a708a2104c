package com.govsignal.service.digest;

public final class ChatMarkup {
    private ChatMarkup() {
    }

    public static String bold(String text) {
        return "**" + text + "**";
    }

    public static String link(String url, String label) {
        if (url == null || url.isBlank()) {
            return "";
        }
        return "<" + url.trim() + "|" + label + ">";
    }
}
