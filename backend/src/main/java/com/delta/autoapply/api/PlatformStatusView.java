package com.delta.autoapply.api;

public record PlatformStatusView(String platform, String displayName, boolean ready) {
}
