package com.relaybot.model;

public record MediaRef(MediaKind kind, String fileId) {
}
