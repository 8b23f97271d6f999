package com.relaybot.model;

public record DialogInfo(long chatId, String type, String title, boolean forum) {
}
