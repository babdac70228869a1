package com.signals.arena.match;

import java.time.Instant;

public record NegotiationMessage(String from, String text, Instant sentAt) {
}
