package com.relaybot.model;

/**
 * Result of relaying one matched message. Only {@link Status#FORWARDED} and {@link Status#COPIED}
 * produce an outbound message in the destination.
 */
public final class DeliveryOutcome {
    public enum Status {
        FORWARDED,
        COPIED,
        FAILED,
        SKIPPED
    }

    private static final DeliveryOutcome FORWARDED = new DeliveryOutcome(Status.FORWARDED, "", 1);
    private static final DeliveryOutcome COPIED = new DeliveryOutcome(Status.COPIED, "", 1);

    public final Status status;
    public final String reason;
    public final int attempts;

    private DeliveryOutcome(Status status, String reason, int attempts) {
        this.status = status;
        this.reason = reason == null ? "" : reason;
        this.attempts = Math.max(0, attempts);
    }

    public static DeliveryOutcome forwarded() {
        return FORWARDED;
    }

    public static DeliveryOutcome forwarded(int attempts) {
        return attempts <= 1 ? FORWARDED : new DeliveryOutcome(Status.FORWARDED, "", attempts);
    }

    public static DeliveryOutcome copied() {
        return COPIED;
    }

    public static DeliveryOutcome copied(int attempts) {
        return attempts <= 1 ? COPIED : new DeliveryOutcome(Status.COPIED, "", attempts);
    }

    public static DeliveryOutcome failed(String reason, int attempts) {
        return new DeliveryOutcome(Status.FAILED, reason, attempts);
    }

    public static DeliveryOutcome skipped(String reason) {
        return new DeliveryOutcome(Status.SKIPPED, reason, 0);
    }

    public boolean delivered() {
        return status == Status.FORWARDED || status == Status.COPIED;
    }

    @Override
    public String toString() {
        return reason.isEmpty() ? status.name() : status.name() + "(" + reason + ")";
    }
}
