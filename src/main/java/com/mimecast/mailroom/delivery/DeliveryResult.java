package com.mimecast.mailroom.delivery;

import java.util.List;

/**
 * Delivery attempt result.
 */
public class DeliveryResult {

    private final DeliveryStatus status;
    private final String detail;
    private final List<String> failedRecipients;

    /**
     * Constructs a new DeliveryResult.
     *
     * @param status           Status.
     * @param detail           Diagnostic text, may be null on success.
     * @param failedRecipients Recipients the failure applies to.
     */
    public DeliveryResult(DeliveryStatus status, String detail, List<String> failedRecipients) {
        this.status = status;
        this.detail = detail;
        this.failedRecipients = failedRecipients != null ? List.copyOf(failedRecipients) : List.of();
    }

    public static DeliveryResult success() {
        return new DeliveryResult(DeliveryStatus.SUCCESS, null, null);
    }

    public static DeliveryResult transientFailure(String detail) {
        return new DeliveryResult(DeliveryStatus.TRANSIENT_FAILURE, detail, null);
    }

    public static DeliveryResult permanentFailure(String detail, List<String> failedRecipients) {
        return new DeliveryResult(DeliveryStatus.PERMANENT_FAILURE, detail, failedRecipients);
    }

    public DeliveryStatus getStatus() {
        return status;
    }

    public String getDetail() {
        return detail;
    }

    public List<String> getFailedRecipients() {
        return failedRecipients;
    }

    @Override
    public String toString() {
        return status + (detail != null ? ": " + detail : "");
    }
}
