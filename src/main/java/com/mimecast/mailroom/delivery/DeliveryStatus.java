package com.mimecast.mailroom.delivery;

/**
 * Delivery attempt status.
 */
public enum DeliveryStatus {
    SUCCESS,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE
}
