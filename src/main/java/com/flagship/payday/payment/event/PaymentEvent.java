package com.flagship.payday.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Base interface for the facts recorded in a payment stream.
 *
 * Events are immutable. Their JSON form is the stored payload; the type name goes into the
 * event_type column.
 */
public interface PaymentEvent {

    String EVENT_VERSION = "1.0.0";

    /**
     * Event type name stored next to the payload.
     */
    @JsonIgnore
    String getEventType();
}
