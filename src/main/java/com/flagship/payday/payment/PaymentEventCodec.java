package com.flagship.payday.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payday.eventstore.EventMetadata;
import com.flagship.payday.eventstore.NewEvent;
import com.flagship.payday.eventstore.StorageException;
import com.flagship.payday.eventstore.StoredEvent;
import com.flagship.payday.payment.event.InvoiceCanceled;
import com.flagship.payday.payment.event.InvoiceCreated;
import com.flagship.payday.payment.event.InvoiceExpired;
import com.flagship.payday.payment.event.InvoicePaymentDetected;
import com.flagship.payday.payment.event.InvoiceSettled;
import com.flagship.payday.payment.event.PaymentEvent;
import com.flagship.payday.payment.event.PaymentFailed;
import com.flagship.payday.payment.event.PaymentInFlight;
import com.flagship.payday.payment.event.PaymentInitiated;
import com.flagship.payday.payment.event.PaymentSucceeded;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Converts payment events to and from their stored JSON form, routing on the event_type column.
 */
@Component
public class PaymentEventCodec {

    private static final Map<String, Class<? extends PaymentEvent>> EVENT_TYPES = Map.of(
        InvoiceCreated.EVENT_TYPE, InvoiceCreated.class,
        InvoicePaymentDetected.EVENT_TYPE, InvoicePaymentDetected.class,
        InvoiceSettled.EVENT_TYPE, InvoiceSettled.class,
        InvoiceExpired.EVENT_TYPE, InvoiceExpired.class,
        InvoiceCanceled.EVENT_TYPE, InvoiceCanceled.class,
        PaymentInitiated.EVENT_TYPE, PaymentInitiated.class,
        PaymentInFlight.EVENT_TYPE, PaymentInFlight.class,
        PaymentSucceeded.EVENT_TYPE, PaymentSucceeded.class,
        PaymentFailed.EVENT_TYPE, PaymentFailed.class
    );

    private final ObjectMapper objectMapper;

    public PaymentEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public NewEvent encode(PaymentEvent event, EventMetadata metadata) {
        try {
            return new NewEvent(event.getEventType(), PaymentEvent.EVENT_VERSION,
                objectMapper.writeValueAsString(event), metadata);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize " + event.getEventType(), e);
        }
    }

    public PaymentEvent decode(StoredEvent stored) {
        Class<? extends PaymentEvent> type = EVENT_TYPES.get(stored.getEventType());
        if (type == null) {
            throw new StorageException(String.format("Unknown event type %s at %s/%s#%d",
                stored.getEventType(), stored.getAggregateType(), stored.getAggregateId(), stored.getSequence()));
        }
        try {
            return objectMapper.readValue(stored.getPayload(), type);
        } catch (JsonProcessingException e) {
            throw new StorageException(String.format("Unreadable %s payload at %s/%s#%d",
                stored.getEventType(), stored.getAggregateType(), stored.getAggregateId(), stored.getSequence()), e);
        }
    }
}
