package com.tapas.orderstream.validator.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tapas.orderstream.common.error.EventSerializationException;
import com.tapas.orderstream.common.model.InvalidReason;
import com.tapas.orderstream.common.model.OrderEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Builds sink lines. Everything written is derived from the record itself, never from
 * the wall clock, so the same record always produces the same bytes.
 */
public class SinkRecordMapper {

    private final ObjectMapper objectMapper;

    public SinkRecordMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String validLine(OrderEvent event, ConsumerRecord<String, String> record) {
        ObjectNode line = objectMapper.valueToTree(event);
        LocalDateTime purchasedAt = purchaseMoment(event);
        if (purchasedAt != null) {
            DayOfWeek day = purchasedAt.getDayOfWeek();
            ObjectNode metadata = line.putObject("purchase_metadata");
            metadata.put("day_of_week", day.getDisplayName(TextStyle.FULL, Locale.ENGLISH));
            metadata.put("hour_of_day", purchasedAt.getHour());
            metadata.put("is_weekend", day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY);
        }
        line.set("source", source(record));
        return write(line);
    }

    public String invalidLine(OrderEvent event, InvalidReason reason, ConsumerRecord<String, String> record) {
        ObjectNode line = objectMapper.createObjectNode();
        if (event != null) {
            line.put("order_id", event.orderId());
            line.put("invalid_mode", event.invalidMode());
        } else {
            line.putNull("order_id");
            line.putNull("invalid_mode");
        }
        line.put("reason", reason.code());
        line.put("raw_payload", record.value());
        line.set("source", source(record));
        return write(line);
    }

    private static LocalDateTime purchaseMoment(OrderEvent event) {
        if (event.purchaseDateTime() != null) {
            return event.purchaseDateTime();
        }
        if (event.eventTimeMs() != null) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(event.eventTimeMs()), ZoneOffset.UTC);
        }
        return null;
    }

    private ObjectNode source(ConsumerRecord<String, String> record) {
        ObjectNode source = objectMapper.createObjectNode();
        source.put("topic", record.topic());
        source.put("partition", record.partition());
        source.put("offset", record.offset());
        source.put("timestamp", record.timestamp());
        return source;
    }

    private String write(ObjectNode line) {
        try {
            return objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to write sink line", e);
        }
    }
}
