package com.ridehub.service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridehub.entity.Ride;
import com.ridehub.entity.RideEvent;

/**
 * Publishes ride lifecycle changes to Kafka, keyed by ride id. Best effort:
 * a failed send is logged and never reaches the caller.
 */
@Service
public class RideActivityPublisher {
    private static final Logger logger = LoggerFactory.getLogger(RideActivityPublisher.class);

    public enum Activity {
        RIDE_CREATED, RIDE_UPDATED, RIDE_DELETED, RIDE_EVENT_APPENDED
    }

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String topic;

    public RideActivityPublisher(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper, Clock clock,
                                 @Value("${ridehub.kafka.activity-topic:ridehub.ride-activity}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.topic = topic;
    }

    public void rideCreated(Ride ride) {
        publish(Activity.RIDE_CREATED, ride.getId(), rideFields(ride));
    }

    public void rideUpdated(Ride ride) {
        publish(Activity.RIDE_UPDATED, ride.getId(), rideFields(ride));
    }

    public void rideDeleted(Long rideId) {
        publish(Activity.RIDE_DELETED, rideId, new LinkedHashMap<>());
    }

    public void eventAppended(RideEvent event) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("eventId", event.getId());
        fields.put("description", event.getDescription());
        fields.put("createdAt", event.getCreatedAt() == null ? null : event.getCreatedAt().toString());
        publish(Activity.RIDE_EVENT_APPENDED, event.getRide().getId(), fields);
    }

    private Map<String, Object> rideFields(Ride ride) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", ride.getStatus());
        fields.put("riderId", ride.getRider() == null ? null : ride.getRider().getId());
        fields.put("driverId", ride.getDriver() == null ? null : ride.getDriver().getId());
        fields.put("pickupTime", ride.getPickupTime() == null ? null : ride.getPickupTime().toString());
        return fields;
    }

    void publish(Activity activity, Long rideId, Map<String, Object> fields) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", activity.name());
        payload.put("rideId", rideId);
        payload.put("occurredAt", clock.instant().toString());
        payload.putAll(fields);
        try {
            String json = objectMapper.writeValueAsString(payload);
            kafkaTemplate.send(topic, String.valueOf(rideId), json)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            logger.error("Kafka delivery failed for {} on ride {}: {}", activity, rideId, ex.getMessage());
                        }
                    });
            logger.info("Kafka message sent: {} for rideId: {}", activity, rideId);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize {} payload for ride {}: {}", activity, rideId, e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to publish Kafka event {} for ride {}: {}", activity, rideId, e.getMessage());
        }
    }
}
