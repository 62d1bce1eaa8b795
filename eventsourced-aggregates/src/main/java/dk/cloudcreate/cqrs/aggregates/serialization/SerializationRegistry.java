package dk.cloudcreate.cqrs.aggregates.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.cqrs.aggregates.command.*;
import dk.cloudcreate.cqrs.aggregates.event.*;
import dk.cloudcreate.cqrs.common.types.*;
import org.slf4j.*;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Maps command and event identifiers to their payload types and converts {@link Command}'s and {@link Event}'s
 * to and from their JSON wire format:
 * <pre>{@code
 * {
 *   "identifier": "user.create",
 *   "aggregate_id": "",
 *   "aggregate_type": "user",
 *   "correlation_id": "c1",
 *   "created_at": "2024-01-01T10:00:00.123456Z",   <- events only
 *   "payload": { ... }
 * }
 * }</pre>
 * Decoding happens in two phases: the envelope and identifier are read first while the payload is kept as an
 * undecoded JSON tree, then the identifier is resolved to the registered payload type and only then is the payload decoded.
 * An unregistered identifier results in an {@link UnknownIdentifierException}.
 * <p>
 * The registry is built at start-up and shared by reference between the components that need it.
 * Registering an identifier again replaces the previous registration.
 */
public final class SerializationRegistry {
    private static final Logger log = LoggerFactory.getLogger(SerializationRegistry.class);

    public static final String IDENTIFIER     = "identifier";
    public static final String AGGREGATE_ID   = "aggregate_id";
    public static final String AGGREGATE_TYPE = "aggregate_type";
    public static final String CORRELATION_ID = "correlation_id";
    public static final String CREATED_AT     = "created_at";
    public static final String PAYLOAD        = "payload";

    private final ConcurrentMap<CommandId, Class<? extends CommandPayload>> commandTypes = new ConcurrentHashMap<>();
    private final ConcurrentMap<EventId, Class<? extends EventPayload>>     eventTypes   = new ConcurrentHashMap<>();
    private final ObjectMapper                                              objectMapper;

    public SerializationRegistry() {
        this(createObjectMapper());
    }

    public SerializationRegistry(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    /**
     * The {@link ObjectMapper} configuration used by default: Java time support and empty payloads allowed
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule())
                                 .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                                 .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public <P extends CommandPayload> SerializationRegistry registerCommand(CommandId commandId, Class<P> payloadType) {
        requireNonNull(commandId, "No commandId provided");
        requireNonNull(payloadType, "No payloadType provided");
        var previous = commandTypes.put(commandId, payloadType);
        if (previous != null && !previous.equals(payloadType)) {
            log.debug("Command identifier '{}' re-registered. Replaced '{}' with '{}'", commandId, previous.getName(), payloadType.getName());
        }
        return this;
    }

    public <P extends EventPayload> SerializationRegistry registerEvent(EventId eventId, Class<P> payloadType) {
        requireNonNull(eventId, "No eventId provided");
        requireNonNull(payloadType, "No payloadType provided");
        var previous = eventTypes.put(eventId, payloadType);
        if (previous != null && !previous.equals(payloadType)) {
            log.debug("Event identifier '{}' re-registered. Replaced '{}' with '{}'", eventId, previous.getName(), payloadType.getName());
        }
        return this;
    }

    public boolean isCommandRegistered(CommandId commandId) {
        return commandTypes.containsKey(requireNonNull(commandId, "No commandId provided"));
    }

    public boolean isEventRegistered(EventId eventId) {
        return eventTypes.containsKey(requireNonNull(eventId, "No eventId provided"));
    }

    // ------------------------------------------------------------------------------------------------------------------------------------------------

    public byte[] marshalCommand(Command<?> command) {
        requireNonNull(command, "No command provided");
        var document = envelopeDocument(command.commandId().toString(),
                                        command.aggregateId(),
                                        command.aggregateType(),
                                        command.correlationId());
        document.set(PAYLOAD, payloadToTree(command.payload()));
        return write(document);
    }

    public Command<?> unmarshalCommand(byte[] data) {
        var document    = readDocument(data);
        var commandId   = CommandId.of(requiredText(document, IDENTIFIER));
        var payloadType = commandTypes.get(commandId);
        if (payloadType == null) {
            throw new UnknownIdentifierException("command", commandId.toString());
        }
        return new Command<>(new CommandEnvelope(commandId,
                                                 optionalText(document, AGGREGATE_ID),
                                                 AggregateType.of(requiredText(document, AGGREGATE_TYPE)),
                                                 CorrelationId.of(requiredText(document, CORRELATION_ID))),
                             treeToPayload(document.get(PAYLOAD), payloadType));
    }

    public byte[] marshalEvent(Event<?> event) {
        requireNonNull(event, "No event provided");
        var document = envelopeDocument(event.eventId().toString(),
                                        event.aggregateId(),
                                        event.aggregateType(),
                                        event.correlationId());
        document.put(CREATED_AT, event.createdAt().toString());
        document.set(PAYLOAD, payloadToTree(event.payload()));
        return write(document);
    }

    public Event<?> unmarshalEvent(byte[] data) {
        var document = readDocument(data);
        var eventId  = EventId.of(requiredText(document, IDENTIFIER));
        var payload  = treeToPayload(document.get(PAYLOAD), resolveEventType(eventId));
        return new Event<>(new EventEnvelope(eventId,
                                             requiredText(document, AGGREGATE_ID),
                                             AggregateType.of(requiredText(document, AGGREGATE_TYPE)),
                                             parseTimestamp(requiredText(document, CREATED_AT)),
                                             CorrelationId.of(requiredText(document, CORRELATION_ID))),
                           payload);
    }

    /**
     * Serialize only the payload of an event. Used by event stores that keep the envelope in separate columns
     *
     * @param event the event
     * @return the payload as JSON
     */
    public String serializeEventPayload(Event<?> event) {
        requireNonNull(event, "No event provided");
        try {
            return objectMapper.writeValueAsString(event.payload());
        } catch (JsonProcessingException e) {
            throw new SerializationException(msg("Failed to serialize payload of event '{}'", event.eventId()), e);
        }
    }

    /**
     * Deserialize an event payload previously serialized using {@link #serializeEventPayload(Event)}
     *
     * @param eventId the event identifier stored alongside the payload
     * @param json    the payload JSON
     * @return the payload
     * @throws UnknownIdentifierException if <code>eventId</code> isn't registered
     */
    public EventPayload deserializeEventPayload(EventId eventId, String json) {
        requireNonNull(eventId, "No eventId provided");
        requireNonNull(json, "No json provided");
        var payloadType = resolveEventType(eventId);
        try {
            return objectMapper.readValue(json, payloadType);
        } catch (JsonProcessingException e) {
            throw new SerializationException(msg("Failed to deserialize payload of event '{}' as '{}'", eventId, payloadType.getName()), e);
        }
    }

    // ------------------------------------------------------------------------------------------------------------------------------------------------

    private Class<? extends EventPayload> resolveEventType(EventId eventId) {
        var payloadType = eventTypes.get(eventId);
        if (payloadType == null) {
            throw new UnknownIdentifierException("event", eventId.toString());
        }
        return payloadType;
    }

    private ObjectNode envelopeDocument(String identifier, String aggregateId, AggregateType aggregateType, CorrelationId correlationId) {
        var document = objectMapper.createObjectNode();
        document.put(IDENTIFIER, identifier);
        document.put(AGGREGATE_ID, aggregateId);
        document.put(AGGREGATE_TYPE, aggregateType.toString());
        document.put(CORRELATION_ID, correlationId.toString());
        return document;
    }

    private JsonNode payloadToTree(Object payload) {
        try {
            return objectMapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            throw new SerializationException(msg("Failed to serialize payload of type '{}'", payload.getClass().getName()), e);
        }
    }

    private <P> P treeToPayload(JsonNode payloadNode, Class<P> payloadType) {
        var node = payloadNode == null || payloadNode.isNull() ? objectMapper.createObjectNode() : payloadNode;
        try {
            return objectMapper.treeToValue(node, payloadType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SerializationException(msg("Failed to deserialize payload as '{}'", payloadType.getName()), e);
        }
    }

    private byte[] write(ObjectNode document) {
        try {
            return objectMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize document", e);
        }
    }

    private ObjectNode readDocument(byte[] data) {
        requireNonNull(data, "No data provided");
        JsonNode document;
        try {
            document = objectMapper.readTree(data);
        } catch (IOException e) {
            throw new SerializationException("Malformed document", e);
        }
        if (document == null || !document.isObject()) {
            throw new SerializationException("Malformed document: expected a JSON object");
        }
        return (ObjectNode) document;
    }

    private static String requiredText(ObjectNode document, String field) {
        var node = document.get(field);
        if (node == null || !node.isTextual()) {
            throw new SerializationException(msg("Malformed document: missing or non textual '{}'", field));
        }
        return node.asText();
    }

    private static String optionalText(ObjectNode document, String field) {
        var node = document.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        if (!node.isTextual()) {
            throw new SerializationException(msg("Malformed document: non textual '{}'", field));
        }
        return node.asText();
    }

    private static OffsetDateTime parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new SerializationException(msg("Malformed document: invalid '{}' value '{}'", CREATED_AT, value), e);
        }
    }
}
