package com.topostat.core.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.topostat.core.error.Attempt;
import com.topostat.core.error.ErrorKind;
import com.topostat.core.model.WireFormat;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the envelope wire format:
 * <pre>{"version": 1, "auth": "&lt;hex&gt;", "timestamp": "YYYY-MM-DD HH:MM:SS.ffffff", "payload": [...]}</pre>
 */
@Component
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses raw envelope JSON. Only type errors fail here; semantic checks are left to
     * {@link MessageEnvelope#check()} and {@link MessageEnvelope#verifyAuth(String)}.
     */
    public Attempt<MessageEnvelope> decode(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "malformed JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "envelope is not a JSON object");
        }

        JsonNode version = root.get("version");
        if (version == null || !version.canConvertToInt()) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "missing or non-integer envelope version");
        }
        JsonNode auth = root.get("auth");
        if (auth == null || !auth.isTextual()) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "missing auth digest");
        }
        JsonNode timestampNode = root.get("timestamp");
        Optional<Instant> timestamp = timestampNode != null && timestampNode.isTextual()
                ? WireFormat.parse(timestampNode.textValue())
                : Optional.empty();
        if (timestamp.isEmpty()) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "missing or unparseable envelope timestamp");
        }
        JsonNode payload = root.get("payload");
        if (payload == null || !payload.isArray()) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "payload is not a list");
        }

        List<JsonNode> records = new ArrayList<>(payload.size());
        payload.forEach(records::add);
        return Attempt.ok(new MessageEnvelope(version.intValue(), auth.textValue(), timestamp.get(), records));
    }

    /**
     * Serializes a signed envelope.
     *
     * @throws IllegalStateException if the envelope fails its structural check
     */
    public String encode(MessageEnvelope envelope) {
        if (!envelope.check()) {
            throw new IllegalStateException("Refusing to encode unchecked envelope " + envelope);
        }
        ObjectNode root = objectMapper.createObjectNode();
        root.put("version", envelope.getProtocolVersion());
        root.put("auth", envelope.getAuthDigest());
        root.put("timestamp", WireFormat.format(envelope.getTimestamp()));
        ArrayNode payload = root.putArray("payload");
        envelope.getPayload().forEach(payload::add);
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize envelope", e);
        }
    }
}
