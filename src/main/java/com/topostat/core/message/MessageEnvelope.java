package com.topostat.core.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.topostat.core.check.Checks;
import com.topostat.core.model.WireFormat;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

/**
 * Authenticated container for a batch of result records.
 * <p>
 * The digest is {@code hex(SHA-512(timestamp + secret))} where the timestamp is
 * rendered in {@link WireFormat} and doubles as the salt. The payload is held as an
 * unmodifiable copy; replacing it clears the digest so a re-signed envelope is required.
 */
public class MessageEnvelope {

    /** The only protocol version this build speaks. */
    public static final int PROTOCOL_VERSION = 1;

    private int protocolVersion;
    private String authDigest;
    private Instant timestamp;
    private List<JsonNode> payload;

    public MessageEnvelope(List<JsonNode> payload) {
        this(PROTOCOL_VERSION, null, null, payload);
    }

    public MessageEnvelope(int protocolVersion, String authDigest, Instant timestamp, List<JsonNode> payload) {
        this.protocolVersion = protocolVersion;
        this.authDigest = authDigest;
        this.timestamp = timestamp;
        this.payload = frozen(payload);
    }

    /**
     * Signs the envelope with {@code secret}, stamping the current UTC time first when
     * no timestamp is set.
     *
     * @return false if the secret is missing
     */
    public boolean generateAuth(String secret) {
        if (secret == null) {
            return false;
        }
        if (timestamp == null) {
            timestamp = WireFormat.now();
        }
        authDigest = digest(timestamp, secret);
        return true;
    }

    /**
     * Recomputes the digest from this envelope's own timestamp and compares it with the
     * carried one. A structurally invalid envelope never verifies.
     */
    public boolean verifyAuth(String secret) {
        if (secret == null || !check()) {
            return false;
        }
        return authDigest.equals(digest(timestamp, secret));
    }

    public boolean check() {
        return protocolVersion == PROTOCOL_VERSION
                && Checks.isNonEmpty(authDigest)
                && Checks.isTimestamp(timestamp)
                && payload != null;
    }

    private static List<JsonNode> frozen(List<JsonNode> payload) {
        if (payload == null) {
            return null;
        }
        List<JsonNode> copy = new ArrayList<>(payload.size());
        for (JsonNode node : payload) {
            copy.add(node.deepCopy());
        }
        return Collections.unmodifiableList(copy);
    }

    static String digest(Instant timestamp, String secret) {
        String salted = WireFormat.format(timestamp) + secret;
        try {
            MessageDigest sha512 = MessageDigest.getInstance("SHA-512");
            return HexFormat.of().formatHex(sha512.digest(salted.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 algorithm not available", e);
        }
    }

    public int getProtocolVersion() {
        return protocolVersion;
    }

    public String getAuthDigest() {
        return authDigest;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public List<JsonNode> getPayload() {
        return payload;
    }

    public void setPayload(List<JsonNode> payload) {
        this.payload = frozen(payload);
        this.authDigest = null;
    }

    @Override
    public String toString() {
        return "MessageEnvelope[version=" + protocolVersion
                + ", timestamp=" + (timestamp != null ? WireFormat.format(timestamp) : null)
                + ", records=" + (payload != null ? payload.size() : 0) + "]";
    }
}
