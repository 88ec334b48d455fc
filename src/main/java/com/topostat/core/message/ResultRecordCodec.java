package com.topostat.core.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.topostat.core.error.Attempt;
import com.topostat.core.error.ErrorKind;
import com.topostat.core.model.Outcome;
import com.topostat.core.model.PlatformInfo;
import com.topostat.core.model.ResultRecord;
import com.topostat.core.model.WireFormat;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Converts {@link ResultRecord}s to and from their wire JSON objects.
 * <p>
 * {@code time} and {@code build} travel as strings; numeric JSON values are accepted
 * on input as well. A record that decodes but fails {@link ResultRecord#validate()}
 * is reported as {@link ErrorKind#STRUCTURAL}.
 */
@Component
public class ResultRecordCodec {

    private final ObjectMapper objectMapper;

    public ResultRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Attempt<ResultRecord> fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "result is not a JSON object");
        }
        JsonNode versionNode = node.get("version");
        if (versionNode == null || !versionNode.canConvertToInt()) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "missing or non-integer version");
        }
        int version = versionNode.intValue();
        if (!ResultRecord.SUPPORTED_VERSIONS.contains(version)) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "unsupported result version " + version);
        }

        Optional<Outcome> outcome = Outcome.fromWire(text(node, "result"));
        if (outcome.isEmpty()) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "unknown result value " + text(node, "result"));
        }
        Double time = parseDouble(node.get("time"));
        if (time == null) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "unparseable time");
        }
        Integer build = parseInt(node.get("build"));
        if (build == null) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "unparseable build number");
        }
        Optional<Instant> timestamp = WireFormat.parse(text(node, "timestamp"));
        if (timestamp.isEmpty()) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "unparseable timestamp");
        }

        PlatformInfo platform = null;
        if (version == ResultRecord.VERSION_2) {
            platform = new PlatformInfo(text(node, "os"), text(node, "arch"), text(node, "kvers"));
        }

        ResultRecord record = new ResultRecord(
                version,
                text(node, "name"),
                outcome.get(),
                time,
                text(node, "host"),
                timestamp.get(),
                text(node, "plan"),
                build,
                text(node, "job"),
                platform);

        if (!record.validate()) {
            return Attempt.fail(ErrorKind.STRUCTURAL, "result failed validation: " + record.name());
        }
        return Attempt.ok(record);
    }

    /**
     * Encodes a valid record.
     *
     * @throws IllegalArgumentException if the record does not validate
     */
    public ObjectNode toJson(ResultRecord record) {
        if (!record.validate()) {
            throw new IllegalArgumentException("Refusing to encode invalid result " + record.name());
        }
        ObjectNode node = objectMapper.createObjectNode();
        node.put("version", record.schemaVersion());
        node.put("name", record.name());
        node.put("result", record.outcome().wireValue());
        node.put("time", String.valueOf(record.durationSeconds()));
        node.put("host", record.agentName());
        node.put("timestamp", WireFormat.format(record.timestamp()));
        node.put("plan", record.planName());
        node.put("build", String.valueOf(record.buildNumber()));
        node.put("job", record.jobName());
        if (record.platform() != null) {
            node.put("os", record.platform().osName());
            node.put("arch", record.platform().archName());
            node.put("kvers", record.platform().kernelVersion());
        }
        return node;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static Double parseDouble(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.textValue().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Integer parseInt(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.textValue().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
