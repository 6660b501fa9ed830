package com.ryuqq.testengine.adapter.runner.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.testengine.core.model.Outcome;
import com.ryuqq.testengine.core.model.TestDuration;
import com.ryuqq.testengine.core.model.TestId;
import com.ryuqq.testengine.core.model.TestStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 프로세스 워커와 주고받는 한 줄 JSON 메시지 코덱.
 *
 * <p><strong>메시지 형식:</strong></p>
 * <pre>
 * 요청 (부모 → 워커): {"group":"billing.InvoiceTests","method":"issue"}
 * 응답 (워커 → 부모): {"outcomes":[{"group":...,"method":...,"status":"FAILURE",
 *                     "exception":"...","message":null,
 *                     "start":{"epochSecond":...,"nano":...},"stop":{...}}]}
 * 오류 (워커 → 부모): {"error":"Unknown test: issue (billing.InvoiceTests)"}
 * </pre>
 *
 * <p>Outcome 레코드만 경계를 넘으며, 항목 자체는 워커가 레지스트리에서 복원합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OutcomeCodec {

    private final ObjectMapper objectMapper;

    public OutcomeCodec() {
        this(new ObjectMapper());
    }

    public OutcomeCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    public String encodeId(TestId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return write(idNode(id));
    }

    /**
     * 요청 메시지 해석.
     *
     * @param line 한 줄 JSON
     * @return TestId
     * @throws WorkerException JSON 형식이 잘못되었거나 필드가 없는 경우
     */
    public TestId decodeId(String line) {
        JsonNode node = read(line);
        return TestId.of(requiredText(node, "group"), requiredText(node, "method"));
    }

    public String encodeBatch(List<Outcome> outcomes) {
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode array = root.putArray("outcomes");
        for (Outcome outcome : outcomes) {
            ObjectNode node = idNode(outcome.testId());
            node.put("status", outcome.status().name());
            node.put("exception", outcome.exception());
            node.put("message", outcome.message());
            node.set("start", instantNode(outcome.duration().start()));
            node.set("stop", instantNode(outcome.duration().stop()));
            array.add(node);
        }
        return write(root);
    }

    public String encodeError(String message) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("error", message == null ? "unknown worker error" : message);
        return write(root);
    }

    /**
     * 응답 메시지 해석.
     *
     * @param line 한 줄 JSON
     * @return 워커가 보고한 Outcome 목록 (보고 순서)
     * @throws WorkerException 오류 응답이거나 형식이 잘못된 경우
     */
    public List<Outcome> decodeBatch(String line) {
        JsonNode root = read(line);
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            throw new WorkerException("Worker reported an error: " + error.asText());
        }
        JsonNode array = root.get("outcomes");
        if (array == null || !array.isArray()) {
            throw new WorkerException("Malformed worker response: missing outcomes");
        }
        List<Outcome> outcomes = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            outcomes.add(decodeOutcome(node));
        }
        return outcomes;
    }

    private Outcome decodeOutcome(JsonNode node) {
        TestStatus status;
        try {
            status = TestStatus.valueOf(requiredText(node, "status"));
        } catch (IllegalArgumentException e) {
            throw new WorkerException("Malformed worker response: unknown status", e);
        }
        return new Outcome(
            TestId.of(requiredText(node, "group"), requiredText(node, "method")),
            status,
            optionalText(node, "exception"),
            optionalText(node, "message"),
            TestDuration.between(instant(node, "start"), instant(node, "stop"))
        );
    }

    private ObjectNode idNode(TestId id) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("group", id.group());
        node.put("method", id.method());
        return node;
    }

    private ObjectNode instantNode(Instant instant) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("epochSecond", instant.getEpochSecond());
        node.put("nano", instant.getNano());
        return node;
    }

    private static Instant instant(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.hasNonNull("epochSecond") || !value.hasNonNull("nano")) {
            throw new WorkerException("Malformed worker response: missing " + field);
        }
        return Instant.ofEpochSecond(value.get("epochSecond").asLong(), value.get("nano").asLong());
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new WorkerException("Malformed worker message: missing " + field);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private JsonNode read(String line) {
        if (line == null || line.isBlank()) {
            throw new WorkerException("Empty worker message");
        }
        try {
            return objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new WorkerException("Malformed worker message: " + e.getOriginalMessage(), e);
        }
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new WorkerException("Failed to encode worker message", e);
        }
    }
}
