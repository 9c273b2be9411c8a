package triagent.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.server.RouterHandler;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InternalDtoTest {

    private final ObjectMapper mapper = RouterHandler.mapper();

    @Test
    void heartbeatRequestDeserialization() throws Exception {
        String json = """
                {
                  "workerId": "w-7",
                  "taskId": "t-1",
                  "progress": 0.25,
                  "expectedTimeoutSeconds": 600
                }
                """;

        HeartbeatRequest req = mapper.readValue(json, HeartbeatRequest.class);

        assertEquals("w-7", req.workerId());
        assertEquals("t-1", req.taskId());
        assertEquals(0.25, req.progress(), 0.0001);
        assertEquals(Duration.ofMinutes(10), req.expectedTimeout());
        assertDoesNotThrow(req::validate);
    }

    @Test
    void heartbeatRequestValidation() {
        assertThrows(IllegalArgumentException.class, new HeartbeatRequest("", null, 0.5, null)::validate);
        assertThrows(IllegalArgumentException.class, new HeartbeatRequest("w", null, 1.5, null)::validate);
        assertThrows(IllegalArgumentException.class, new HeartbeatRequest("w", null, 0.5, -1L)::validate);
        assertNull(new HeartbeatRequest("w", null, 0.0, null).expectedTimeout());
    }

    @Test
    void registerRequestBuildsWorker() throws Exception {
        String json = """
                {"workerId": "w-1", "pid": 321, "host": "build-7", "processStartedAt": "2026-03-01T09:59:58Z",
                 "shard": "shard-2", "model": "gemini", "specialization": ["analysis", "REVIEW"]}
                """;

        RegisterWorkerRequest req = mapper.readValue(json, RegisterWorkerRequest.class);
        req.validate();
        Worker worker = req.toWorker();

        assertEquals("w-1", worker.id());
        assertEquals(321L, worker.pid());
        assertEquals("build-7", worker.host());
        assertEquals(Instant.parse("2026-03-01T09:59:58Z"), worker.processStartedAt());
        assertEquals("shard-2", worker.shard());
        assertEquals(EnumSet.of(TaskType.ANALYSIS, TaskType.REVIEW), worker.specialization());
    }

    @Test
    void registerRequestValidation() {
        assertThrows(IllegalArgumentException.class,
                new RegisterWorkerRequest(" ", null, null, null, null, null, null)::validate);
        assertThrows(IllegalArgumentException.class,
                new RegisterWorkerRequest("w", 0L, null, null, null, null, null)::validate);
        assertThrows(IllegalArgumentException.class,
                new RegisterWorkerRequest("w", 1L, null, null, null, null, List.of("cooking"))::validate);
    }

    @Test
    void operationResponseSerialization() throws Exception {
        String json = mapper.writeValueAsString(OperationResponse.success("SUBMITTED"));
        assertTrue(json.contains("\"ok\":true"));
        assertTrue(json.contains("\"outcome\":\"SUBMITTED\""));
        assertFalse(json.contains("error"));

        String failed = mapper.writeValueAsString(OperationResponse.error("WRONG_WORKER", "owned by w-2"));
        assertTrue(failed.contains("\"ok\":false"));
        assertTrue(failed.contains("\"error\":\"owned by w-2\""));
    }

    @Test
    void messageEnvelopeUsesSnakeCaseFields() throws Exception {
        String json = """
                {
                  "id": "m-1",
                  "type": "TASK_REJECT",
                  "source": "gemini",
                  "target": "orchestrator",
                  "timestamp": "2026-03-01T10:00:00Z",
                  "task_id": "t-9",
                  "payload": {"reason": "no tests", "confidence": 0.8},
                  "trace_id": "trace-1"
                }
                """;

        MessageEnvelope message = mapper.readValue(json, MessageEnvelope.class);

        assertEquals(MessageType.TASK_REJECT, message.type());
        assertEquals("t-9", message.taskId());
        assertEquals("trace-1", message.traceId());
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), message.timestamp());
        assertEquals("no tests", message.payloadText("reason"));
        assertEquals(0.8, message.payloadDouble("confidence", 0), 0.0001);
        assertEquals(0.5, message.payloadDouble("missing", 0.5), 0.0001);
        assertNull(message.payloadText("missing"));
        assertDoesNotThrow(message::validate);

        String out = mapper.writeValueAsString(message);
        assertTrue(out.contains("\"task_id\":\"t-9\""));
        assertTrue(out.contains("\"timestamp\":\"2026-03-01T10:00:00Z\""));
    }

    @Test
    void messageEnvelopeValidationPerType() {
        assertThrows(IllegalArgumentException.class,
                new MessageEnvelope("m", null, "a", null, null, "t", null, null)::validate);
        assertThrows(IllegalArgumentException.class,
                new MessageEnvelope("m", MessageType.TASK_APPROVE, null, null, null, "t", null, null)::validate);
        assertThrows(IllegalArgumentException.class,
                new MessageEnvelope("m", MessageType.TASK_ASSIGN, "ops", null, null, null, null, null)::validate);
        assertThrows(IllegalArgumentException.class,
                new MessageEnvelope("m", MessageType.CONTROL_PAUSE, "ops", " ", null, null, null, null)::validate);
        assertDoesNotThrow(new MessageEnvelope("m", MessageType.CONTROL_RESUME, "ops",
                MessageEnvelope.ALL_WORKERS, null, null, null, null)::validate);
    }
}
