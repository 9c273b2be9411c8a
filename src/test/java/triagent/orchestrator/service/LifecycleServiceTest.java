package triagent.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import triagent.orchestrator.config.Dependencies;
import triagent.orchestrator.error.InvalidTransitionException;
import triagent.orchestrator.error.StoreUnavailableException;
import triagent.orchestrator.model.ConsensusResult;
import triagent.orchestrator.model.ConsensusSession;
import triagent.orchestrator.model.Escalation;
import triagent.orchestrator.model.EscalationStatus;
import triagent.orchestrator.model.FailResult;
import triagent.orchestrator.model.Priority;
import triagent.orchestrator.model.SubmitResult;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.TaskState;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.Vote;
import triagent.orchestrator.model.VoteOutcome;
import triagent.orchestrator.model.VoteValue;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.model.WorkerStatus;
import triagent.orchestrator.repository.ConsensusRepository;
import triagent.orchestrator.support.FakeExecutor;
import triagent.orchestrator.support.FakeProcessProbe;
import triagent.orchestrator.support.MutableClock;
import triagent.orchestrator.support.TestStores;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Dependencies deps;
    private LifecycleService lifecycle;
    private ConsensusService consensus;
    private WorkerPoolService pool;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(TestStores.config("test-lifecycle").withMaxRetriesPerTask(2),
                MutableClock.at("2026-03-01T10:00:00Z"), new FakeProcessProbe(), new FakeExecutor());
        lifecycle = deps.lifecycleService();
        consensus = deps.consensusService();
        pool = deps.workerPoolService();

        pool.register(Worker.builder().id("w-1").build());
        pool.markReady("w-1");
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private Task claimNew(String taskId, TaskType type, Priority priority) {
        deps.taskService().ensureTaskExists(taskId, null, type, priority, "do it", null);
        return claimAgain();
    }

    private Task claimAgain() {
        return pool.claimForWorker("w-1").orElseThrow();
    }

    private ConsensusSession submit(String taskId) {
        assertEquals(SubmitResult.SUBMITTED, lifecycle.submitForReview(taskId, "w-1", null, "patch"));
        return consensus.findOpenByTask(taskId).orElseThrow();
    }

    private ConsensusResult voteAll(ConsensusSession session, VoteValue value) {
        for (String voter : session.expectedVoters()) {
            consensus.recordVote(session.id(), voter, value, "found a bug in line 3", null);
        }
        return consensus.evaluate(session.id());
    }

    @Test
    void submitMovesToReviewAndOpensSession() {
        claimNew("t-1", TaskType.IMPLEMENTATION, Priority.MEDIUM);

        ConsensusSession session = submit("t-1");

        Task task = deps.taskService().findById("t-1").orElseThrow();
        assertEquals(TaskState.REVIEW, task.state());
        assertEquals("patch", task.result());
        assertEquals("codex", session.implementer());
        assertEquals(List.of("claude", "gemini"), session.expectedVoters());
        assertEquals(WorkerStatus.IDLE, pool.findById("w-1").orElseThrow().status());
        assertEquals(1, pool.findById("w-1").orElseThrow().tasksCompleted());
    }

    @Test
    void submitIsIdempotentAndOwnerChecked() {
        claimNew("t-2", TaskType.IMPLEMENTATION, Priority.MEDIUM);

        assertEquals(SubmitResult.WRONG_WORKER, lifecycle.submitForReview("t-2", "w-other", null, "x"));
        assertEquals(SubmitResult.SUBMITTED, lifecycle.submitForReview("t-2", "w-1", null, "x"));
        assertEquals(SubmitResult.ALREADY_SUBMITTED, lifecycle.submitForReview("t-2", "w-1", null, "x"));
        assertEquals(SubmitResult.NOT_FOUND, lifecycle.submitForReview("missing", "w-1", null, "x"));
        assertEquals(1, consensus.sessionsForTask("t-2").size());
    }

    @Test
    void passCompletesTask() {
        claimNew("t-3", TaskType.IMPLEMENTATION, Priority.MEDIUM);
        ConsensusSession session = submit("t-3");

        ConsensusResult result = voteAll(session, VoteValue.APPROVE);

        assertEquals(TaskState.COMPLETED, lifecycle.applyConsensus("t-3", result));
        Task task = deps.taskService().findById("t-3").orElseThrow();
        assertEquals(TaskState.COMPLETED, task.state());
        assertNotNull(task.completedAt());
    }

    @Test
    void failRequeuesWithFeedbackWhileRetriesRemain() throws Exception {
        claimNew("t-4", TaskType.IMPLEMENTATION, Priority.MEDIUM);
        ConsensusSession session = submit("t-4");

        assertEquals(TaskState.QUEUED, lifecycle.applyConsensus("t-4", voteAll(session, VoteValue.REJECT)));

        Task task = deps.taskService().findById("t-4").orElseThrow();
        assertEquals(TaskState.QUEUED, task.state());
        assertEquals(1, task.retryCount());
        JsonNode feedback = MAPPER.readTree(task.feedback());
        assertEquals(1, feedback.get("attempt").asInt());
        assertEquals("FAIL", feedback.get("result").asText());
        assertEquals(session.id(), feedback.get("sessionId").asText());
        assertEquals(2, feedback.get("votes").size());
        assertEquals("REJECT", feedback.get("votes").get(0).get("vote").asText());
        assertEquals("found a bug in line 3", feedback.get("votes").get(0).get("reason").asText());
    }

    @Test
    void rejectionAtRetryLimitEscalates() {
        claimNew("t-5", TaskType.IMPLEMENTATION, Priority.MEDIUM);
        for (int attempt = 0; attempt < 2; attempt++) {
            ConsensusSession session = submit("t-5");
            assertEquals(TaskState.QUEUED, lifecycle.applyConsensus("t-5", voteAll(session, VoteValue.REJECT)));
            claimAgain();
        }

        ConsensusSession last = submit("t-5");
        assertEquals(TaskState.ESCALATED, lifecycle.applyConsensus("t-5", voteAll(last, VoteValue.REJECT)));

        Task task = deps.taskService().findById("t-5").orElseThrow();
        assertEquals(TaskState.ESCALATED, task.state());
        assertEquals(2, task.retryCount());
        List<Escalation> escalations = lifecycle.escalationsForTask("t-5");
        assertEquals(1, escalations.size());
        assertEquals("MEDIUM", escalations.get(0).severity());
    }

    @Test
    void inconclusiveEscalatesImmediately() {
        claimNew("t-6", TaskType.SECURITY, Priority.MEDIUM);
        ConsensusSession session = submit("t-6");

        consensus.recordVote(session.id(), session.expectedVoters().get(0), VoteValue.APPROVE, null, null);
        consensus.recordVote(session.id(), session.expectedVoters().get(1), VoteValue.ABSTAIN, null, null);
        ConsensusResult result = consensus.evaluate(session.id());

        assertEquals(ConsensusResult.INCONCLUSIVE, result);
        assertEquals(TaskState.ESCALATED, lifecycle.applyConsensus("t-6", result));
        assertEquals("HIGH", lifecycle.escalationsForTask("t-6").get(0).severity());
    }

    @Test
    void pendingLeavesTaskAlone() {
        claimNew("t-7", TaskType.IMPLEMENTATION, Priority.MEDIUM);
        submit("t-7");

        assertEquals(TaskState.REVIEW, lifecycle.applyConsensus("t-7", ConsensusResult.PENDING));
    }

    @Test
    void consensusOnTaskOutsideReviewIsRejected() {
        claimNew("t-8", TaskType.IMPLEMENTATION, Priority.MEDIUM);

        assertThrows(InvalidTransitionException.class, () -> lifecycle.applyConsensus("t-8", ConsensusResult.PASS));
        assertEquals(TaskState.RUNNING, deps.taskService().findById("t-8").orElseThrow().state());
    }

    @Test
    void executorFailureRetriesThenEscalates() {
        claimNew("t-9", TaskType.ANALYSIS, Priority.CRITICAL);

        assertEquals(FailResult.RETRIED, lifecycle.failExecution("t-9", "w-1", "exit 1"));
        claimAgain();
        assertEquals(FailResult.RETRIED, lifecycle.failExecution("t-9", "w-1", "exit 1"));
        claimAgain();
        assertEquals(FailResult.ESCALATED, lifecycle.failExecution("t-9", "w-1", "exit 1"));

        Task task = deps.taskService().findById("t-9").orElseThrow();
        assertEquals(TaskState.ESCALATED, task.state());
        assertEquals("exit 1", task.error());
        assertEquals("HIGH", lifecycle.escalationsForTask("t-9").get(0).severity());
        assertEquals(3, pool.findById("w-1").orElseThrow().tasksFailed());
        assertEquals(FailResult.ALREADY_TERMINAL, lifecycle.failExecution("t-9", "w-1", "again"));
    }

    @Test
    void failureReportFromNonOwnerIsIgnored() {
        claimNew("t-10", TaskType.IMPLEMENTATION, Priority.MEDIUM);

        assertEquals(FailResult.WRONG_WORKER, lifecycle.failExecution("t-10", "w-other", "boom"));
        assertEquals(FailResult.NOT_FOUND, lifecycle.failExecution("missing", "w-1", "boom"));
        assertEquals(TaskState.RUNNING, deps.taskService().findById("t-10").orElseThrow().state());
    }

    @Test
    void operatorFailIsTerminal() {
        claimNew("t-11", TaskType.IMPLEMENTATION, Priority.MEDIUM);

        lifecycle.fail("t-11", "cancelled by operator");

        assertEquals(TaskState.FAILED, deps.taskService().findById("t-11").orElseThrow().state());
        assertEquals(WorkerStatus.IDLE, pool.findById("w-1").orElseThrow().status());
        assertThrows(InvalidTransitionException.class, () -> lifecycle.fail("t-11", "again"));
    }

    @Test
    void resolvingEscalationKeepsTaskEscalated() {
        claimNew("t-12", TaskType.IMPLEMENTATION, Priority.MEDIUM);
        lifecycle.failExecution("t-12", "w-1", "x");
        claimAgain();
        lifecycle.failExecution("t-12", "w-1", "x");
        claimAgain();
        lifecycle.failExecution("t-12", "w-1", "x");

        Escalation escalation = lifecycle.openEscalations().get(0);
        assertTrue(lifecycle.resolveEscalation(escalation.id(), "alice"));
        assertFalse(lifecycle.resolveEscalation(escalation.id(), "alice"));

        assertTrue(lifecycle.openEscalations().isEmpty());
        assertEquals(EscalationStatus.RESOLVED, lifecycle.escalationsForTask("t-12").get(0).status());
        assertEquals(TaskState.ESCALATED, deps.taskService().findById("t-12").orElseThrow().state());
    }

    @Test
    void failingTaskInReviewClosesItsSession() {
        claimNew("t-13", TaskType.IMPLEMENTATION, Priority.MEDIUM);
        ConsensusSession session = submit("t-13");

        lifecycle.fail("t-13", "cancelled by operator");

        assertEquals(ConsensusResult.CANCELLED, consensus.findById(session.id()).orElseThrow().finalResult());
        assertTrue(consensus.findOpenByTask("t-13").isEmpty());
        assertEquals(VoteOutcome.SESSION_CLOSED,
                consensus.recordVote(session.id(), "claude", VoteValue.APPROVE, "late", null));
        assertEquals(ConsensusResult.CANCELLED, consensus.evaluate(session.id()));
        assertEquals(TaskState.FAILED, deps.taskService().findById("t-13").orElseThrow().state());
    }

    @Test
    void voteCannotLandInAClosedSession() {
        claimNew("t-14", TaskType.IMPLEMENTATION, Priority.MEDIUM);
        ConsensusSession session = submit("t-14");
        assertTrue(deps.consensusRepository().complete(session.id(), ConsensusResult.FAIL, Instant.now()));

        Vote late = new Vote(session.id(), "gemini", VoteValue.APPROVE, null, 0L, Instant.now());

        assertEquals(VoteOutcome.SESSION_CLOSED, deps.consensusRepository().insertVote(late));
        assertTrue(consensus.votes(session.id()).isEmpty());
    }

    @Test
    void reviewThatCannotStartIsEscalated() {
        ConsensusService brokenConsensus = new ConsensusService(new SessionsUnavailable(deps.consensusRepository()),
                deps.auditRepository(), deps.config(), deps.clock());
        LifecycleService brokenLifecycle = new LifecycleService(deps.taskRepository(), deps.escalationRepository(),
                deps.auditRepository(), brokenConsensus, pool, deps.clock());
        claimNew("t-15", TaskType.IMPLEMENTATION, Priority.MEDIUM);

        assertEquals(SubmitResult.SUBMITTED, brokenLifecycle.submitForReview("t-15", "w-1", null, "patch"));

        Task task = deps.taskService().findById("t-15").orElseThrow();
        assertEquals(TaskState.ESCALATED, task.state());
        assertEquals("patch", task.result());
        assertTrue(consensus.findOpenByTask("t-15").isEmpty());
        List<Escalation> escalations = lifecycle.escalationsForTask("t-15");
        assertEquals(1, escalations.size());
        assertTrue(escalations.get(0).reason().contains("store down"));
        assertEquals(WorkerStatus.IDLE, pool.findById("w-1").orElseThrow().status());
    }

    /**
     * Consensus store that cannot create sessions.
     */
    private static final class SessionsUnavailable implements ConsensusRepository {

        private final ConsensusRepository delegate;

        SessionsUnavailable(ConsensusRepository delegate) {
            this.delegate = delegate;
        }

        @Override
        public void createSession(ConsensusSession session) {
            throw new StoreUnavailableException("create consensus session: store down", null);
        }

        @Override
        public Optional<ConsensusSession> findById(String sessionId) {
            return delegate.findById(sessionId);
        }

        @Override
        public Optional<ConsensusSession> findOpenByTask(String taskId) {
            return delegate.findOpenByTask(taskId);
        }

        @Override
        public List<ConsensusSession> findByTask(String taskId) {
            return delegate.findByTask(taskId);
        }

        @Override
        public VoteOutcome insertVote(Vote vote) {
            return delegate.insertVote(vote);
        }

        @Override
        public List<Vote> findVotes(String sessionId) {
            return delegate.findVotes(sessionId);
        }

        @Override
        public boolean complete(String sessionId, ConsensusResult result, Instant now) {
            return delegate.complete(sessionId, result, now);
        }
    }
}
