package triagent.orchestrator.service;

import org.junit.jupiter.api.*;
import triagent.orchestrator.config.Dependencies;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.model.ConsensusResult;
import triagent.orchestrator.model.ConsensusSession;
import triagent.orchestrator.model.EventType;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.VoteOutcome;
import triagent.orchestrator.model.VoteValue;
import triagent.orchestrator.support.FakeExecutor;
import triagent.orchestrator.support.FakeProcessProbe;
import triagent.orchestrator.support.MutableClock;
import triagent.orchestrator.support.TestStores;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusServiceTest {

    private Dependencies deps;
    private ConsensusService consensus;

    private void start(OrchestratorConfig config) {
        deps = Dependencies.create(config, MutableClock.at("2026-03-01T10:00:00Z"), new FakeProcessProbe(),
                new FakeExecutor());
        consensus = deps.consensusService();
    }

    @BeforeEach
    void setUp() {
        start(TestStores.config("test-consensus"));
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private VoteOutcome vote(ConsensusSession session, String voter, VoteValue value) {
        return consensus.recordVote(session.id(), voter, value, value + " by " + voter, Duration.ofSeconds(2));
    }

    @Test
    void implementerIsExcludedFromVoters() {
        ConsensusSession session = consensus.createSession("t-1", "codex", TaskType.IMPLEMENTATION);

        assertEquals(List.of("claude", "gemini"), session.expectedVoters());
        assertEquals(2, session.requiredApprovals());
        assertTrue(session.isOpen());
        assertEquals(VoteOutcome.IMPLEMENTER_VOTE, vote(session, "codex", VoteValue.APPROVE));
        assertTrue(consensus.votes(session.id()).isEmpty());
    }

    @Test
    void twoApprovalsPass() {
        ConsensusSession session = consensus.createSession("t-2", "codex", TaskType.IMPLEMENTATION);

        assertEquals(VoteOutcome.ACCEPTED, vote(session, "claude", VoteValue.APPROVE));
        assertEquals(ConsensusResult.PENDING, consensus.evaluate(session.id()));
        assertEquals(VoteOutcome.ACCEPTED, vote(session, "gemini", VoteValue.APPROVE));

        assertEquals(ConsensusResult.PASS, consensus.evaluate(session.id()));
        assertFalse(consensus.findById(session.id()).orElseThrow().isOpen());
        assertEquals(1, deps.auditRepository().countByTaskAndType("t-2", EventType.CONSENSUS_DECIDED));
    }

    @Test
    void twoRejectionsFail() {
        ConsensusSession session = consensus.createSession("t-3", "claude", TaskType.ANALYSIS);

        vote(session, "codex", VoteValue.REJECT);
        vote(session, "gemini", VoteValue.REJECT);

        assertEquals(ConsensusResult.FAIL, consensus.evaluate(session.id()));
    }

    @Test
    void splitVoteIsInconclusiveOnceEveryoneResponded() {
        ConsensusSession session = consensus.createSession("t-4", "gemini", TaskType.REVIEW);

        vote(session, "claude", VoteValue.APPROVE);
        assertEquals(ConsensusResult.PENDING, consensus.evaluate(session.id()));
        vote(session, "codex", VoteValue.ABSTAIN);

        assertEquals(ConsensusResult.INCONCLUSIVE, consensus.evaluate(session.id()));
    }

    @Test
    void timeoutsAndErrorsCountAsResponses() {
        ConsensusSession session = consensus.createSession("t-5", "codex", TaskType.IMPLEMENTATION);

        vote(session, "claude", VoteValue.TIMEOUT);
        vote(session, "gemini", VoteValue.ERROR);

        assertEquals(ConsensusResult.INCONCLUSIVE, consensus.evaluate(session.id()));
    }

    @Test
    void duplicateUnknownAndLateVotesAreRejected() {
        ConsensusSession session = consensus.createSession("t-6", "codex", TaskType.IMPLEMENTATION);

        assertEquals(VoteOutcome.ACCEPTED, vote(session, "claude", VoteValue.APPROVE));
        assertEquals(VoteOutcome.DUPLICATE_VOTE, vote(session, "claude", VoteValue.REJECT));
        assertEquals(VoteOutcome.UNKNOWN_VOTER, vote(session, "mistral", VoteValue.APPROVE));
        assertEquals(VoteOutcome.SESSION_NOT_FOUND,
                consensus.recordVote("missing", "claude", VoteValue.APPROVE, null, null));

        vote(session, "gemini", VoteValue.APPROVE);
        consensus.evaluate(session.id());
        assertEquals(VoteOutcome.SESSION_CLOSED, vote(session, "gemini", VoteValue.REJECT));

        assertEquals(VoteValue.APPROVE, consensus.votes(session.id()).get(0).value());
        assertEquals(2, consensus.votes(session.id()).size());
    }

    @Test
    void closedSessionKeepsItsResult() {
        ConsensusSession session = consensus.createSession("t-7", "codex", TaskType.IMPLEMENTATION);
        vote(session, "claude", VoteValue.REJECT);
        vote(session, "gemini", VoteValue.REJECT);

        assertEquals(ConsensusResult.FAIL, consensus.evaluate(session.id()));
        assertEquals(ConsensusResult.FAIL, consensus.evaluate(session.id()));
        assertEquals(1, deps.auditRepository().countByTaskAndType("t-7", EventType.CONSENSUS_DECIDED));
        assertTrue(consensus.findOpenByTask("t-7").isEmpty());
    }

    @Test
    void securityNeedsEveryReviewerWithFourCapabilities() {
        deps.close();
        start(TestStores.config("test-consensus-4").withCapabilities("claude", "codex", "gemini", "mistral"));

        ConsensusSession session = consensus.createSession("sec", "claude", TaskType.SECURITY);
        assertEquals(3, session.requiredApprovals());

        vote(session, "codex", VoteValue.APPROVE);
        vote(session, "gemini", VoteValue.APPROVE);
        assertEquals(ConsensusResult.PENDING, consensus.evaluate(session.id()));

        vote(session, "mistral", VoteValue.APPROVE);
        assertEquals(ConsensusResult.PASS, consensus.evaluate(session.id()));
    }

    @Test
    void securityWithOneDissentIsNotAPass() {
        deps.close();
        start(TestStores.config("test-consensus-4b").withCapabilities("claude", "codex", "gemini", "mistral"));

        ConsensusSession session = consensus.createSession("sec-2", "claude", TaskType.SECURITY);
        vote(session, "codex", VoteValue.APPROVE);
        vote(session, "gemini", VoteValue.APPROVE);
        vote(session, "mistral", VoteValue.REJECT);

        assertEquals(ConsensusResult.INCONCLUSIVE, consensus.evaluate(session.id()));
    }

    @Test
    void requiredApprovalsIsClampedToVoters() {
        assertEquals(1, consensus.requiredApprovals(TaskType.IMPLEMENTATION, 1));
        assertEquals(2, consensus.requiredApprovals(TaskType.IMPLEMENTATION, 5));
        assertEquals(5, consensus.requiredApprovals(TaskType.SECURITY, 5));
        assertEquals(1, consensus.requiredApprovals(TaskType.SECURITY, 0));
    }

    @Test
    void noReviewersIsInconclusiveAtOnce() {
        deps.close();
        start(TestStores.config("test-consensus-solo").withCapabilities("codex"));

        ConsensusSession session = consensus.createSession("solo", "codex", TaskType.IMPLEMENTATION);

        assertTrue(session.expectedVoters().isEmpty());
        assertEquals(ConsensusResult.INCONCLUSIVE, consensus.evaluate(session.id()));
    }

    @Test
    void decisionRule() {
        assertEquals(ConsensusResult.PASS, ConsensusService.decide(2, 0, 2, 3, 2));
        assertEquals(ConsensusResult.FAIL, ConsensusService.decide(0, 2, 2, 3, 2));
        assertEquals(ConsensusResult.PENDING, ConsensusService.decide(1, 1, 2, 3, 2));
        assertEquals(ConsensusResult.INCONCLUSIVE, ConsensusService.decide(1, 1, 3, 3, 2));
        // Approval is checked first.
        assertEquals(ConsensusResult.PASS, ConsensusService.decide(1, 1, 2, 2, 1));
    }
}
