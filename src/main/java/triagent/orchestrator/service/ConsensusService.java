package triagent.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.model.AuditEvent;
import triagent.orchestrator.model.ConsensusResult;
import triagent.orchestrator.model.ConsensusSession;
import triagent.orchestrator.model.EventType;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.Vote;
import triagent.orchestrator.model.VoteOutcome;
import triagent.orchestrator.model.VoteValue;
import triagent.orchestrator.repository.AuditRepository;
import triagent.orchestrator.repository.ConsensusRepository;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Multi-voter approval gate.
 *
 * Every configured capability except the implementer is an expected voter.
 * With M required approvals a session passes at M approvals, fails at M rejections
 * and is inconclusive once every expected voter answered without reaching either.
 */
public class ConsensusService {

    private static final Logger log = LoggerFactory.getLogger(ConsensusService.class);

    private final ConsensusRepository consensusRepository;
    private final AuditRepository auditRepository;
    private final OrchestratorConfig config;
    private final Clock clock;

    public ConsensusService(ConsensusRepository consensusRepository, AuditRepository auditRepository,
            OrchestratorConfig config, Clock clock) {
        this.consensusRepository = consensusRepository;
        this.auditRepository = auditRepository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Open a review session for a submitted result.
     *
     * @param implementer capability that produced the result
     * @param type        task type, selects majority or unanimous policy
     */
    public ConsensusSession createSession(String taskId, String implementer, TaskType type) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (implementer == null || implementer.isBlank()) {
            throw new IllegalArgumentException("implementer is required");
        }

        List<String> voters = config.capabilities().stream()
                .filter(capability -> !capability.equals(implementer))
                .collect(Collectors.toList());
        int required = requiredApprovals(type, voters.size());

        ConsensusSession session = new ConsensusSession(UUID.randomUUID().toString(), taskId, implementer,
                required, voters, clock.instant(), null, ConsensusResult.PENDING);
        consensusRepository.createSession(session);

        log.info("Consensus session {} opened for task {} (implementer={}, voters={}, required={})",
                session.id(), taskId, implementer, voters, required);
        return session;
    }

    /**
     * M for a session with the given number of voters: MIN_APPROVALS, or every voter
     * for unanimous task types, clamped to [1, voters].
     */
    public int requiredApprovals(TaskType type, int voterCount) {
        int required = type != null && config.unanimousTaskTypes().contains(type)
                ? voterCount
                : config.minApprovals();
        return Math.max(1, Math.min(required, voterCount));
    }

    /**
     * Record one vote. Rejected votes leave the session untouched.
     */
    public VoteOutcome recordVote(String sessionId, String voter, VoteValue value, String reason,
            Duration duration) {
        if (voter == null || voter.isBlank()) {
            throw new IllegalArgumentException("voter is required");
        }
        if (value == null) {
            throw new IllegalArgumentException("vote is required");
        }

        Optional<ConsensusSession> found = consensusRepository.findById(sessionId);
        if (found.isEmpty()) {
            return rejected(sessionId, voter, VoteOutcome.SESSION_NOT_FOUND);
        }
        ConsensusSession session = found.get();
        if (voter.equals(session.implementer())) {
            return rejected(sessionId, voter, VoteOutcome.IMPLEMENTER_VOTE);
        }
        if (!session.expectedVoters().contains(voter)) {
            return rejected(sessionId, voter, VoteOutcome.UNKNOWN_VOTER);
        }
        if (!session.isOpen()) {
            return rejected(sessionId, voter, VoteOutcome.SESSION_CLOSED);
        }

        long durationMs = duration != null ? duration.toMillis() : 0L;
        Vote vote = new Vote(sessionId, voter, value, reason, durationMs, clock.instant());
        VoteOutcome inserted = consensusRepository.insertVote(vote);
        if (!inserted.accepted()) {
            return rejected(sessionId, voter, inserted);
        }

        auditRepository.record(AuditEvent.of(EventType.VOTE_RECORDED, session.taskId(), null, voter,
                value + (reason != null && !reason.isBlank() ? ": " + abbreviate(reason) : "")));
        log.info("Vote {} from {} on task {}", value, voter, session.taskId());
        return VoteOutcome.ACCEPTED;
    }

    /**
     * Evaluate a session and store the result once it is final.
     * A closed session returns its stored result.
     */
    public ConsensusResult evaluate(String sessionId) {
        ConsensusSession session = consensusRepository.findById(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown consensus session: " + sessionId));
        if (!session.isOpen()) {
            return session.finalResult();
        }

        List<Vote> votes = consensusRepository.findVotes(sessionId);
        int approvals = 0;
        int rejections = 0;
        for (Vote vote : votes) {
            if (vote.value() == VoteValue.APPROVE) {
                approvals++;
            } else if (vote.value() == VoteValue.REJECT) {
                rejections++;
            }
        }

        ConsensusResult result = decide(approvals, rejections, votes.size(), session.expectedVoters().size(),
                session.requiredApprovals());
        if (!result.isFinal()) {
            return result;
        }

        if (consensusRepository.complete(sessionId, result, clock.instant())) {
            auditRepository.record(AuditEvent.of(EventType.CONSENSUS_DECIDED, session.taskId(), null, "consensus",
                    result + " (" + approvals + " approve, " + rejections + " reject, "
                            + votes.size() + "/" + session.expectedVoters().size() + " responded)"));
            log.info("Consensus for task {}: {} ({}/{} approvals)", session.taskId(), result, approvals,
                    session.requiredApprovals());
            return result;
        }

        // Someone else closed it first.
        return consensusRepository.findById(sessionId).map(ConsensusSession::finalResult).orElse(result);
    }

    /**
     * Close every open session of a task as CANCELLED; later votes are refused.
     *
     * @return number of sessions this call closed
     */
    public int cancelOpen(String taskId, String reason) {
        int cancelled = 0;
        for (ConsensusSession session : consensusRepository.findByTask(taskId)) {
            if (session.isOpen() && consensusRepository.complete(session.id(), ConsensusResult.CANCELLED,
                    clock.instant())) {
                cancelled++;
                auditRepository.record(AuditEvent.of(EventType.CONSENSUS_DECIDED, taskId, null, "consensus",
                        ConsensusResult.CANCELLED + " (" + reason + ")"));
                log.info("Consensus session {} of task {} cancelled: {}", session.id(), taskId, reason);
            }
        }
        return cancelled;
    }

    /**
     * Decision rule. Approval wins ties with rejection since it is checked first.
     */
    public static ConsensusResult decide(int approvals, int rejections, int responded, int expected, int required) {
        if (approvals >= required) {
            return ConsensusResult.PASS;
        }
        if (rejections >= required) {
            return ConsensusResult.FAIL;
        }
        if (responded >= expected) {
            return ConsensusResult.INCONCLUSIVE;
        }
        return ConsensusResult.PENDING;
    }

    public Optional<ConsensusSession> findOpenByTask(String taskId) {
        return consensusRepository.findOpenByTask(taskId);
    }

    public Optional<ConsensusSession> findById(String sessionId) {
        return consensusRepository.findById(sessionId);
    }

    public List<ConsensusSession> sessionsForTask(String taskId) {
        return consensusRepository.findByTask(taskId);
    }

    public List<Vote> votes(String sessionId) {
        return consensusRepository.findVotes(sessionId);
    }

    private VoteOutcome rejected(String sessionId, String voter, VoteOutcome outcome) {
        log.warn("Vote from {} on session {} rejected: {}", voter, sessionId, outcome);
        return outcome;
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
