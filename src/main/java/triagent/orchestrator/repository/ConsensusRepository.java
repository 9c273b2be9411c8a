package triagent.orchestrator.repository;

import triagent.orchestrator.model.ConsensusResult;
import triagent.orchestrator.model.ConsensusSession;
import triagent.orchestrator.model.Vote;
import triagent.orchestrator.model.VoteOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for consensus sessions and their votes.
 */
public interface ConsensusRepository {

    /**
     * Persist a new PENDING session.
     */
    void createSession(ConsensusSession session);

    /**
     * Find a session by ID.
     */
    Optional<ConsensusSession> findById(String sessionId);

    /**
     * Find the PENDING session of a task, if any.
     */
    Optional<ConsensusSession> findOpenByTask(String taskId);

    /**
     * Find every session of a task, oldest first.
     */
    List<ConsensusSession> findByTask(String taskId);

    /**
     * Insert a vote while holding the session row, so it cannot land in a session
     * that closes concurrently.
     *
     * @return ACCEPTED, DUPLICATE_VOTE, SESSION_CLOSED or SESSION_NOT_FOUND
     */
    VoteOutcome insertVote(Vote vote);

    /**
     * Find the votes of a session in arrival order.
     */
    List<Vote> findVotes(String sessionId);

    /**
     * Store the final result. Only succeeds while the session is still PENDING.
     *
     * @return true if this call closed the session
     */
    boolean complete(String sessionId, ConsensusResult result, Instant now);
}
