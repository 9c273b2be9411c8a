package triagent.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * Review round for one submitted result.
 *
 * @param implementer    capability that produced the result; never a voter
 * @param expectedVoters every configured capability except the implementer
 */
public record ConsensusSession(
        String id,
        String taskId,
        String implementer,
        int requiredApprovals,
        List<String> expectedVoters,
        Instant createdAt,
        Instant completedAt,
        ConsensusResult finalResult) {

    public ConsensusSession {
        expectedVoters = List.copyOf(expectedVoters);
    }

    public boolean isOpen() {
        return finalResult == ConsensusResult.PENDING;
    }
}
