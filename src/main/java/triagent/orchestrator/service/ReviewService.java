package triagent.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.error.CircuitOpenException;
import triagent.orchestrator.executor.ExecutorException;
import triagent.orchestrator.executor.ExecutorTimeoutException;
import triagent.orchestrator.executor.ModelExecutor;
import triagent.orchestrator.model.ConsensusResult;
import triagent.orchestrator.model.ConsensusSession;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.Vote;
import triagent.orchestrator.model.VoteValue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects votes for a task in REVIEW by asking every expected reviewer capability
 * through its circuit breaker, then applies the consensus outcome.
 */
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private static final Pattern APPROVE = Pattern.compile("\\b(APPROVED?|PASS(ED)?|LGTM)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern REJECT = Pattern.compile("\\b(REJECT(ED)?|FAIL(ED)?|BLOCK(ED)?)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ABSTAIN = Pattern.compile("\\b(ABSTAIN|SKIP|UNABLE)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TIMEOUT = Pattern.compile("\\bTIMEOUT\\b|\\btimed out\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ERROR = Pattern.compile("\\bERROR\\b", Pattern.CASE_INSENSITIVE);

    private static final int MAX_REASON = 500;

    private final ConsensusService consensusService;
    private final LifecycleService lifecycleService;
    private final TaskService taskService;
    private final CircuitBreakerService breakerService;
    private final BudgetGovernor budgetGovernor;
    private final ModelExecutor executor;
    private final SpendMeter spendMeter;
    private final OrchestratorConfig config;
    private final Clock clock;

    public ReviewService(ConsensusService consensusService, LifecycleService lifecycleService,
            TaskService taskService, CircuitBreakerService breakerService, BudgetGovernor budgetGovernor,
            ModelExecutor executor, SpendMeter spendMeter, OrchestratorConfig config, Clock clock) {
        this.consensusService = consensusService;
        this.lifecycleService = lifecycleService;
        this.taskService = taskService;
        this.breakerService = breakerService;
        this.budgetGovernor = budgetGovernor;
        this.executor = executor;
        this.spendMeter = spendMeter;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Run the open review round for a task.
     *
     * @return the consensus result; PENDING if there was no open session or votes are still missing
     */
    public ConsensusResult review(String taskId) {
        Optional<ConsensusSession> open = consensusService.findOpenByTask(taskId);
        if (open.isEmpty()) {
            log.debug("No open consensus session for task {}", taskId);
            return ConsensusResult.PENDING;
        }
        ConsensusSession session = open.get();
        Task task = taskService.findById(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));

        Set<String> voted = new HashSet<>();
        for (Vote vote : consensusService.votes(session.id())) {
            voted.add(vote.voter());
        }

        String prompt = reviewPrompt(task);
        ConsensusResult result = ConsensusResult.PENDING;
        for (String voter : session.expectedVoters()) {
            if (voted.contains(voter)) {
                continue;
            }
            askReviewer(session, voter, prompt);
            result = consensusService.evaluate(session.id());
            if (result.isFinal()) {
                break;
            }
        }

        if (result.isFinal()) {
            lifecycleService.applyConsensus(taskId, result);
        }
        return result;
    }

    private void askReviewer(ConsensusSession session, String voter, String prompt) {
        Instant started = clock.instant();
        VoteValue value;
        String reason;
        try {
            String output = breakerService.execute(voter,
                    () -> executor.execute(voter, prompt, config.executorTimeout()));
            chargeFor(voter, prompt, output, session.taskId());
            value = parseVerdict(output);
            reason = abbreviate(output);
        } catch (ExecutorTimeoutException e) {
            value = VoteValue.TIMEOUT;
            reason = e.getMessage();
        } catch (ExecutorException e) {
            value = VoteValue.ERROR;
            reason = e.getMessage();
        } catch (CircuitOpenException e) {
            value = VoteValue.ERROR;
            reason = e.getMessage();
        }

        Duration took = Duration.between(started, clock.instant());
        consensusService.recordVote(session.id(), voter, value, reason, took);
    }

    private void chargeFor(String capability, String prompt, String output, String taskId) {
        BigDecimal cost = spendMeter.cost(capability, prompt, output);
        if (cost != null && cost.signum() > 0) {
            budgetGovernor.recordSpend(cost, capability, taskId);
        }
    }

    /**
     * Read a verdict out of free-form reviewer output. When both approval and
     * rejection keywords appear, the one that comes first wins.
     */
    public static VoteValue parseVerdict(String output) {
        if (output == null || output.isBlank()) {
            return VoteValue.ABSTAIN;
        }

        int approveAt = firstMatch(APPROVE, output);
        int rejectAt = firstMatch(REJECT, output);
        if (approveAt >= 0 && (rejectAt < 0 || approveAt < rejectAt)) {
            return VoteValue.APPROVE;
        }
        if (rejectAt >= 0) {
            return VoteValue.REJECT;
        }
        if (firstMatch(ABSTAIN, output) >= 0) {
            return VoteValue.ABSTAIN;
        }
        if (firstMatch(TIMEOUT, output) >= 0) {
            return VoteValue.TIMEOUT;
        }
        if (firstMatch(ERROR, output) >= 0) {
            return VoteValue.ERROR;
        }
        return VoteValue.ABSTAIN;
    }

    static String reviewPrompt(Task task) {
        StringBuilder prompt = new StringBuilder()
                .append("Review this result of task ").append(task.name())
                .append(" (").append(task.type()).append(") for issues, bugs, security vulnerabilities,")
                .append(" and best practices. Reply with APPROVE or REJECT followed by your findings.\n");
        if (task.payload() != null) {
            prompt.append("\nTask:\n").append(task.payload()).append('\n');
        }
        prompt.append("\nResult:\n").append(task.result() != null ? task.result() : "").append('\n');
        return prompt.toString();
    }

    private static int firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.start() : -1;
    }

    private static String abbreviate(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= MAX_REASON ? trimmed : trimmed.substring(0, MAX_REASON) + "...";
    }
}
