package triagent.orchestrator.service;

import org.junit.jupiter.api.*;
import triagent.orchestrator.config.Dependencies;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.model.ConsensusResult;
import triagent.orchestrator.model.Priority;
import triagent.orchestrator.model.SubmitResult;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.TaskState;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.Vote;
import triagent.orchestrator.model.VoteValue;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.support.FakeExecutor;
import triagent.orchestrator.support.FakeProcessProbe;
import triagent.orchestrator.support.MutableClock;
import triagent.orchestrator.support.TestStores;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReviewServiceTest {

    private FakeExecutor executor;
    private Dependencies deps;

    private void start(OrchestratorConfig config, SpendMeter meter) {
        executor = new FakeExecutor();
        deps = Dependencies.create(config, MutableClock.at("2026-03-01T10:00:00Z"), new FakeProcessProbe(),
                executor, meter);
        deps.workerPoolService().register(Worker.builder().id("w-1").build());
        deps.workerPoolService().markReady("w-1");
    }

    @BeforeEach
    void setUp() {
        start(TestStores.config("test-review"), SpendMeter.NONE);
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private void inReview(String taskId) {
        deps.taskService().ensureTaskExists(taskId, "Add retry", TaskType.IMPLEMENTATION, Priority.MEDIUM,
                "add retries to the client", null);
        deps.workerPoolService().claimForWorker("w-1").orElseThrow();
        assertEquals(SubmitResult.SUBMITTED,
                deps.lifecycleService().submitForReview(taskId, "w-1", null, "diff --git a/Client.java"));
    }

    private List<Vote> votesFor(String taskId) {
        return deps.consensusService().votes(deps.consensusService().sessionsForTask(taskId).get(0).id());
    }

    @Test
    void approvalsCompleteTheTask() {
        executor.reply("claude", "APPROVE - clean change").reply("gemini", "LGTM");
        inReview("t-1");

        assertEquals(ConsensusResult.PASS, deps.reviewService().review("t-1"));

        assertEquals(TaskState.COMPLETED, deps.taskService().findById("t-1").orElseThrow().state());
        assertEquals(0, executor.callCount("codex"), "the implementer never reviews its own work");
    }

    @Test
    void rejectionsSendTheTaskBackWithFeedback() {
        executor.reply("claude", "REJECT: missing null check").reply("gemini", "Rejected, no tests");
        inReview("t-2");

        assertEquals(ConsensusResult.FAIL, deps.reviewService().review("t-2"));

        Task task = deps.taskService().findById("t-2").orElseThrow();
        assertEquals(TaskState.QUEUED, task.state());
        assertTrue(task.feedback().contains("missing null check"));
    }

    @Test
    void timeoutCountsAsResponseWithoutApproval() {
        executor.timeOut("claude").reply("gemini", "APPROVED");
        inReview("t-3");

        assertEquals(ConsensusResult.INCONCLUSIVE, deps.reviewService().review("t-3"));

        assertEquals(TaskState.ESCALATED, deps.taskService().findById("t-3").orElseThrow().state());
        assertEquals(VoteValue.TIMEOUT, votesFor("t-3").stream()
                .filter(v -> v.voter().equals("claude")).findFirst().orElseThrow().value());
    }

    @Test
    void openBreakerVotesError() {
        deps.breakerService().recordFailure("gemini");
        deps.breakerService().recordFailure("gemini");
        deps.breakerService().recordFailure("gemini");
        executor.reply("claude", "approve");
        inReview("t-4");

        assertEquals(ConsensusResult.INCONCLUSIVE, deps.reviewService().review("t-4"));

        assertEquals(0, executor.callCount("gemini"));
        assertEquals(VoteValue.ERROR, votesFor("t-4").stream()
                .filter(v -> v.voter().equals("gemini")).findFirst().orElseThrow().value());
    }

    @Test
    void stopsAskingOnceDecided() {
        deps.close();
        start(TestStores.config("test-review-4").withCapabilities("claude", "codex", "gemini", "mistral"),
                SpendMeter.NONE);
        executor.reply("claude", "APPROVE").reply("gemini", "APPROVE").reply("mistral", "REJECT");
        inReview("t-5");

        assertEquals(ConsensusResult.PASS, deps.reviewService().review("t-5"));
        assertEquals(0, executor.callCount("mistral"));
    }

    @Test
    void noOpenSessionIsPending() {
        assertEquals(ConsensusResult.PENDING, deps.reviewService().review("nothing"));
    }

    @Test
    void reviewerCallsAreCharged() {
        deps.close();
        start(TestStores.config("test-review-spend"), (capability, prompt, output) -> new BigDecimal("0.05"));
        inReview("t-6");

        deps.reviewService().review("t-6");

        assertEquals(0, new BigDecimal("0.10").compareTo(deps.budgetGovernor().dailySpend()));
    }

    @Test
    void verdictParsing() {
        assertEquals(VoteValue.APPROVE, ReviewService.parseVerdict("APPROVE"));
        assertEquals(VoteValue.APPROVE, ReviewService.parseVerdict("Looks good. lgtm"));
        assertEquals(VoteValue.APPROVE, ReviewService.parseVerdict("Tests passed"));
        assertEquals(VoteValue.REJECT, ReviewService.parseVerdict("REJECT - SQL injection"));
        assertEquals(VoteValue.REJECT, ReviewService.parseVerdict("build failed"));
        assertEquals(VoteValue.REJECT, ReviewService.parseVerdict("Reject. I would not approve this."));
        assertEquals(VoteValue.APPROVE, ReviewService.parseVerdict("Approved; nothing to reject here"));
        assertEquals(VoteValue.ABSTAIN, ReviewService.parseVerdict("I am unable to review this"));
        assertEquals(VoteValue.TIMEOUT, ReviewService.parseVerdict("request timed out"));
        assertEquals(VoteValue.ERROR, ReviewService.parseVerdict("ERROR: rate limited"));
        assertEquals(VoteValue.ABSTAIN, ReviewService.parseVerdict("hmm"));
        assertEquals(VoteValue.ABSTAIN, ReviewService.parseVerdict(null));
        assertEquals(VoteValue.ABSTAIN, ReviewService.parseVerdict("  "));
    }

    @Test
    void reviewPromptCarriesTaskAndResult() {
        Task task = Task.builder().id("t").name("Add retry").type(TaskType.IMPLEMENTATION)
                .payload("add retries").result("diff").build();

        String prompt = ReviewService.reviewPrompt(task);

        assertTrue(prompt.contains("Add retry (IMPLEMENTATION)"));
        assertTrue(prompt.contains("security vulnerabilities"));
        assertTrue(prompt.contains("add retries"));
        assertTrue(prompt.endsWith("diff\n"));
    }
}
