package triagent.orchestrator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.model.RecoveryReport;
import triagent.orchestrator.service.HeartbeatService;

/**
 * Background pass that recovers busy workers whose heartbeat went stale.
 *
 * For each stale worker:
 * 1. Its RUNNING tasks go back to QUEUED, retry count unchanged
 * 2. It is marked dead when its process is gone, crashed when the process is still there
 */
public class StaleWorkerReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleWorkerReaper.class);

    private final HeartbeatService heartbeatService;

    public StaleWorkerReaper(HeartbeatService heartbeatService) {
        this.heartbeatService = heartbeatService;
    }

    @Override
    public void run() {
        try {
            reap();
        } catch (Exception e) {
            log.error("Stale worker reaper error", e);
        }
    }

    /**
     * @return what this pass recovered
     */
    public RecoveryReport reap() {
        return heartbeatService.recoverStaleWorkers();
    }
}
