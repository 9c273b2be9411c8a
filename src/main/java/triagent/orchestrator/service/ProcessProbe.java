package triagent.orchestrator.service;

import triagent.orchestrator.model.Worker;

/**
 * Looks at worker OS processes. A process is identified by pid, host and start
 * instant together; a bare pid may belong to anything on another host or after reuse.
 */
public interface ProcessProbe {

    enum Liveness {
        /** The worker's own process is running here */
        ALIVE,
        /** No process with that identity exists here */
        GONE,
        /** Remote host or incomplete identity; nothing can be said */
        UNVERIFIABLE
    }

    Liveness liveness(Worker worker);

    /**
     * Forcibly terminate the worker's process, only when it is verifiably {@link Liveness#ALIVE}.
     *
     * @return true if a kill signal was delivered
     */
    boolean terminate(Worker worker);
}
