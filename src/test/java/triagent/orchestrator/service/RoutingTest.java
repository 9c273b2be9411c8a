package triagent.orchestrator.service;

import org.junit.jupiter.api.Test;
import triagent.orchestrator.model.TaskRoute;
import triagent.orchestrator.model.TaskType;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoutingTest {

    @Test
    void shardIsStableAcrossInstances() {
        ShardRouter first = new ShardRouter(3);
        ShardRouter second = new ShardRouter(3);

        for (int i = 0; i < 50; i++) {
            String key = "task-" + i;
            assertEquals(first.shardFor(key), second.shardFor(key));
        }
    }

    @Test
    void shardsStayInRange() {
        ShardRouter router = new ShardRouter(4);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            seen.add(router.shardFor("key-" + i));
        }
        assertEquals(Set.of("shard-0", "shard-1", "shard-2", "shard-3"), seen);
    }

    @Test
    void knownCrc32Value() {
        // CRC32("hello") = 0x3610A686 = 907060870; 907060870 % 3 = 1
        assertEquals("shard-1", new ShardRouter(3).shardFor("hello"));
    }

    @Test
    void shardRouterRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> new ShardRouter(0));
        assertThrows(IllegalArgumentException.class, () -> new ShardRouter(2).shardFor(null));
    }

    @Test
    void routingTableCoversEveryType() {
        TaskRouter router = new TaskRouter();

        assertEquals(new TaskRoute("codex", "impl"), router.route(TaskType.IMPLEMENTATION));
        assertEquals(new TaskRoute("claude", "review"), router.route(TaskType.REVIEW));
        assertEquals(new TaskRoute("gemini", "analysis"), router.route(TaskType.ANALYSIS));
        assertEquals("claude", router.route(TaskType.SECURITY).capability());
        assertEquals(TaskType.values().length, router.routes().size());
    }

    @Test
    void routingTableIsReadOnly() {
        TaskRouter router = new TaskRouter();
        assertThrows(UnsupportedOperationException.class,
                () -> router.routes().put(TaskType.SECURITY, new TaskRoute("gemini", "x")));
    }
}
