package triagent.orchestrator.service;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Stable task-key to shard mapping, reproducible across restarts and processes.
 */
public final class ShardRouter {

    private final int shardCount;

    public ShardRouter(int shardCount) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be positive");
        }
        this.shardCount = shardCount;
    }

    /**
     * @return {@code "shard-" + CRC32(key) mod shardCount}
     */
    public String shardFor(String taskKey) {
        if (taskKey == null) {
            throw new IllegalArgumentException("taskKey is required");
        }
        CRC32 crc = new CRC32();
        crc.update(taskKey.getBytes(StandardCharsets.UTF_8));
        return "shard-" + (crc.getValue() % shardCount);
    }

    public int shardCount() {
        return shardCount;
    }
}
