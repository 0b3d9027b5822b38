package net.stepwise.adapter.jdbc.work;

import com.fasterxml.jackson.databind.JsonNode;
import net.stepwise.core.exception.ValidationException;
import net.stepwise.core.work.RangeWorkDescriptor;

import java.time.Duration;
import java.util.Optional;

/**
 * 범위형 JDBC 작업의 선택 인자. JSON 객체 {"keyColumn", "batchSize", "subBatchSize", "subBatchPauseMs"}.
 */
public record RangeOptions(String keyColumn, long batchSize, long subBatchSize, Duration subBatchPause) {

    public static final RangeOptions DEFAULTS = new RangeOptions("id",
            RangeWorkDescriptor.DEFAULT_BATCH_SIZE,
            RangeWorkDescriptor.DEFAULT_SUB_BATCH_SIZE,
            RangeWorkDescriptor.DEFAULT_SUB_BATCH_PAUSE);

    public RangeOptions {
        SqlIdentifiers.require("key column", keyColumn);
        if (batchSize <= 0 || subBatchSize <= 0) throw new ValidationException("batch sizes must be positive");
        if (subBatchPause.isNegative()) throw new ValidationException("subBatchPauseMs must not be negative");
    }

    public static RangeOptions from(Optional<JsonNode> node) {
        if (node.isEmpty()) return DEFAULTS;
        JsonNode n = node.get();
        if (!n.isObject()) throw new ValidationException("range options must be a JSON object: " + n);
        return new RangeOptions(
                n.path("keyColumn").asText(DEFAULTS.keyColumn),
                n.path("batchSize").asLong(DEFAULTS.batchSize),
                n.path("subBatchSize").asLong(DEFAULTS.subBatchSize),
                n.has("subBatchPauseMs") ? Duration.ofMillis(n.get("subBatchPauseMs").asLong()) : DEFAULTS.subBatchPause);
    }
}
