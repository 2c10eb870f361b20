package com.purchasingpower.knowledgegraph.provenance.impl;

import com.purchasingpower.knowledgegraph.provenance.ProvenanceService;
import com.purchasingpower.knowledgegraph.util.StoreCallLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes provenance records to the {@code provenance} logger so they can be routed to their
 * own appender.
 */
@Service
public class LoggingProvenanceService implements ProvenanceService {

    private static final Logger PROVENANCE = LoggerFactory.getLogger("provenance");

    private final Map<String, OpenOperation> openOperations = new ConcurrentHashMap<>();

    @Override
    public String startOperation(String toolId, String operationType, List<String> inputs,
                                 Map<String, Object> parameters) {
        String operationId = UUID.randomUUID().toString();
        openOperations.put(operationId, new OpenOperation(toolId, operationType, Instant.now()));
        PROVENANCE.info("START op={} tool={} type={} inputs={} params={}",
            operationId, toolId, operationType, StoreCallLogger.formatIds(inputs), parameters);
        return operationId;
    }

    @Override
    public void completeOperation(String operationId, List<String> outputs, boolean success,
                                  Map<String, Object> metadata, String errorMessage) {
        OpenOperation open = openOperations.remove(operationId);
        if (open == null) {
            PROVENANCE.warn("COMPLETE for unknown op={}", operationId);
            return;
        }
        long elapsedMs = Duration.between(open.startedAt(), Instant.now()).toMillis();
        if (success) {
            PROVENANCE.info("COMPLETE op={} tool={} type={} outputs={} metadata={} ({}ms)",
                operationId, open.toolId(), open.operationType(), StoreCallLogger.formatIds(outputs),
                metadata, elapsedMs);
        } else {
            PROVENANCE.warn("FAILED op={} tool={} type={} error={} metadata={} ({}ms)",
                operationId, open.toolId(), open.operationType(), errorMessage, metadata, elapsedMs);
        }
    }

    int openOperationCount() {
        return openOperations.size();
    }

    private record OpenOperation(String toolId, String operationType, Instant startedAt) {
    }
}
