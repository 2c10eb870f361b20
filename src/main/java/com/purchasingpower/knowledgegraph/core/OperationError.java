package com.purchasingpower.knowledgegraph.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured error attached to a failed operation result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationError {

    private ErrorKind kind;
    private String message;

    @Builder.Default
    private List<String> missingEntityIds = new ArrayList<>();

    public static OperationError validation(String message) {
        return OperationError.builder()
            .kind(ErrorKind.VALIDATION)
            .message(message)
            .build();
    }

    public static OperationError unavailable(String message) {
        return OperationError.builder()
            .kind(ErrorKind.DATASTORE_UNAVAILABLE)
            .message(message)
            .build();
    }

    public static OperationError missingEntities(List<String> missingEntityIds) {
        return OperationError.builder()
            .kind(ErrorKind.REFERENTIAL_INTEGRITY)
            .message("Entities not found in graph: " + String.join(", ", missingEntityIds))
            .missingEntityIds(new ArrayList<>(missingEntityIds))
            .build();
    }

    public static OperationError internal(String message) {
        return OperationError.builder()
            .kind(ErrorKind.INTERNAL)
            .message(message)
            .build();
    }
}
