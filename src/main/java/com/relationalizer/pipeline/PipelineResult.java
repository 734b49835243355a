package com.relationalizer.pipeline;

import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a conversion run.
 */
@Data
@Builder
public class PipelineResult {
    private boolean success;
    private String errorMessage;
    private SchemaAnalysis analysis;

    private long documentsRead;
    private long documentsWritten;
    private long documentsSkipped;
    private long statementsWritten;
    private int tablesCreated;

    @Builder.Default
    private List<DocumentFailure> failures = List.of();

    public static PipelineResult failure(String errorMessage) {
        return PipelineResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
