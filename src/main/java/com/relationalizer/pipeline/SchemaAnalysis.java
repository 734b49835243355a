package com.relationalizer.pipeline;

import java.util.List;

import com.relationalizer.model.AggregateSchema;
import com.relationalizer.model.TableGraph;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of the schema discovery pass.
 */
@Value
@Builder
public class SchemaAnalysis {
    AggregateSchema aggregate;
    TableGraph tableGraph;
    List<String> ddl;
    List<DocumentFailure> failures;
    long documentsRead;

    public long getDocumentsProfiled() {
        return aggregate.getDocumentCount();
    }
}
