package com.relationalizer.store;

import java.util.stream.Stream;

import com.relationalizer.model.RawDocument;

/**
 * A store of raw listing documents. Each call to {@link #documents()} starts a new pass; the
 * returned stream holds resources and must be closed.
 */
public interface RawDocumentSource {

    String getName();

    Stream<RawDocument> documents();
}
