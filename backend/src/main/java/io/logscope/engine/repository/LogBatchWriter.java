package io.logscope.engine.repository;

import io.logscope.engine.model.LogRecord;
import java.util.List;

/**
 * Sink the ingestion buffer drains into. Implementations insert the whole batch or throw.
 */
@FunctionalInterface
public interface LogBatchWriter {

    void insertBatch(List<LogRecord> records);
}
