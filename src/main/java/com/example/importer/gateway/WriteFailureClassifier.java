package com.example.importer.gateway;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Splits database failures into retryable ones (connection drops, lock and query timeouts) and everything else
 * (constraint violations, type mismatches, bad SQL).
 */
public final class WriteFailureClassifier {

    private WriteFailureClassifier() {
    }

    public static BatchWriteResult.Outcome classify(DataAccessException e) {
        if (e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException) {
            return BatchWriteResult.Outcome.TRANSIENT_ERROR;
        }
        return BatchWriteResult.Outcome.FATAL_ERROR;
    }

    public static BatchWriteResult toResult(DataAccessException e) {
        String message = e.getMostSpecificCause().getMessage();
        return classify(e) == BatchWriteResult.Outcome.TRANSIENT_ERROR
                ? BatchWriteResult.transientError(message)
                : BatchWriteResult.fatalError(message);
    }
}
