package com.adlanda.codexai.model;

/**
 * Outcome of a full project index rebuild.
 *
 * @param success           Whether the rebuild ran to completion
 * @param message           Human readable summary
 * @param documentsDeleted  Documents removed from the index before re-indexing
 * @param documentsIndexed  Documents indexed again
 * @param documentsSkipped  Documents that vanished or failed and were skipped
 */
public record RebuildResult(
        boolean success,
        String message,
        int documentsDeleted,
        int documentsIndexed,
        int documentsSkipped
) {}
