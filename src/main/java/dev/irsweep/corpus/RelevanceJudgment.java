package dev.irsweep.corpus;

/**
 * A binary relevance judgment: {@code documentId} is relevant to {@code queryId}.
 *
 * @param queryId the judged query
 * @param documentId the relevant document
 */
public record RelevanceJudgment(String queryId, String documentId) {}
