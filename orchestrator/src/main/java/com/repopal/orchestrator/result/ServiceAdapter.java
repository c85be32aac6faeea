package com.repopal.orchestrator.result;

/**
 * Delivers pipeline outcomes back to a service (GitHub comment, Slack thread...).
 * Formatting the message is the adapter's business.
 */
public interface ServiceAdapter {

    /** Matches {@code StandardizedEvent.service()} and the entries of metadata {@code notify}. */
    String serviceName();

    void notifySuccess(PipelineSummary summary);

    /**
     * @param error human-readable summary, never a stack trace
     */
    void notifyError(PipelineSummary summary, String error);
}
