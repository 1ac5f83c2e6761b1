package com.questrail.spe.observability;

/**
 * Main interface for receiving SPE decode observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface SpeObservabilitySink {
    /**
     * Called once the fixed header has been decoded.
     * @param event header summary
     */
    void onHeaderDecoded(SpeHeaderEvent event);

    /**
     * Called for each metadata document section skipped as unrecognised.
     * @param event the skipped section
     */
    void onSectionIgnored(SpeIgnoredSectionEvent event);

    /**
     * Called when a recognised but unsupported structure is omitted from the result.
     * @param event the omitted feature
     */
    void onWarning(SpeWarningEvent event);

    /**
     * Called when a dataset has been assembled.
     * @param event decode summary
     */
    void onDecodeCompleted(SpeDecodeCompletedEvent event);

    /**
     * Called when a decode is aborted.
     * @param event the error event
     */
    void onError(SpeErrorEvent event);
}
