package com.questrail.spe.observability;

/**
 * No-op implementation of SpeObservabilitySink.
 */
public final class NullObservabilitySink implements SpeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onHeaderDecoded(SpeHeaderEvent event) {}

    @Override
    public void onSectionIgnored(SpeIgnoredSectionEvent event) {}

    @Override
    public void onWarning(SpeWarningEvent event) {}

    @Override
    public void onDecodeCompleted(SpeDecodeCompletedEvent event) {}

    @Override
    public void onError(SpeErrorEvent event) {}
}
