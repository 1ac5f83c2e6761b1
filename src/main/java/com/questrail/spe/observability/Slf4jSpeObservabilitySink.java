package com.questrail.spe.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SpeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSpeObservabilitySink implements SpeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSpeObservabilitySink.class);

    @Override
    public void onHeaderDecoded(SpeHeaderEvent event) {
        log.debug("SPE header: version={} frames={} rois={} dataType={}",
            event.version(),
            event.frameCount(),
            event.roiCount(),
            event.dataType());
    }

    @Override
    public void onSectionIgnored(SpeIgnoredSectionEvent event) {
        log.debug("SPE metadata section ignored: {}", event.section());
    }

    @Override
    public void onWarning(SpeWarningEvent event) {
        log.warn("SPE {} '{}' omitted: {}",
            event.feature().section(),
            event.feature().name(),
            event.feature().reason());
    }

    @Override
    public void onDecodeCompleted(SpeDecodeCompletedEvent event) {
        log.info("SPE {} file decoded: {} frame(s), regions={}, tracking={} in {} ms",
            event.version(),
            event.frameCount(),
            event.regions(),
            event.trackingFields(),
            event.elapsed().toMillis());
    }

    @Override
    public void onError(SpeErrorEvent event) {
        log.error("SPE decode failed: {}", event.message(), event.cause());
    }
}
