package com.questrail.spe.internal.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The frame {@code DataBlock} of the document's {@code DataFormat} section:
 * its attributes and the attributes of each region descriptor, unvalidated.
 */
public record RawFrameFormat(Map<String, String> attributes, List<Map<String, String>> regions)
{
    public RawFrameFormat {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        regions = regions.stream()
                .map(r -> Collections.unmodifiableMap(new LinkedHashMap<>(r)))
                .toList();
    }
}
