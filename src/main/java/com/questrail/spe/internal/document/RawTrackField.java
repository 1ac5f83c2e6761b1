package com.questrail.spe.internal.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One child of the tracking {@code MetaBlock}, unvalidated.
 *
 * @param element    element local name, e.g. {@code TimeStamp}
 * @param attributes element attributes in document order
 */
public record RawTrackField(String element, Map<String, String> attributes)
{
    public RawTrackField {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
