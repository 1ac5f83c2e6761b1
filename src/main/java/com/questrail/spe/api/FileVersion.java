package com.questrail.spe.api;

import java.util.Optional;

/**
 * On-disk revision of an SPE file, selected from the header's
 * {@code file_header_ver} field.
 *
 * <ul>
 *   <li>{@link #LEGACY}: versions 1.x and 2.x, all metadata in the binary header</li>
 *   <li>{@link #MODERN}: version 3.x, binary header plus a trailing XML document</li>
 * </ul>
 */
public enum FileVersion
{
    LEGACY,
    MODERN;

    /**
     * Classifies a raw header version number.
     *
     * @return the file version, or empty if the number is not a known revision
     */
    public static Optional<FileVersion> fromHeaderVersion(float headerVersion) {
        if (Float.isNaN(headerVersion)) {
            return Optional.empty();
        }
        if (headerVersion >= 1.0f && headerVersion < 3.0f) {
            return Optional.of(LEGACY);
        }
        if (headerVersion >= 3.0f && headerVersion < 4.0f) {
            return Optional.of(MODERN);
        }
        return Optional.empty();
    }
}
