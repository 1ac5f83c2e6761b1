/**
 * SPE Codec: Fixed Header Layer
 * =============================================================================
 *
 * <p>This package decodes the fixed-offset binary header that starts every SPE
 * file. It is the only place in the reader that knows byte offsets of header
 * fields.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   ByteSource
 *        → BinaryHeaderDecoder     (field tables applied here)
 *            → HeaderFields        (version-tagged, immutable)
 *                → ROI layout, metadata document, frame decoding
 * </pre>
 *
 * <h2>Field Tables as Data</h2>
 * <p>Each revision's header is described by a {@link com.questrail.spe.codec.HeaderLayout}
 * table. Revisions differ only in which fields their table defines; there is
 * no per-revision decoder subclass.</p>
 */
package com.questrail.spe.codec;
