package com.questrail.spe;

import com.questrail.spe.api.Dataset;
import com.questrail.spe.api.Metadata;
import com.questrail.spe.api.ResolvedRoi;
import com.questrail.spe.api.SpeFormatException;
import com.questrail.spe.api.SpeSchemaException;
import com.questrail.spe.codec.BinaryHeaderDecoder;
import com.questrail.spe.codec.HeaderFields;
import com.questrail.spe.config.SpeReaderConfig;
import com.questrail.spe.internal.assemble.DatasetAssembler;
import com.questrail.spe.internal.document.MetadataDocument;
import com.questrail.spe.internal.document.StructuredMetadataParser;
import com.questrail.spe.internal.frame.Frame;
import com.questrail.spe.internal.frame.FrameBlockDecoder;
import com.questrail.spe.internal.layout.FrameLayout;
import com.questrail.spe.internal.layout.RoiLayoutResolver;
import com.questrail.spe.internal.metadata.MetadataUnifier;
import com.questrail.spe.internal.tracking.TrackingFieldDecoder;
import com.questrail.spe.io.ByteSource;
import com.questrail.spe.observability.SpeDecodeCompletedEvent;
import com.questrail.spe.observability.SpeErrorEvent;
import com.questrail.spe.observability.SpeHeaderEvent;
import com.questrail.spe.observability.SpeObservabilitySink;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * SpeReader
 * =============================================================================
 * Composition root of the decode pipeline.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link BinaryHeaderDecoder}: fixed header, version detection</li>
 *   <li>{@link StructuredMetadataParser}: trailing document, modern files only</li>
 *   <li>{@link MetadataUnifier}: validation and ROI layout resolution</li>
 *   <li>{@link FrameBlockDecoder} and {@link TrackingFieldDecoder}: every frame</li>
 *   <li>{@link DatasetAssembler}: tensors, coordinates, shared metadata</li>
 * </ol>
 *
 * <h2>Failure model</h2>
 * <ul>
 *   <li>Structural problems abort the decode with a {@link SpeFormatException}.</li>
 *   <li>Metadata problems abort it with one {@link SpeSchemaException}
 *       listing every violation.</li>
 *   <li>Both are reported to the observability sink before propagating.</li>
 *   <li>No partial dataset is ever returned.</li>
 * </ul>
 *
 * <p>A reader holds no per-file state and may be shared between threads.
 * Files opened from a {@link Path} are closed on every exit path; a
 * caller-supplied {@link ByteSource} stays open.</p>
 */
public final class SpeReader
{
    private final SpeReaderConfig config;
    private final SpeObservabilitySink sink;
    private final BinaryHeaderDecoder headerDecoder;
    private final StructuredMetadataParser documentParser = new StructuredMetadataParser();
    private final MetadataUnifier unifier;

    public SpeReader(SpeReaderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();
        this.headerDecoder = new BinaryHeaderDecoder(config.strict(), config.maxRoiCount());
        this.unifier = new MetadataUnifier(new RoiLayoutResolver(), sink);
    }

    public SpeReader() {
        this(SpeReaderConfig.defaults());
    }

    /**
     * Decodes the file at {@code file}.
     */
    public Dataset read(Path file) throws IOException {
        try (ByteSource source = ByteSource.open(file)) {
            return read(source);
        }
    }

    /**
     * Decodes {@code source}. The source is not closed.
     */
    public Dataset read(ByteSource source) throws IOException {
        Objects.requireNonNull(source, "source");
        final Instant started = Instant.now();
        try {
            final HeaderFields header = decodeHeader(source);
            final Metadata metadata = unify(source, header);

            final FrameBlockDecoder frames = new FrameBlockDecoder(FrameLayout.of(metadata), metadata.frameCount());
            frames.verifyExtent(source, header.metadataOffset());
            final TrackingFieldDecoder tracking = new TrackingFieldDecoder(metadata.tracking());

            final DatasetAssembler assembler = new DatasetAssembler(metadata, config.withCalibration());
            if (config.parallelism() > 1 && metadata.frameCount() > 1) {
                decodeParallel(source, frames, tracking, assembler);
            }
            else {
                for (int i = 0; i < metadata.frameCount(); i++) {
                    assembler.accept(tracking.annotate(frames.decode(source, i)));
                }
            }
            final Dataset dataset = assembler.assemble();

            sink.onDecodeCompleted(new SpeDecodeCompletedEvent(
                    Instant.now(),
                    metadata.version(),
                    metadata.frameCount(),
                    metadata.rois().stream().map(ResolvedRoi::name).toList(),
                    tracking.fieldNames(),
                    Duration.between(started, Instant.now())));
            return dataset;
        }
        catch (SpeFormatException | SpeSchemaException e) {
            sink.onError(new SpeErrorEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }
    }

    /**
     * Decodes only the metadata of the file at {@code file}; frame data is not read.
     */
    public Metadata readMetadata(Path file) throws IOException {
        try (ByteSource source = ByteSource.open(file)) {
            return readMetadata(source);
        }
    }

    /**
     * Decodes only the metadata of {@code source}. The source is not closed.
     */
    public Metadata readMetadata(ByteSource source) throws IOException {
        Objects.requireNonNull(source, "source");
        try {
            return unify(source, decodeHeader(source));
        }
        catch (SpeFormatException | SpeSchemaException e) {
            sink.onError(new SpeErrorEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }
    }

    private HeaderFields decodeHeader(ByteSource source) throws IOException {
        final HeaderFields header = headerDecoder.decode(source);
        sink.onHeaderDecoded(new SpeHeaderEvent(
                Instant.now(), header.version(), header.frameCount(), header.roiCount(), header.dataType()));
        return header;
    }

    private Metadata unify(ByteSource source, HeaderFields header) throws IOException {
        final MetadataDocument document = header.metadataOffset().isPresent()
                ? documentParser.parse(source, header.metadataOffset().getAsLong())
                : MetadataDocument.absent();
        return unifier.unify(header, document);
    }

    /**
     * Splits the frames into contiguous ranges, one task per range, each
     * reading through its own handle. Frames are handed to the assembler on
     * the calling thread.
     */
    private void decodeParallel(ByteSource source,
                                FrameBlockDecoder frames,
                                TrackingFieldDecoder tracking,
                                DatasetAssembler assembler) throws IOException {
        final int frameCount = frames.frameCount();
        final int tasks = Math.min(config.parallelism(), frameCount);
        final int chunk = (frameCount + tasks - 1) / tasks;

        final ExecutorService executor = Executors.newFixedThreadPool(tasks);
        try {
            final List<Future<List<Frame>>> results = new ArrayList<>(tasks);
            for (int from = 0; from < frameCount; from += chunk) {
                final int start = from;
                final int end = Math.min(frameCount, from + chunk);
                final Callable<List<Frame>> task = () -> {
                    try (ByteSource handle = source.reopen()) {
                        final List<Frame> decoded = new ArrayList<>(end - start);
                        for (Frame frame : frames.decodeRange(handle, start, end)) {
                            decoded.add(tracking.annotate(frame));
                        }
                        return decoded;
                    }
                };
                results.add(executor.submit(task));
            }

            for (Future<List<Frame>> result : results) {
                for (Frame frame : await(result)) {
                    assembler.accept(frame);
                }
            }
        }
        finally {
            executor.shutdownNow();
        }
    }

    private static List<Frame> await(Future<List<Frame>> result) throws IOException {
        try {
            return result.get();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while decoding frames", e);
        }
        catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Frame decoding failed", cause);
        }
    }
}
