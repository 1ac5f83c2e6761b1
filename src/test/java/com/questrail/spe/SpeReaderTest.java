package com.questrail.spe;

import com.questrail.spe.api.Coordinate;
import com.questrail.spe.api.DataArray;
import com.questrail.spe.api.Dataset;
import com.questrail.spe.api.FailureSection;
import com.questrail.spe.api.FileVersion;
import com.questrail.spe.api.Metadata;
import com.questrail.spe.api.NumericType;
import com.questrail.spe.api.SpeFormatException;
import com.questrail.spe.api.SpeSchemaException;
import com.questrail.spe.codec.HeaderField;
import com.questrail.spe.codec.HeaderLayout;
import com.questrail.spe.config.SpeReaderConfig;
import com.questrail.spe.fixtures.SpeFileBuilder;
import com.questrail.spe.io.ByteSource;
import com.questrail.spe.observability.RecordingObservabilitySink;
import com.questrail.spe.observability.SpeDecodeCompletedEvent;
import com.questrail.spe.observability.SpeErrorEvent;
import com.questrail.spe.observability.SpeHeaderEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SpeReaderTest
 * -----------------------------------------------------------------------------
 * End-to-end decoding of synthetic files through the full pipeline.
 *
 * <p>Covers the reference scenarios:</p>
 * <ul>
 *   <li>a modern file with two regions and per-frame exposure timestamps</li>
 *   <li>a modern file whose metadata document is malformed, next to the
 *       equivalent legacy file</li>
 *   <li>a legacy file with a polynomial wavelength calibration</li>
 * </ul>
 */
final class SpeReaderTest
{
    @TempDir
    Path tempDir;

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private SpeReader reader() {
        return new SpeReader(SpeReaderConfig.builder().withObservabilitySink(sink).build());
    }

    private static SpeFileBuilder twoRegionsWithTimestamps(SpeFileBuilder builder) {
        return builder
                .withFrames(10)
                .withRoi(0, 0, 128, 128).named("full")
                .withRoi(128, 0, 64, 64)
                .withTracking("TimeStamp", "event=\"ExposureStarted\" resolution=\"1000\"", "Single", 32,
                        frame -> 1000.0 * frame + 250.0)
                .withTracking("TimeStamp", "event=\"ExposureEnded\" resolution=\"1000\"", "Single", 32,
                        frame -> 1000.0 * frame + 750.0);
    }

    @Test
    void modernFileWithRegionsAndTracking() throws IOException
    {
        Path file = twoRegionsWithTimestamps(SpeFileBuilder.modern(256, 128)).writeTo(tempDir, "scenario-a.spe");

        Dataset dataset = reader().read(file);

        assertEquals(List.of("full", "ROI 1"), List.copyOf(dataset.names()));
        assertArrayEquals(new int[] {10, 128, 128}, dataset.get("full").data().shape());
        assertArrayEquals(new int[] {10, 64, 64}, dataset.get("ROI 1").data().shape());
        assertEquals(SpeFileBuilder.pixel(7, 1, 30, 40), dataset.get("ROI 1").data().getDouble(7, 30, 40));
        assertEquals(SpeFileBuilder.pixel(9, 0, 127, 127), dataset.get("full").data().getDouble(9, 127, 127));

        Coordinate start = dataset.get("full").coordinate("exposure_start").orElseThrow();
        assertEquals(DataArray.FRAME, start.dimension());
        assertEquals(10, start.length());
        for (int frame = 0; frame < 10; frame++) {
            assertEquals(frame + 0.25, start.value(frame), 1e-6);
        }
        assertEquals(start, dataset.get("ROI 1").coordinate("exposure_start").orElseThrow());
        assertEquals(9.75, dataset.get("ROI 1").coordinate("exposure_end").orElseThrow().value(9), 1e-6);

        Metadata metadata = dataset.metadata();
        assertEquals(FileVersion.MODERN, metadata.version());
        assertEquals(8, metadata.trackingBlockSize());
        assertEquals(128L * 128 * 2 + 64L * 64 * 2 + 8, metadata.frameStride());

        SpeDecodeCompletedEvent completed = sink.eventsOfType(SpeDecodeCompletedEvent.class).get(0);
        assertEquals(List.of("full", "ROI 1"), completed.regions());
        assertEquals(List.of("exposure_start", "exposure_end"), completed.trackingFields());
        assertTrue(sink.hasEventOfType(SpeHeaderEvent.class));
    }

    @Test
    void malformedDocumentFailsInDocumentSection() throws IOException
    {
        String broken = "<?xml version=\"1.0\"?><SpeFormat><DataFormat><DataBlock type=\"Frame\"></SpeFormat>";
        Path file = SpeFileBuilder.modern(64, 64)
                .withFrames(2)
                .withRoi(0, 0, 64, 64)
                .withDocument(broken)
                .writeTo(tempDir, "scenario-b.spe");

        SpeFormatException e = assertThrows(SpeFormatException.class, () -> reader().read(file));

        assertEquals(FailureSection.METADATA_DOCUMENT, e.section());
        assertTrue(sink.hasEventOfType(SpeErrorEvent.class));
        assertFalse(sink.hasEventOfType(SpeDecodeCompletedEvent.class));
    }

    @Test
    void legacyEquivalentOfMalformedFileDecodes() throws IOException
    {
        Path file = SpeFileBuilder.legacy(64, 64)
                .withFrames(2)
                .withRoi(0, 0, 64, 64)
                .writeTo(tempDir, "scenario-b-legacy.spe");

        Dataset dataset = reader().read(file);

        assertEquals(2, dataset.frameCount());
        assertEquals(SpeFileBuilder.pixel(1, 0, 63, 0), dataset.get("ROI 0").data().getDouble(1, 63, 0));
    }

    @Test
    void legacyPolynomialCalibration() throws IOException
    {
        double a0 = 435.5;
        double a1 = 0.125;
        double a2 = -2.5e-5;
        Path file = SpeFileBuilder.legacy(1340, 100)
                .withDataType(NumericType.FLOAT32)
                .withRoi(0, 0, 1340, 1)
                .withLegacyCalibration(true, 2, "nm", a0, a1, a2)
                .writeTo(tempDir, "scenario-c.spe");

        Dataset dataset = reader().read(file);

        Coordinate wavelength = dataset.get("ROI 0").coordinate("wavelength").orElseThrow();
        assertEquals(DataArray.X, wavelength.dimension());
        assertEquals(1340, wavelength.length());
        for (int px = 0; px < 1340; px++) {
            assertEquals(a0 + a1 * px + a2 * px * px, wavelength.value(px), 1e-9);
        }
    }

    @Test
    void legacyFilesNeverProduceTracking() throws IOException
    {
        Path file = SpeFileBuilder.legacy(16, 16)
                .withFrames(3)
                .withRoi(0, 0, 16, 16)
                .withTrailingBytes(64)
                .writeTo(tempDir, "trailing.spe");

        Dataset dataset = reader().read(file);

        assertTrue(dataset.metadata().tracking().isEmpty());
        assertEquals(List.of(DataArray.FRAME, DataArray.Y, DataArray.X),
                List.copyOf(dataset.get("ROI 0").coordinates().keySet()));
    }

    @Test
    void zeroFrameFileDecodes() throws IOException
    {
        byte[] bytes = SpeFileBuilder.modern(32, 8).withFrames(0).withRoi(0, 0, 32, 8).build();

        Dataset dataset = reader().read(ByteSource.wrap(bytes));

        assertEquals(0, dataset.frameCount());
        assertArrayEquals(new int[] {0, 8, 32}, dataset.get("ROI 0").data().shape());
    }

    @Test
    void fullSensorRegion() throws IOException
    {
        byte[] bytes = SpeFileBuilder.modern(40, 30).withFrames(2).withRoi(0, 0, 40, 30).build();

        DataArray array = reader().read(ByteSource.wrap(bytes)).get("ROI 0");

        assertArrayEquals(new int[] {2, 30, 40}, array.data().shape());
        assertEquals(39.0, array.coordinate(DataArray.X).orElseThrow().value(39));
    }

    @Test
    void decodingIsIdempotent() throws IOException
    {
        byte[] bytes = twoRegionsWithTimestamps(SpeFileBuilder.modern(256, 128)).build();
        SpeReader reader = reader();

        assertEquals(reader.read(ByteSource.wrap(bytes)), reader.read(ByteSource.wrap(bytes)));
    }

    @Test
    void parallelDecodeMatchesSequential() throws IOException
    {
        Path file = twoRegionsWithTimestamps(SpeFileBuilder.modern(256, 128)).writeTo(tempDir, "parallel.spe");
        SpeReader parallel = new SpeReader(SpeReaderConfig.builder()
                .withParallelism(3)
                .withObservabilitySink(sink)
                .build());

        assertEquals(reader().read(file), parallel.read(file));
    }

    @Test
    void truncatedFrameDataIsStructuralError() throws IOException
    {
        Path file = SpeFileBuilder.legacy(16, 16)
                .withFrames(4)
                .withRoi(0, 0, 16, 16)
                .truncatedBy(1)
                .writeTo(tempDir, "truncated.spe");

        SpeFormatException e = assertThrows(SpeFormatException.class, () -> reader().read(file));

        assertEquals(FailureSection.FRAME_DATA, e.section());
    }

    @Test
    void frameCountOverflowingFileOffsetsIsStructuralError()
    {
        byte[] bytes = SpeFileBuilder.legacy(65535, 65535)
                .withDataType(NumericType.FLOAT64)
                .withFrames(0)
                .withRoi(0, 0, 65535, 65535)
                .build();
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(HeaderLayout.LEGACY.require(HeaderField.FRAME_COUNT).offset(), 268443649);

        SpeFormatException e = assertThrows(SpeFormatException.class, () -> reader().read(ByteSource.wrap(bytes)));

        assertEquals(FailureSection.FRAME_DATA, e.section());
        assertTrue(sink.hasEventOfType(SpeErrorEvent.class));
    }

    @Test
    void schemaViolationsAreReportedTogether()
    {
        byte[] bytes = SpeFileBuilder.modern(16, 16)
                .withFrames(2)
                .withRoi(0, 0, 16, 16)
                .withDocumentFrameCount(5)
                .withPixelFormat("MonochromeFloating32")
                .build();

        SpeSchemaException e = assertThrows(SpeSchemaException.class, () -> reader().read(ByteSource.wrap(bytes)));

        assertEquals(2, e.violations().size());
        assertTrue(sink.hasEventOfType(SpeErrorEvent.class));
    }

    @Test
    void readMetadataSkipsFrameData() throws IOException
    {
        // Frame data is missing entirely; metadata alone still decodes.
        byte[] bytes = SpeFileBuilder.legacy(64, 16)
                .withFrames(5)
                .withRoi(0, 0, 64, 16)
                .truncatedBy(5 * 64 * 16 * 2)
                .build();

        Metadata metadata = reader().readMetadata(ByteSource.wrap(bytes));

        assertEquals(5, metadata.frameCount());
        assertEquals(64 * 16 * 2, metadata.frameStride());
        assertEquals("ROI 0", metadata.rois().get(0).name());
    }

    @Test
    void tabulatedCalibrationFromDocument() throws IOException
    {
        StringBuilder table = new StringBuilder();
        for (int i = 0; i < 64; i++) {
            table.append(i == 0 ? "" : ",").append(600.0 + i);
        }
        byte[] bytes = SpeFileBuilder.modern(64, 4)
                .withRoi(8, 0, 16, 4)
                .withCalibrationXml("<WavelengthMapping><Wavelength>" + table + "</Wavelength></WavelengthMapping>")
                .build();

        Coordinate wavelength = reader().read(ByteSource.wrap(bytes)).get("ROI 0").coordinate("wavelength").orElseThrow();

        assertEquals(16, wavelength.length());
        assertEquals(608.0, wavelength.value(0));
        assertEquals(623.0, wavelength.value(15));
    }

    @Test
    void unknownSectionsDoNotFailDecode() throws IOException
    {
        byte[] bytes = SpeFileBuilder.modern(8, 8)
                .withRoi(0, 0, 8, 8)
                .withExtraSection("<DataHistories><DataHistory/></DataHistories>")
                .withGeneralInformationXml("<Camera model=\"ProEM\"/>")
                .build();

        Dataset dataset = reader().read(ByteSource.wrap(bytes));

        assertEquals("ProEM", dataset.metadata().generalInfo().get("Camera@model"));
    }
}
