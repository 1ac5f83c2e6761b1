package com.questrail.spe.codec;

import com.questrail.spe.api.FailureSection;
import com.questrail.spe.api.FileVersion;
import com.questrail.spe.api.NumericType;
import com.questrail.spe.api.RawRoi;
import com.questrail.spe.api.SpeFormatException;
import com.questrail.spe.fixtures.SpeFileBuilder;
import com.questrail.spe.io.ByteSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BinaryHeaderDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link BinaryHeaderDecoder}: version detection, sentinel
 * checks, ROI table conversion and the metadata document offset.
 */
final class BinaryHeaderDecoderTest
{
    private final BinaryHeaderDecoder decoder = new BinaryHeaderDecoder(true, HeaderLayout.ROI_TABLE_CAPACITY);

    @Test
    void decodesModernHeader() throws IOException
    {
        byte[] file = SpeFileBuilder.modern(512, 256)
                .withFrames(3)
                .withRoi(10, 20, 100, 50)
                .build();

        HeaderFields header = decoder.decode(ByteSource.wrap(file));

        assertEquals(FileVersion.MODERN, header.version());
        assertEquals(3.0f, header.headerVersion());
        assertEquals(512, header.sensorWidth());
        assertEquals(256, header.sensorHeight());
        assertEquals(3, header.frameCount());
        assertEquals(NumericType.UINT16, header.dataType());
        assertEquals(1, header.roiCount());
        assertEquals(new RawRoi(10, 20, 100, 50, 1, 1), header.rois().get(0));
        assertEquals(HeaderLayout.HEADER_SIZE + 3L * 100 * 50 * 2, header.metadataOffset().getAsLong());
        assertTrue(header.legacyCalibration().isEmpty());
    }

    @Test
    void decodesLegacyHeaderWithCalibration() throws IOException
    {
        byte[] file = SpeFileBuilder.legacy(64, 8)
                .withDataType(NumericType.FLOAT32)
                .withRoi(0, 0, 64, 8)
                .withLegacyCalibration(true, 2, "nm", 400.0, 0.5, 0.001)
                .build();

        HeaderFields header = decoder.decode(ByteSource.wrap(file));

        assertEquals(FileVersion.LEGACY, header.version());
        assertEquals(NumericType.FLOAT32, header.dataType());
        assertTrue(header.metadataOffset().isEmpty());

        LegacyCalibration calibration = header.legacyCalibration().orElseThrow();
        assertTrue(calibration.valid());
        assertEquals(2, calibration.polynomialOrder());
        assertEquals(HeaderLayout.CALIBRATION_COEFFICIENTS, calibration.coefficients().size());
        assertEquals(400.0, calibration.coefficients().get(0));
        assertEquals(0.001, calibration.coefficients().get(2));
        assertEquals(0.0, calibration.coefficients().get(5));
        assertEquals("nm", calibration.label());
    }

    @Test
    void convertsOneBasedInclusiveBounds() throws IOException
    {
        byte[] file = SpeFileBuilder.legacy(100, 100)
                .withRawRoi(5, 24, 2, 1, 10, 5)
                .build();

        RawRoi roi = decoder.decode(ByteSource.wrap(file)).rois().get(0);

        assertEquals(new RawRoi(4, 0, 20, 10, 2, 5), roi);
    }

    @Test
    void exposesGeneralInformation() throws IOException
    {
        byte[] file = SpeFileBuilder.legacy(16, 16).withRoi(0, 0, 12, 8).build();

        HeaderFields header = decoder.decode(ByteSource.wrap(file));

        assertEquals("17Oct2026", header.generalInfo().get("date"));
        assertEquals("2.5", header.generalInfo().get("headerVersion"));
        assertEquals("-70.0", header.generalInfo().get("detectorTemperature"));
        assertEquals("12", header.generalInfo().get("storedWidth"));
        assertEquals("8", header.generalInfo().get("storedHeight"));
    }

    @Test
    void rejectsZeroSensorWidth()
    {
        byte[] file = SpeFileBuilder.legacy(16, 16).withRoi(0, 0, 16, 16).build();
        little(file).putShort(HeaderLayout.LEGACY.require(HeaderField.SENSOR_WIDTH).offset(), (short) 0);

        SpeFormatException e = assertThrows(SpeFormatException.class, () -> decoder.decode(ByteSource.wrap(file)));
        assertEquals(FailureSection.HEADER, e.section());
        assertTrue(e.getMessage().contains("sensor dimensions"));
    }

    @Test
    void rejectsUnknownDataTypeCode()
    {
        byte[] file = SpeFileBuilder.modern(16, 16).withRoi(0, 0, 16, 16).build();
        little(file).putShort(HeaderLayout.MODERN.require(HeaderField.DATA_TYPE).offset(), (short) 4);

        SpeFormatException e = assertThrows(SpeFormatException.class, () -> decoder.decode(ByteSource.wrap(file)));
        assertEquals(FailureSection.HEADER, e.section());
        assertTrue(e.getMessage().contains("data type code 4"));
    }

    @Test
    void rejectsNegativeFrameCount()
    {
        byte[] file = SpeFileBuilder.legacy(16, 16).withFrames(0).withRoi(0, 0, 16, 16).build();
        little(file).putInt(HeaderLayout.LEGACY.require(HeaderField.FRAME_COUNT).offset(), -1);

        SpeFormatException e = assertThrows(SpeFormatException.class, () -> decoder.decode(ByteSource.wrap(file)));
        assertEquals(FailureSection.HEADER, e.section());
        assertTrue(e.getMessage().contains("frame count -1"));
    }

    private static ByteBuffer little(byte[] file) {
        return ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN);
    }

    @Test
    void rejectsFileShorterThanHeader()
    {
        SpeFormatException e = assertThrows(SpeFormatException.class,
                () -> decoder.decode(ByteSource.wrap(new byte[100])));
        assertEquals(FailureSection.HEADER, e.section());
    }

    @Test
    void rejectsUnknownVersion()
    {
        byte[] file = SpeFileBuilder.legacy(16, 16).withRoi(0, 0, 16, 16).build();
        ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN).putFloat(HeaderLayout.VERSION_SLOT.offset(), 7.0f);

        SpeFormatException e = assertThrows(SpeFormatException.class, () -> decoder.decode(ByteSource.wrap(file)));
        assertEquals(FailureSection.HEADER, e.section());
        assertTrue(e.getMessage().contains("version"));
    }

    @Test
    void strictModeRejectsBrokenSentinels()
    {
        byte[] file = SpeFileBuilder.legacy(16, 16).withRoi(0, 0, 16, 16).withBrokenSentinels().build();

        SpeFormatException e = assertThrows(SpeFormatException.class, () -> decoder.decode(ByteSource.wrap(file)));
        assertTrue(e.getMessage().contains("Unrecognized magic"));
    }

    @Test
    void lenientModeIgnoresSentinels() throws IOException
    {
        byte[] file = SpeFileBuilder.legacy(16, 16).withRoi(0, 0, 16, 16).withBrokenSentinels().build();

        HeaderFields header = new BinaryHeaderDecoder(false, 10).decode(ByteSource.wrap(file));
        assertEquals(16, header.sensorWidth());
    }

    @Test
    void rejectsRoiCountAboveLimit()
    {
        byte[] file = SpeFileBuilder.legacy(16, 16)
                .withRoi(0, 0, 8, 8)
                .withRoi(8, 8, 8, 8)
                .build();

        SpeFormatException e = assertThrows(SpeFormatException.class,
                () -> new BinaryHeaderDecoder(true, 1).decode(ByteSource.wrap(file)));
        assertEquals(FailureSection.HEADER, e.section());
    }

    @Test
    void rejectsZeroRoiCount()
    {
        byte[] file = SpeFileBuilder.legacy(16, 16).withRoi(0, 0, 16, 16).withRoiCountOverride(0).build();

        assertThrows(SpeFormatException.class, () -> decoder.decode(ByteSource.wrap(file)));
    }

    @Test
    void rejectsZeroBinning()
    {
        byte[] file = SpeFileBuilder.legacy(16, 16).withRoi(0, 0, 16, 16).build();
        FieldSlot table = HeaderLayout.LEGACY.require(HeaderField.ROI_TABLE);
        ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN).putShort(table.elementOffset(2), (short) 0);

        SpeFormatException e = assertThrows(SpeFormatException.class, () -> decoder.decode(ByteSource.wrap(file)));
        assertTrue(e.getMessage().contains("binning"));
    }

    @Test
    void zeroDocumentOffsetMeansNoDocument() throws IOException
    {
        byte[] file = SpeFileBuilder.modern(16, 16).withRoi(0, 0, 16, 16).withoutDocument().build();

        assertTrue(decoder.decode(ByteSource.wrap(file)).metadataOffset().isEmpty());
    }

    @Test
    void rejectsDocumentOffsetPastEndOfFile()
    {
        byte[] file = SpeFileBuilder.modern(16, 16).withRoi(0, 0, 16, 16).build();
        ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN)
                .putLong(HeaderLayout.MODERN.require(HeaderField.XML_OFFSET).offset(), file.length + 10L);

        SpeFormatException e = assertThrows(SpeFormatException.class, () -> decoder.decode(ByteSource.wrap(file)));
        assertEquals(FailureSection.HEADER, e.section());
    }

    @Test
    void rejectsMaxRoiCountOutsideTable()
    {
        assertThrows(IllegalArgumentException.class, () -> new BinaryHeaderDecoder(true, 0));
        assertThrows(IllegalArgumentException.class, () -> new BinaryHeaderDecoder(true, 11));
    }
}
