package com.questrail.spe.internal.document;

import com.questrail.spe.api.FailureSection;
import com.questrail.spe.api.SpeFormatException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StructuredMetadataParserTest
 * -----------------------------------------------------------------------------
 * Extraction of the recognised sections, tolerance of unknown ones, and the
 * structural failure for malformed documents.
 */
final class StructuredMetadataParserTest
{
    private static final String NS = " xmlns=\"http://www.princetoninstruments.com/spe/2009\"";

    private final StructuredMetadataParser parser = new StructuredMetadataParser();

    private MetadataDocument parse(String xml) {
        return parser.parse(xml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void extractsFrameFormatAndRegions()
    {
        MetadataDocument document = parse("<SpeFormat" + NS + "><DataFormat>"
                + "<DataBlock type=\"Frame\" count=\"10\" pixelFormat=\"MonochromeUnsigned16\" stride=\"40960\">"
                + "<DataBlock type=\"Region\" width=\"128\" height=\"128\" name=\"top\"/>"
                + "<DataBlock type=\"Region\" width=\"64\" height=\"64\"/>"
                + "</DataBlock></DataFormat></SpeFormat>");

        RawFrameFormat frame = document.frameFormat().orElseThrow();
        assertEquals("10", frame.attributes().get("count"));
        assertEquals("MonochromeUnsigned16", frame.attributes().get("pixelFormat"));
        assertEquals(2, frame.regions().size());
        assertEquals("top", frame.regions().get(0).get("name"));
        assertNull(frame.regions().get(1).get("name"));
        assertTrue(document.trackingLayout().isEmpty());
        assertTrue(document.calibrations().isEmpty());
    }

    @Test
    void extractsTrackingFieldsInOrder()
    {
        MetadataDocument document = parse("<SpeFormat" + NS + "><MetaFormat><MetaBlock type=\"TrackingFrame\">"
                + "<TimeStamp event=\"ExposureStarted\" type=\"Int64\" bitDepth=\"64\" resolution=\"1000000\"/>"
                + "<FrameTrackingNumber type=\"Int64\" bitDepth=\"64\"/>"
                + "</MetaBlock></MetaFormat></SpeFormat>");

        List<RawTrackField> fields = document.trackingLayout().orElseThrow();
        assertEquals(2, fields.size());
        assertEquals("TimeStamp", fields.get(0).element());
        assertEquals("ExposureStarted", fields.get(0).attribute("event"));
        assertEquals("1000000", fields.get(0).attribute("resolution"));
        assertEquals("FrameTrackingNumber", fields.get(1).element());
    }

    @Test
    void emptyMetaBlockMeansNoTracking()
    {
        MetadataDocument document = parse("<SpeFormat><MetaFormat><MetaBlock/></MetaFormat></SpeFormat>");

        assertTrue(document.trackingLayout().isEmpty());
    }

    @Test
    void extractsCalibrations()
    {
        MetadataDocument document = parse("<SpeFormat" + NS + "><Calibrations>"
                + "<WavelengthMapping orientation=\"Normal\"><Wavelength>500.0,500.5,501.0</Wavelength></WavelengthMapping>"
                + "<PolynomialMapping roi=\"1\" referencePixel=\"4\">1.0,2.0</PolynomialMapping>"
                + "<SensorInformation width=\"1024\" height=\"256\" orientation=\"FlipHorizontal\"/>"
                + "<SensorMapping id=\"1\"/>"
                + "<DetectorMapping/>"
                + "</Calibrations></SpeFormat>");

        RawCalibrations calibrations = document.calibrations().orElseThrow();
        assertEquals(2, calibrations.mappings().size());
        assertEquals(RawCalibration.WAVELENGTH_MAPPING, calibrations.mappings().get(0).kind());
        assertEquals("500.0,500.5,501.0", calibrations.mappings().get(0).text());
        assertEquals("1", calibrations.mappings().get(1).attribute("roi"));
        assertEquals("FlipHorizontal", calibrations.sensorInformation().orElseThrow().get("orientation"));
        assertEquals(List.of("Calibrations/DetectorMapping"), document.ignoredSections());
    }

    @Test
    void flattensGeneralInformation()
    {
        MetadataDocument document = parse("<SpeFormat><GeneralInformation>"
                + "<FileInformation created=\"2026-10-17\"><Notes>first</Notes><Notes>second</Notes></FileInformation>"
                + "<Camera model=\"PIXIS\"/>"
                + "</GeneralInformation></SpeFormat>");

        Map<String, String> info = document.generalInfo().orElseThrow();
        assertEquals("2026-10-17", info.get("FileInformation@created"));
        assertEquals("first", info.get("FileInformation.Notes"));
        assertEquals("second", info.get("FileInformation.Notes[1]"));
        assertEquals("PIXIS", info.get("Camera@model"));
    }

    @Test
    void unknownSectionsAreIgnored()
    {
        MetadataDocument document = parse("<SpeFormat><DataHistories><History/></DataHistories>"
                + "<FutureThing a=\"b\"/></SpeFormat>");

        assertEquals(List.of("DataHistories", "FutureThing"), document.ignoredSections());
        assertTrue(document.isAbsent());
    }

    @Test
    void malformedDocumentIsStructuralError()
    {
        SpeFormatException e = assertThrows(SpeFormatException.class,
                () -> parse("<SpeFormat><DataFormat><DataBlock type=\"Frame\"></SpeFormat>"));

        assertEquals(FailureSection.METADATA_DOCUMENT, e.section());
        assertTrue(e.getMessage().startsWith("METADATA_DOCUMENT"));
    }

    @Test
    void invalidUtf8IsStructuralError()
    {
        byte[] head = "<SpeFormat><GeneralInformation><Notes>".getBytes(StandardCharsets.US_ASCII);
        byte[] tail = "</Notes></GeneralInformation></SpeFormat>".getBytes(StandardCharsets.US_ASCII);
        byte[] document = new byte[head.length + 2 + tail.length];
        System.arraycopy(head, 0, document, 0, head.length);
        document[head.length] = (byte) 0xC3;
        document[head.length + 1] = (byte) 0x28;
        System.arraycopy(tail, 0, document, head.length + 2, tail.length);

        SpeFormatException e = assertThrows(SpeFormatException.class, () -> parser.parse(document));

        assertEquals(FailureSection.METADATA_DOCUMENT, e.section());
    }

    @Test
    void rejectsWrongRoot()
    {
        SpeFormatException e = assertThrows(SpeFormatException.class, () -> parse("<Other/>"));

        assertEquals(FailureSection.METADATA_DOCUMENT, e.section());
    }

    @Test
    void rejectsDoctype()
    {
        assertThrows(SpeFormatException.class,
                () -> parse("<!DOCTYPE SpeFormat [<!ENTITY x \"y\">]><SpeFormat>&x;</SpeFormat>"));
    }
}
