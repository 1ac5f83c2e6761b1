package com.questrail.spe.internal.metadata;

import com.questrail.spe.api.Calibration;
import com.questrail.spe.api.CalibrationSpec;
import com.questrail.spe.api.FileVersion;
import com.questrail.spe.api.FrameTrackFieldSpec;
import com.questrail.spe.api.Metadata;
import com.questrail.spe.api.NumericType;
import com.questrail.spe.api.Orientation;
import com.questrail.spe.api.ResolvedRoi;
import com.questrail.spe.api.SpeSchemaException;
import com.questrail.spe.api.TabulatedCalibration;
import com.questrail.spe.api.TrackingLayout;
import com.questrail.spe.api.UnsupportedFeature;
import com.questrail.spe.codec.HeaderFields;
import com.questrail.spe.codec.LegacyCalibration;
import com.questrail.spe.internal.assemble.CalibrationAxis;
import com.questrail.spe.internal.document.MetadataDocument;
import com.questrail.spe.internal.document.RawCalibration;
import com.questrail.spe.internal.document.RawCalibrations;
import com.questrail.spe.internal.document.RawFrameFormat;
import com.questrail.spe.internal.document.RawTrackField;
import com.questrail.spe.internal.layout.FrameLayout;
import com.questrail.spe.internal.layout.RoiLayoutResolver;
import com.questrail.spe.observability.SpeIgnoredSectionEvent;
import com.questrail.spe.observability.SpeObservabilitySink;
import com.questrail.spe.observability.SpeWarningEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * MetadataUnifier
 * =============================================================================
 * Merges the binary header with the metadata document into one validated,
 * version-independent {@link Metadata}.
 *
 * <h2>Collect-all validation</h2>
 * <p>Every field is checked before anything is rejected. A decode attempt
 * therefore reports all {@code SchemaViolation}s at once, through
 * {@link ValidationResult#violations()} or a single {@link SpeSchemaException}.</p>
 *
 * <h2>Per revision</h2>
 * <ul>
 *   <li>Legacy: the header is the only source. A calibration whose valid
 *       flag is set becomes a polynomial calibration. Tracking never exists.</li>
 *   <li>Modern: frame format, tracking layout and calibrations come from the
 *       document and are cross-checked against the header.</li>
 * </ul>
 *
 * <h2>Degradation</h2>
 * <p>Structures that are recognised but not decodable (an unknown tracking
 * element kind, an unknown pixel format name, a region list that disagrees
 * with the header table) are recorded as {@link UnsupportedFeature}s and
 * reported to the sink as warnings. They never fail the decode.</p>
 *
 * <p>Region layout is resolved here, once the tracking block size is known.
 * Layout failures are structural and propagate as {@code SpeFormatException}.</p>
 */
public final class MetadataUnifier
{
    /** Coordinate name used when a calibration does not carry one. */
    public static final String DEFAULT_CALIBRATION_NAME = "wavelength";

    private static final long MAX_TRACKING_BITS = 8L * 4096;

    private final RoiLayoutResolver resolver;
    private final SpeObservabilitySink sink;

    public MetadataUnifier(RoiLayoutResolver resolver, SpeObservabilitySink sink) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Unifies and validates.
     *
     * @throws SpeSchemaException carrying every violation found
     */
    public Metadata unify(HeaderFields header, MetadataDocument document) {
        return validate(header, document).orElseThrow();
    }

    /**
     * Unifies and validates without throwing for schema violations.
     */
    public ValidationResult<Metadata> validate(HeaderFields header, MetadataDocument document) {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(document, "document");

        final Violations violations = new Violations();
        final List<UnsupportedFeature> unsupported = new ArrayList<>();

        for (String section : document.ignoredSections()) {
            sink.onSectionIgnored(new SpeIgnoredSectionEvent(Instant.now(), section));
        }

        final List<String> regionNames = new ArrayList<>();
        OptionalLong declaredStride = OptionalLong.empty();
        Optional<TrackingLayout> tracking = Optional.empty();
        boolean trackingValid = true;
        final List<Calibration> calibrations = new ArrayList<>();
        Orientation sensorOrientation = Orientation.NORMAL;

        if (header.version() == FileVersion.LEGACY) {
            if (!document.isAbsent()) {
                violations.outOfRange("document", "legacy files carry no metadata document");
            }
            header.legacyCalibration().ifPresent(c -> legacyCalibration(c, violations).ifPresent(calibrations::add));
        }
        else {
            if (document.frameFormat().isPresent()) {
                final RawFrameFormat frameFormat = document.frameFormat().get();
                declaredStride = checkFrameFormat(frameFormat, header, violations, unsupported);
                for (Map<String, String> region : frameFormat.regions()) {
                    regionNames.add(region.get("name"));
                }
                if (frameFormat.regions().size() != header.roiCount()) {
                    unsupported.add(new UnsupportedFeature("DataFormat", "Region",
                            "document lists " + frameFormat.regions().size() + " region(s), header table "
                                    + header.roiCount() + "; header table used"));
                }
            }

            if (document.trackingLayout().isPresent()) {
                final int before = violations.size();
                tracking = trackingLayout(document.trackingLayout().get(), violations, unsupported);
                trackingValid = violations.size() == before;
            }

            if (document.calibrations().isPresent()) {
                final RawCalibrations raw = document.calibrations().get();
                calibrations.addAll(documentCalibrations(raw.mappings(), violations));
                sensorOrientation = raw.sensorInformation()
                        .map(info -> Orientation.parse(info.get("orientation")))
                        .orElse(Orientation.NORMAL);
            }
        }

        final Map<String, String> generalInfo = new LinkedHashMap<>(header.generalInfo());
        document.generalInfo().ifPresent(generalInfo::putAll);

        report(unsupported);

        // Without a valid tracking layout the frame stride is unknown.
        if (!trackingValid) {
            return ValidationResult.invalid(violations.toList());
        }

        final int trackingBlockSize = tracking.map(TrackingLayout::blockSize).orElse(0);
        final FrameLayout layout = resolver.resolve(header, regionNames, trackingBlockSize, declaredStride);
        checkCalibrationScope(calibrations, layout.rois(), sensorOrientation, violations);

        if (!violations.isEmpty()) {
            return ValidationResult.invalid(violations.toList());
        }

        return ValidationResult.valid(new Metadata(
                header.version(),
                header.frameCount(),
                header.sensorWidth(),
                header.sensorHeight(),
                header.dataType(),
                layout.frameStride(),
                generalInfo,
                calibrations,
                layout.rois(),
                tracking,
                sensorOrientation,
                unsupported));
    }

    // ========================================================================
    // Legacy
    // ========================================================================

    /**
     * An order of 0 is written by older software that only filled the
     * coefficients; then every stored coefficient up to the last non-zero one
     * is used.
     */
    private static Optional<Calibration> legacyCalibration(LegacyCalibration raw, Violations violations) {
        if (!raw.valid()) {
            return Optional.empty();
        }
        final int order = raw.polynomialOrder();
        if (order < 0 || order >= raw.coefficients().size()) {
            violations.outOfRange("calibration.polynomialOrder",
                    "order " + order + " outside 0.." + (raw.coefficients().size() - 1));
            return Optional.empty();
        }

        int used = order + 1;
        if (order == 0) {
            used = raw.coefficients().size();
            while (used > 1 && raw.coefficients().get(used - 1) == 0.0) {
                used--;
            }
        }

        final List<Double> coefficients = raw.coefficients().subList(0, used);
        boolean finite = true;
        for (int i = 0; i < coefficients.size(); i++) {
            if (!Double.isFinite(coefficients.get(i))) {
                violations.outOfRange("calibration.coefficients[" + i + "]", "value is not finite");
                finite = false;
            }
        }
        if (!finite) {
            return Optional.empty();
        }
        return Optional.of(new CalibrationSpec(DEFAULT_CALIBRATION_NAME, raw.label(), coefficients, 0,
                Optional.empty(), Orientation.NORMAL));
    }

    // ========================================================================
    // Modern
    // ========================================================================

    private static OptionalLong checkFrameFormat(RawFrameFormat frameFormat,
                                                 HeaderFields header,
                                                 Violations violations,
                                                 List<UnsupportedFeature> unsupported) {
        final Map<String, String> attributes = frameFormat.attributes();

        violations.integer("DataFormat.Frame.count", attributes.get("count")).ifPresent(count -> {
            if (count != header.frameCount()) {
                violations.outOfRange("DataFormat.Frame.count",
                        "document declares " + count + " frame(s), header " + header.frameCount());
            }
        });

        final String pixelFormat = attributes.get("pixelFormat");
        if (pixelFormat != null) {
            final Optional<NumericType> type = NumericType.fromPixelFormat(pixelFormat);
            if (type.isEmpty()) {
                unsupported.add(new UnsupportedFeature("DataFormat", "pixelFormat",
                        "'" + pixelFormat + "' is not recognised; header data type used"));
            }
            else if (type.get() != header.dataType()) {
                violations.outOfRange("DataFormat.Frame.pixelFormat",
                        pixelFormat + " disagrees with header data type " + header.dataType());
            }
        }

        final Optional<Long> stride = violations.integer("DataFormat.Frame.stride", attributes.get("stride"));
        if (stride.isPresent() && stride.get() <= 0) {
            violations.outOfRange("DataFormat.Frame.stride", "stride " + stride.get() + " is not positive");
            return OptionalLong.empty();
        }
        return stride.map(OptionalLong::of).orElse(OptionalLong.empty());
    }

    /**
     * Builds the tracking layout. Fields are packed in declaration order;
     * unsupported fields still occupy their bytes.
     */
    private static Optional<TrackingLayout> trackingLayout(List<RawTrackField> rawFields,
                                                           Violations violations,
                                                           List<UnsupportedFeature> unsupported) {
        final List<FrameTrackFieldSpec> fields = new ArrayList<>();
        final Set<String> names = new HashSet<>();
        int offset = 0;
        boolean complete = true;

        for (int i = 0; i < rawFields.size(); i++) {
            final RawTrackField raw = rawFields.get(i);
            final String path = "MetaFormat." + raw.element() + "[" + i + "]";

            final Optional<Long> bitDepth = violations.requiredInteger(path + ".bitDepth", raw.attribute("bitDepth"));
            if (bitDepth.isEmpty()) {
                complete = false;
                continue;
            }
            if (bitDepth.get() <= 0 || bitDepth.get() % 8 != 0 || bitDepth.get() > MAX_TRACKING_BITS) {
                violations.outOfRange(path + ".bitDepth",
                        "bit depth " + bitDepth.get() + " is not a positive multiple of 8 up to " + MAX_TRACKING_BITS);
                complete = false;
                continue;
            }
            final int size = (int) (bitDepth.get() / 8);
            final String name = TrackingFieldNames.nameOf(raw);

            double resolution = 1.0;
            final Optional<Double> declared = violations.number(path + ".resolution", raw.attribute("resolution"));
            if (declared.isPresent()) {
                if (declared.get() <= 0) {
                    violations.outOfRange(path + ".resolution", "resolution " + declared.get() + " is not positive");
                }
                else {
                    resolution = declared.get();
                }
            }

            final String typeName = raw.attribute("type");
            if (typeName == null) {
                violations.missing(path + ".type", "required attribute is absent");
            }
            else {
                final Optional<NumericType> type = NumericType.fromTrackingType(typeName);
                if (type.isEmpty()) {
                    unsupported.add(new UnsupportedFeature("MetaFormat", name,
                            "element type '" + typeName + "' is not supported"));
                }
                else if (type.get().width() != size) {
                    violations.outOfRange(path + ".bitDepth",
                            "bit depth " + bitDepth.get() + " does not match type " + typeName);
                }
                else if (!names.add(name)) {
                    violations.outOfRange(path, "duplicate tracking field name '" + name + "'");
                }
                else {
                    fields.add(new FrameTrackFieldSpec(name, offset, size, type.get(), resolution));
                }
            }
            offset += size;
        }

        if (!complete) {
            return Optional.empty();
        }
        return Optional.of(new TrackingLayout(fields, offset));
    }

    private static List<Calibration> documentCalibrations(List<RawCalibration> mappings, Violations violations) {
        final List<Calibration> out = new ArrayList<>();
        for (int i = 0; i < mappings.size(); i++) {
            final RawCalibration raw = mappings.get(i);
            final String path = "Calibrations." + raw.kind() + "[" + i + "]";
            final int before = violations.size();

            final String name = orDefault(raw.attribute("name"), DEFAULT_CALIBRATION_NAME);
            final Orientation orientation = Orientation.parse(raw.attribute("orientation"));
            final Optional<Integer> roi = violations.integer(path + ".roi", raw.attribute("roi")).map(Long::intValue);
            final Optional<List<Double>> values = violations.numbers(path, raw.text());

            if (RawCalibration.WAVELENGTH_MAPPING.equals(raw.kind())) {
                final String unit = orDefault(raw.attribute("unit"), "nm");
                if (violations.size() == before) {
                    out.add(new TabulatedCalibration(name, unit, values.orElseThrow(), roi, orientation));
                }
            }
            else {
                final String unit = orDefault(raw.attribute("unit"), "");
                final int referencePixel = violations.integer(path + ".referencePixel", raw.attribute("referencePixel"))
                        .map(Long::intValue)
                        .orElse(0);
                if (violations.size() == before) {
                    out.add(new CalibrationSpec(name, unit, values.orElseThrow(), referencePixel, roi, orientation));
                }
            }
        }
        return out;
    }

    private static void checkCalibrationScope(List<Calibration> calibrations,
                                              List<ResolvedRoi> rois,
                                              Orientation sensorOrientation,
                                              Violations violations) {
        for (int i = 0; i < calibrations.size(); i++) {
            final Calibration calibration = calibrations.get(i);
            if (calibration.roiIndex().isPresent()) {
                final int roi = calibration.roiIndex().get();
                if (roi < 0 || roi >= rois.size()) {
                    violations.outOfRange("Calibrations[" + i + "].roi",
                            "region " + roi + " does not exist; file has " + rois.size());
                }
            }
        }

        for (ResolvedRoi roi : rois) {
            final Optional<Calibration> selected = CalibrationAxis.select(calibrations, roi.index());
            if (selected.isPresent() && selected.get() instanceof TabulatedCalibration table) {
                final int needed = CalibrationAxis.of(table, sensorOrientation).requiredTableLength(roi);
                if (table.values().size() < needed) {
                    violations.outOfRange("Calibrations." + RawCalibration.WAVELENGTH_MAPPING,
                            "table of " + table.values().size() + " value(s) does not cover region '"
                                    + roi.name() + "', which needs " + needed);
                }
            }
        }
    }

    private void report(List<UnsupportedFeature> unsupported) {
        for (UnsupportedFeature feature : unsupported) {
            sink.onWarning(new SpeWarningEvent(Instant.now(), feature));
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
