package com.questrail.spe.codec;

import com.questrail.spe.api.FileVersion;
import com.questrail.spe.api.NumericType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * HeaderLayout
 * -----------------------------------------------------------------------------
 * Version-keyed field tables for the fixed SPE header.
 *
 * <p>Each file revision is described as data, a mapping from
 * {@link HeaderField} to {@link FieldSlot}, so that a single decoding engine
 * ({@link BinaryHeaderDecoder}) serves both revisions.</p>
 *
 * <p>The header is {@value #HEADER_SIZE} bytes for every revision. Only
 * {@link HeaderField#HEADER_VERSION} is read before a table is selected, and
 * its position is the same in every table.</p>
 *
 * <h2>Differences between revisions</h2>
 * <ul>
 *   <li>Legacy files carry the x-axis calibration structure (valid flag,
 *       polynomial order, coefficients, label).</li>
 *   <li>Modern files reuse offset 678 for the 64-bit offset of the trailing
 *       metadata document.</li>
 * </ul>
 */
public final class HeaderLayout
{
    /** Size of the fixed header region for all revisions. */
    public static final int HEADER_SIZE = 4100;

    /** Number of entries in the header ROI table. */
    public static final int ROI_TABLE_CAPACITY = 10;

    /** uint16 values per ROI entry: startx, endx, groupx, starty, endy, groupy. */
    public static final int ROI_ENTRY_FIELDS = 6;

    /** Maximum number of legacy calibration polynomial coefficients. */
    public static final int CALIBRATION_COEFFICIENTS = 6;

    public static final int LNOSCAN_SENTINEL = -1;
    public static final int WINVIEW_ID_SENTINEL = 0x01234567;
    public static final int LAST_VALUE_SENTINEL = 0x5555;

    /** Position of the version field, shared by all tables. */
    public static final FieldSlot VERSION_SLOT = FieldSlot.scalar(1992, NumericType.FLOAT32);

    public static final HeaderLayout LEGACY = new HeaderLayout(FileVersion.LEGACY, legacyTable());
    public static final HeaderLayout MODERN = new HeaderLayout(FileVersion.MODERN, modernTable());

    private final FileVersion version;
    private final Map<HeaderField, FieldSlot> slots;

    private HeaderLayout(FileVersion version, Map<HeaderField, FieldSlot> slots) {
        this.version = version;
        this.slots = Collections.unmodifiableMap(slots);
    }

    public static HeaderLayout forVersion(FileVersion version) {
        return switch (Objects.requireNonNull(version, "version")) {
            case LEGACY -> LEGACY;
            case MODERN -> MODERN;
        };
    }

    public FileVersion version() {
        return version;
    }

    /**
     * Returns the slot of a field, or empty if this revision does not define it.
     */
    public Optional<FieldSlot> slot(HeaderField field) {
        return Optional.ofNullable(slots.get(field));
    }

    /**
     * Returns the slot of a field that every revision defines.
     *
     * @throws IllegalArgumentException if this revision lacks the field
     */
    public FieldSlot require(HeaderField field) {
        FieldSlot slot = slots.get(field);
        if (slot == null) {
            throw new IllegalArgumentException(field + " is not defined for " + version + " headers");
        }
        return slot;
    }

    private static Map<HeaderField, FieldSlot> commonTable() {
        Map<HeaderField, FieldSlot> table = new EnumMap<>(HeaderField.class);
        table.put(HeaderField.SENSOR_WIDTH, FieldSlot.scalar(6, NumericType.UINT16));
        table.put(HeaderField.EXPOSURE, FieldSlot.scalar(10, NumericType.FLOAT32));
        table.put(HeaderField.SENSOR_HEIGHT, FieldSlot.scalar(18, NumericType.UINT16));
        table.put(HeaderField.DATE, FieldSlot.ascii(20, 10));
        table.put(HeaderField.DETECTOR_TEMPERATURE, FieldSlot.scalar(36, NumericType.FLOAT32));
        table.put(HeaderField.STORED_WIDTH, FieldSlot.scalar(42, NumericType.UINT16));
        table.put(HeaderField.DATA_TYPE, FieldSlot.scalar(108, NumericType.INT16));
        table.put(HeaderField.EXPERIMENT_TIME_LOCAL, FieldSlot.ascii(172, 7));
        table.put(HeaderField.EXPERIMENT_TIME_UTC, FieldSlot.ascii(179, 7));
        table.put(HeaderField.GEOMETRIC, FieldSlot.scalar(600, NumericType.UINT16));
        table.put(HeaderField.STORED_HEIGHT, FieldSlot.scalar(656, NumericType.UINT16));
        table.put(HeaderField.LNOSCAN, FieldSlot.scalar(666, NumericType.INT32));
        table.put(HeaderField.FRAME_COUNT, FieldSlot.scalar(1446, NumericType.INT32));
        table.put(HeaderField.ROI_COUNT, FieldSlot.scalar(1510, NumericType.INT16));
        table.put(HeaderField.ROI_TABLE,
                FieldSlot.array(1512, NumericType.UINT16, ROI_TABLE_CAPACITY * ROI_ENTRY_FIELDS));
        table.put(HeaderField.HEADER_VERSION, VERSION_SLOT);
        table.put(HeaderField.WINVIEW_ID, FieldSlot.scalar(2996, NumericType.INT32));
        table.put(HeaderField.LAST_VALUE, FieldSlot.scalar(4098, NumericType.INT16));
        return table;
    }

    private static Map<HeaderField, FieldSlot> legacyTable() {
        Map<HeaderField, FieldSlot> table = commonTable();
        // x-axis CALIBRATION structure starts at 3000
        table.put(HeaderField.CALIBRATION_VALID, FieldSlot.scalar(3098, NumericType.UINT8));
        table.put(HeaderField.CALIBRATION_POLYNOMIAL_ORDER, FieldSlot.scalar(3101, NumericType.UINT8));
        table.put(HeaderField.CALIBRATION_COEFFICIENTS,
                FieldSlot.array(3263, NumericType.FLOAT64, CALIBRATION_COEFFICIENTS));
        table.put(HeaderField.CALIBRATION_LABEL, FieldSlot.ascii(3321, 81));
        return table;
    }

    private static Map<HeaderField, FieldSlot> modernTable() {
        Map<HeaderField, FieldSlot> table = commonTable();
        table.put(HeaderField.XML_OFFSET, FieldSlot.scalar(678, NumericType.UINT64));
        return table;
    }
}
