package com.labware.echo.labware;

import static com.labware.echo.xml.XmlField.attribute;
import static com.labware.echo.xml.XmlField.optionalAttribute;
import static com.labware.echo.xml.XmlField.wrappedElementList;

import com.labware.echo.codec.Codecs;
import com.labware.echo.xml.XmlRecord;
import com.labware.echo.xml.XmlSchema;

/**
 * Schema tables for the two labware layouts and the conversions between plate
 * records and {@link PlateInfo} values.
 *
 * <pre>
 * &lt;EchoLabware&gt;
 *   &lt;sourceplates&gt;&lt;plateinfo .../&gt;...&lt;/sourceplates&gt;
 *   &lt;destinationplates&gt;&lt;plateinfo .../&gt;...&lt;/destinationplates&gt;
 * &lt;/EchoLabware&gt;
 * </pre>
 */
public final class LabwareSchemas {

    public static final String ROOT_TAG = "EchoLabware";
    public static final String SOURCE_PLATES = "sourceplates";
    public static final String DESTINATION_PLATES = "destinationplates";

    /**
     * {@code plateinfo} as written in ELWX files, every field stored.
     */
    public static final XmlSchema PLATE_INFO = XmlSchema.builder("plateinfo")
            .field(attribute("platetype", Codecs.STRING))
            .field(attribute("plateformat", Codecs.STRING))
            .field(attribute("usage", PlateUsage.CODEC))
            .field(optionalAttribute("fluid", Codecs.STRING))
            .field(attribute("manufacturer", Codecs.STRING))
            .field(attribute("lotnumber", Codecs.STRING))
            .field(attribute("partnumber", Codecs.STRING))
            .field(attribute("rows", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("cols", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("a1offsety", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("centerspacingx", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("centerspacingy", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("plateheight", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("skirtheight", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("wellwidth", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("welllength", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("wellcapacity", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("bottominset", Codecs.FLOAT))
            .field(attribute("centerwellposx", Codecs.FLOAT))
            .field(attribute("centerwellposy", Codecs.FLOAT))
            .field(optionalAttribute("minwellvol", Codecs.FLOAT))
            .field(optionalAttribute("maxwellvol", Codecs.FLOAT))
            .field(optionalAttribute("maxvoltotal", Codecs.FLOAT))
            .field(optionalAttribute("minvolume", Codecs.FLOAT))
            .field(optionalAttribute("dropvolume", Codecs.FLOAT))
            .build();

    /**
     * {@code plateinfo} as written in ELW files.
     */
    public static final XmlSchema FIXED_GEOMETRY_PLATE_INFO =
            PLATE_INFO.excluding("usage", "welllength", "plateformat");

    public static final XmlSchema ELWX_DOCUMENT = XmlSchema.builder(ROOT_TAG)
            .field(wrappedElementList(SOURCE_PLATES, SOURCE_PLATES, PLATE_INFO))
            .field(wrappedElementList(DESTINATION_PLATES, DESTINATION_PLATES, PLATE_INFO))
            .build();

    public static final XmlSchema ELW_DOCUMENT = XmlSchema.builder(ROOT_TAG)
            .field(wrappedElementList(SOURCE_PLATES, SOURCE_PLATES, FIXED_GEOMETRY_PLATE_INFO))
            .field(wrappedElementList(DESTINATION_PLATES, DESTINATION_PLATES, FIXED_GEOMETRY_PLATE_INFO))
            .build();

    private LabwareSchemas() {
        // Utility class
    }

    /**
     * Generic {@code plateinfo} record for any plate view; derived fields are
     * materialized.
     */
    public static XmlRecord toRecord(PlateInfo plate) {
        return new XmlRecord(PLATE_INFO.getTag())
                .put("platetype", plate.getPlatetype())
                .put("plateformat", plate.getPlateformat())
                .put("usage", plate.getUsage())
                .put("fluid", plate.getFluid())
                .put("manufacturer", plate.getManufacturer())
                .put("lotnumber", plate.getLotnumber())
                .put("partnumber", plate.getPartnumber())
                .put("rows", plate.getRows())
                .put("cols", plate.getCols())
                .put("a1offsety", plate.getA1offsety())
                .put("centerspacingx", plate.getCenterspacingx())
                .put("centerspacingy", plate.getCenterspacingy())
                .put("plateheight", plate.getPlateheight())
                .put("skirtheight", plate.getSkirtheight())
                .put("wellwidth", plate.getWellwidth())
                .put("welllength", plate.getWelllength())
                .put("wellcapacity", plate.getWellcapacity())
                .put("bottominset", plate.getBottominset())
                .put("centerwellposx", plate.getCenterwellposx())
                .put("centerwellposy", plate.getCenterwellposy())
                .put("minwellvol", plate.getMinwellvol())
                .put("maxwellvol", plate.getMaxwellvol())
                .put("maxvoltotal", plate.getMaxvoltotal())
                .put("minvolume", plate.getMinvolume())
                .put("dropvolume", plate.getDropvolume());
    }

    public static GenericPlateInfo genericFromRecord(XmlRecord r) {
        return GenericPlateInfo.builder()
                .platetype(r.getString("platetype"))
                .plateformat(r.getString("plateformat"))
                .usage((PlateUsage) r.get("usage"))
                .fluid(r.getString("fluid"))
                .manufacturer(r.getString("manufacturer"))
                .lotnumber(r.getString("lotnumber"))
                .partnumber(r.getString("partnumber"))
                .rows(r.getInteger("rows"))
                .cols(r.getInteger("cols"))
                .a1offsety(r.getInteger("a1offsety"))
                .centerspacingx(r.getInteger("centerspacingx"))
                .centerspacingy(r.getInteger("centerspacingy"))
                .plateheight(r.getInteger("plateheight"))
                .skirtheight(r.getInteger("skirtheight"))
                .wellwidth(r.getInteger("wellwidth"))
                .welllength(r.getInteger("welllength"))
                .wellcapacity(r.getInteger("wellcapacity"))
                .bottominset(r.getDouble("bottominset"))
                .centerwellposx(r.getDouble("centerwellposx"))
                .centerwellposy(r.getDouble("centerwellposy"))
                .minwellvol(r.getDouble("minwellvol"))
                .maxwellvol(r.getDouble("maxwellvol"))
                .maxvoltotal(r.getDouble("maxvoltotal"))
                .minvolume(r.getDouble("minvolume"))
                .dropvolume(r.getDouble("dropvolume"))
                .build();
    }

    public static FixedGeometryPlateInfo fixedGeometryFromRecord(XmlRecord r, PlateUsage usage) {
        return FixedGeometryPlateInfo.builder()
                .platetype(r.getString("platetype"))
                .usage(usage)
                .fluid(r.getString("fluid"))
                .manufacturer(r.getString("manufacturer"))
                .lotnumber(r.getString("lotnumber"))
                .partnumber(r.getString("partnumber"))
                .rows(r.getInteger("rows"))
                .cols(r.getInteger("cols"))
                .a1offsety(r.getInteger("a1offsety"))
                .centerspacingx(r.getInteger("centerspacingx"))
                .centerspacingy(r.getInteger("centerspacingy"))
                .plateheight(r.getInteger("plateheight"))
                .skirtheight(r.getInteger("skirtheight"))
                .wellwidth(r.getInteger("wellwidth"))
                .wellcapacity(r.getInteger("wellcapacity"))
                .bottominset(r.getDouble("bottominset"))
                .centerwellposx(r.getDouble("centerwellposx"))
                .centerwellposy(r.getDouble("centerwellposy"))
                .minwellvol(r.getDouble("minwellvol"))
                .maxwellvol(r.getDouble("maxwellvol"))
                .maxvoltotal(r.getDouble("maxvoltotal"))
                .minvolume(r.getDouble("minvolume"))
                .dropvolume(r.getDouble("dropvolume"))
                .build();
    }
}
