package com.labware.echo.survey;

import static com.labware.echo.xml.XmlField.attribute;
import static com.labware.echo.xml.XmlField.element;
import static com.labware.echo.xml.XmlField.elementList;
import static com.labware.echo.xml.XmlField.optionalAttribute;

import com.labware.echo.codec.Codecs;
import com.labware.echo.xml.XmlRecord;
import com.labware.echo.xml.XmlSchema;

/**
 * Schema tables for the plate survey dialect and the record conversions.
 *
 * <pre>
 * &lt;platesurvey name barcode date ... totalWells&gt;
 *   &lt;w r c n vl cvl ...&gt;
 *     &lt;e t x y z&gt;&lt;f t o v/&gt;...&lt;/e&gt;
 *   &lt;/w&gt;
 *   ...
 * &lt;/platesurvey&gt;
 * </pre>
 */
public final class SurveySchemas {

    public static final String WELLS = "wells";
    public static final String ECHO_SIGNAL = "echo_signal";
    public static final String FEATURES = "features";

    public static final XmlSchema SIGNAL_FEATURE = XmlSchema.builder("f")
            .field(attribute("feature_type", "t", Codecs.STRING))
            .field(attribute("tof", "o", Codecs.FLOAT))
            .field(attribute("vpp", "v", Codecs.FLOAT))
            .build();

    public static final XmlSchema ECHO_SIGNAL_SCHEMA = XmlSchema.builder("e")
            .field(attribute("signal_type", "t", Codecs.STRING))
            .field(attribute("transducer_x", "x", Codecs.FLOAT))
            .field(attribute("transducer_y", "y", Codecs.FLOAT))
            .field(attribute("transducer_z", "z", Codecs.FLOAT))
            .field(elementList(FEATURES, SIGNAL_FEATURE))
            .build();

    public static final XmlSchema WELL = XmlSchema.builder("w")
            .field(attribute("row", "r", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("column", "c", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("well", "n", Codecs.STRING))
            .field(attribute("volume", "vl", Codecs.ZERO_AS_ABSENT_FLOAT))
            .field(attribute("current_volume", "cvl", Codecs.ZERO_AS_ABSENT_FLOAT))
            .field(attribute("status", "status", Codecs.STRING))
            .field(attribute("fluid", "fld", Codecs.STRING))
            .field(attribute("fluid_units", "fldu", Codecs.STRING))
            .field(attribute("meniscus_x", "x", Codecs.FLOAT))
            .field(attribute("meniscus_y", "y", Codecs.FLOAT))
            .field(attribute("fluid_composition", "s", Codecs.FLOAT))
            .field(attribute("dmso_homogeneous", "fsh", Codecs.FLOAT))
            .field(attribute("dmso_inhomogeneous", "fsinh", Codecs.FLOAT))
            .field(attribute("fluid_thickness", "t", Codecs.FLOAT))
            .field(attribute("current_fluid_thickness", "ct", Codecs.FLOAT))
            .field(attribute("bottom_thickness", "b", Codecs.FLOAT))
            .field(attribute("fluid_thickness_homogeneous", "fth", Codecs.FLOAT))
            .field(attribute("fluid_thickness_inhomogeneous", "ftinh", Codecs.FLOAT))
            .field(attribute("outlier", "o", Codecs.FLOAT))
            .field(attribute("corrective_action", "a", Codecs.STRING))
            .field(element(ECHO_SIGNAL, ECHO_SIGNAL_SCHEMA))
            .build();

    public static final XmlSchema PLATE_SURVEY = XmlSchema.builder("platesurvey")
            .field(attribute("plate_type", "name", Codecs.STRING))
            .field(attribute("plate_barcode", "barcode", Codecs.BARCODE))
            .field(attribute("timestamp", "date", Codecs.TIMESTAMP))
            .field(attribute("instrument_serial_number", "serial_number", Codecs.STRING))
            .field(attribute("vtl", "vtl", Codecs.INTEGER))
            .field(attribute("original", "original", Codecs.INTEGER))
            .field(attribute("data_format_version", "frmt", Codecs.INTEGER))
            .field(attribute("survey_rows", "rows", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("survey_columns", "cols", Codecs.NON_NEGATIVE_INTEGER))
            .field(attribute("survey_total_wells", "totalWells", Codecs.NON_NEGATIVE_INTEGER))
            .field(elementList(WELLS, WELL))
            .field(optionalAttribute("plate_name", "plate_name", Codecs.STRING))
            .field(optionalAttribute("comment", "note", Codecs.STRING))
            .build();

    private SurveySchemas() {
        // Utility class
    }

    /**
     * Header-only record: every scalar survey field, no wells.
     */
    public static XmlRecord headerRecord(EchoPlateSurvey survey) {
        return new XmlRecord(PLATE_SURVEY.getTag())
                .put("plate_type", survey.getPlateType())
                .put("plate_barcode", survey.getPlateBarcode())
                .put("timestamp", survey.getTimestamp())
                .put("instrument_serial_number", survey.getInstrumentSerialNumber())
                .put("vtl", survey.getVtl())
                .put("original", survey.getOriginal())
                .put("data_format_version", survey.getDataFormatVersion())
                .put("survey_rows", survey.getSurveyRows())
                .put("survey_columns", survey.getSurveyColumns())
                .put("survey_total_wells", survey.getSurveyTotalWells())
                .put("plate_name", survey.getPlateName())
                .put("comment", survey.getComment());
    }

    public static XmlRecord toRecord(EchoPlateSurvey survey) {
        return headerRecord(survey)
                .put(WELLS, survey.getWells().stream().map(SurveySchemas::toRecord).toList());
    }

    public static XmlRecord toRecord(WellSurvey well) {
        return new XmlRecord(WELL.getTag())
                .put("row", well.getRow())
                .put("column", well.getColumn())
                .put("well", well.getWell())
                .put("volume", well.getVolume())
                .put("current_volume", well.getCurrentVolume())
                .put("status", well.getStatus())
                .put("fluid", well.getFluid())
                .put("fluid_units", well.getFluidUnits())
                .put("meniscus_x", well.getMeniscusX())
                .put("meniscus_y", well.getMeniscusY())
                .put("fluid_composition", well.getFluidComposition())
                .put("dmso_homogeneous", well.getDmsoHomogeneous())
                .put("dmso_inhomogeneous", well.getDmsoInhomogeneous())
                .put("fluid_thickness", well.getFluidThickness())
                .put("current_fluid_thickness", well.getCurrentFluidThickness())
                .put("bottom_thickness", well.getBottomThickness())
                .put("fluid_thickness_homogeneous", well.getFluidThicknessHomogeneous())
                .put("fluid_thickness_inhomogeneous", well.getFluidThicknessInhomogeneous())
                .put("outlier", well.getOutlier())
                .put("corrective_action", well.getCorrectiveAction())
                .put(ECHO_SIGNAL, toRecord(well.getEchoSignal()));
    }

    static XmlRecord toRecord(EchoSignal signal) {
        return new XmlRecord(ECHO_SIGNAL_SCHEMA.getTag())
                .put("signal_type", signal.getSignalType())
                .put("transducer_x", signal.getTransducerX())
                .put("transducer_y", signal.getTransducerY())
                .put("transducer_z", signal.getTransducerZ())
                .put(FEATURES, signal.getFeatures().stream()
                        .map(f -> new XmlRecord(SIGNAL_FEATURE.getTag())
                                .put("feature_type", f.getFeatureType())
                                .put("tof", f.getTof())
                                .put("vpp", f.getVpp()))
                        .toList());
    }

    /**
     * @throws com.labware.echo.exception.SchemaViolationException if the well count
     *         does not match {@code survey_total_wells}
     */
    public static EchoPlateSurvey surveyFromRecord(XmlRecord r) {
        return EchoPlateSurvey.builder()
                .plateType(r.getString("plate_type"))
                .plateBarcode(r.getString("plate_barcode"))
                .timestamp(r.getTimestamp("timestamp"))
                .instrumentSerialNumber(r.getString("instrument_serial_number"))
                .vtl(r.getInteger("vtl"))
                .original(r.getInteger("original"))
                .dataFormatVersion(r.getInteger("data_format_version"))
                .surveyRows(r.getInteger("survey_rows"))
                .surveyColumns(r.getInteger("survey_columns"))
                .surveyTotalWells(r.getInteger("survey_total_wells"))
                .wells(r.getRecords(WELLS).stream().map(SurveySchemas::wellFromRecord).toList())
                .plateName(r.getString("plate_name"))
                .comment(r.getString("comment"))
                .build();
    }

    static WellSurvey wellFromRecord(XmlRecord r) {
        return WellSurvey.builder()
                .row(r.getInteger("row"))
                .column(r.getInteger("column"))
                .well(r.getString("well"))
                .volume(r.getDouble("volume"))
                .currentVolume(r.getDouble("current_volume"))
                .status(r.getString("status"))
                .fluid(r.getString("fluid"))
                .fluidUnits(r.getString("fluid_units"))
                .meniscusX(r.getDouble("meniscus_x"))
                .meniscusY(r.getDouble("meniscus_y"))
                .fluidComposition(r.getDouble("fluid_composition"))
                .dmsoHomogeneous(r.getDouble("dmso_homogeneous"))
                .dmsoInhomogeneous(r.getDouble("dmso_inhomogeneous"))
                .fluidThickness(r.getDouble("fluid_thickness"))
                .currentFluidThickness(r.getDouble("current_fluid_thickness"))
                .bottomThickness(r.getDouble("bottom_thickness"))
                .fluidThicknessHomogeneous(r.getDouble("fluid_thickness_homogeneous"))
                .fluidThicknessInhomogeneous(r.getDouble("fluid_thickness_inhomogeneous"))
                .outlier(r.getDouble("outlier"))
                .correctiveAction(r.getString("corrective_action"))
                .echoSignal(signalFromRecord(r.getRecord(ECHO_SIGNAL)))
                .build();
    }

    static EchoSignal signalFromRecord(XmlRecord r) {
        return EchoSignal.builder()
                .signalType(r.getString("signal_type"))
                .transducerX(r.getDouble("transducer_x"))
                .transducerY(r.getDouble("transducer_y"))
                .transducerZ(r.getDouble("transducer_z"))
                .features(r.getRecords(FEATURES).stream()
                        .map(f -> SignalFeature.builder()
                                .featureType(f.getString("feature_type"))
                                .tof(f.getDouble("tof"))
                                .vpp(f.getDouble("vpp"))
                                .build())
                        .toList())
                .build();
    }
}
