package com.labware.echo.validation;

import com.labware.echo.exception.SchemaViolationException;
import com.labware.echo.survey.EchoPlateSurvey;

/**
 * Cross-field checks on a plate survey.
 */
public final class SurveyValidator {

    public static final String FORMAT_VERSION = "FORMAT_VERSION";

    /**
     * The only data format version this library has been checked against.
     */
    public static final int SUPPORTED_DATA_FORMAT_VERSION = 1;

    private SurveyValidator() {
        // Utility class
    }

    /**
     * Runs every check: fatal ones throw, advisories go to {@code sink}.
     */
    public static void validate(EchoPlateSurvey survey, DiagnosticSink sink) {
        checkWellCount(survey.getSurveyTotalWells(), survey.getWells().size());
        checkDataFormatVersion(survey.getDataFormatVersion(), sink);
    }

    /**
     * @throws SchemaViolationException if the number of well records differs from
     *                                  the declared total
     */
    public static void checkWellCount(int declaredTotalWells, int actualWells) {
        if (actualWells != declaredTotalWells) {
            throw new SchemaViolationException("Number of well data items (" + actualWells
                    + ") does not match reported (" + declaredTotalWells + ")");
        }
    }

    public static void checkDataFormatVersion(int dataFormatVersion, DiagnosticSink sink) {
        if (dataFormatVersion != SUPPORTED_DATA_FORMAT_VERSION) {
            sink.warn(FORMAT_VERSION, "Unexpected data format version " + dataFormatVersion
                    + ". This library has been tested on version " + SUPPORTED_DATA_FORMAT_VERSION + ".");
        }
    }
}
