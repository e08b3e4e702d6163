package com.labware.echo.survey;

import static com.labware.echo.util.ModelChecks.nonNegative;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Function;

import com.labware.echo.exception.SchemaViolationException;
import com.labware.echo.table.SurveyTableProjection;
import com.labware.echo.table.Table;
import com.labware.echo.validation.DiagnosticSink;
import com.labware.echo.validation.SurveyValidator;
import com.labware.echo.xml.XmlWriteOptions;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One plate survey session as written by the Echo software ({@code <platesurvey>}).
 *
 * Construction enforces that the number of well records equals
 * {@code surveyTotalWells} and that the grid sizes are non-negative; a survey
 * that breaks either is never created, including through {@link #toBuilder()}.
 */
@Value
public class EchoPlateSurvey {

    /**
     * The {@code name} attribute. In practice always the plate type.
     */
    String plateType;

    /**
     * {@code null} when the file says {@code UnknownBarCode}.
     */
    String plateBarcode;

    LocalDateTime timestamp;
    String instrumentSerialNumber;
    int vtl;
    int original;
    int dataFormatVersion;
    int surveyRows;
    int surveyColumns;
    int surveyTotalWells;
    List<WellSurvey> wells;

    /**
     * Not part of the vendor format; kept for files written by other tooling.
     */
    String plateName;

    /**
     * Not part of the vendor format ({@code note} attribute).
     */
    String comment;

    @Builder(toBuilder = true)
    public EchoPlateSurvey(@NonNull String plateType, String plateBarcode, @NonNull LocalDateTime timestamp,
                           @NonNull String instrumentSerialNumber, int vtl, int original,
                           int dataFormatVersion, int surveyRows, int surveyColumns, int surveyTotalWells,
                           @NonNull @Singular List<WellSurvey> wells, String plateName, String comment) {
        SurveyValidator.checkWellCount(surveyTotalWells, wells.size());
        this.plateType = plateType;
        this.plateBarcode = plateBarcode;
        this.timestamp = timestamp;
        this.instrumentSerialNumber = instrumentSerialNumber;
        this.vtl = vtl;
        this.original = original;
        this.dataFormatVersion = dataFormatVersion;
        this.surveyRows = nonNegative("surveyRows", surveyRows);
        this.surveyColumns = nonNegative("surveyColumns", surveyColumns);
        this.surveyTotalWells = nonNegative("surveyTotalWells", surveyTotalWells);
        this.wells = List.copyOf(wells);
        this.plateName = plateName;
        this.comment = comment;
    }

    /**
     * Reads a survey file, reporting advisories through the log.
     *
     * @throws SchemaViolationException if the well count is inconsistent
     */
    public static EchoPlateSurvey read(Path path) throws IOException {
        return read(path, DiagnosticSink.logging());
    }

    public static EchoPlateSurvey read(Path path, DiagnosticSink sink) throws IOException {
        return new PlateSurveyXmlReader(sink).read(path);
    }

    public static EchoPlateSurvey fromBytes(byte[] raw) {
        return fromBytes(raw, DiagnosticSink.logging());
    }

    public static EchoPlateSurvey fromBytes(byte[] raw, DiagnosticSink sink) {
        return new PlateSurveyXmlReader(sink).read(raw);
    }

    public byte[] toBytes() {
        return toBytes(XmlWriteOptions.DEFAULTS);
    }

    public byte[] toBytes(XmlWriteOptions options) {
        return new PlateSurveyXmlWriter().write(this, options);
    }

    public Path write(Path path) throws IOException {
        return write(path, XmlWriteOptions.DEFAULTS);
    }

    public Path write(Path path, XmlWriteOptions options) throws IOException {
        return new PlateSurveyXmlWriter().write(this, path, options);
    }

    /**
     * Writes to the path derived from this survey, e.g. by a {@link SurveyPathTemplate}.
     *
     * @return the path written
     */
    public Path write(Function<? super EchoPlateSurvey, ? extends Path> pathFunction) throws IOException {
        return write(pathFunction.apply(this));
    }

    /**
     * Re-runs all checks on this survey.
     */
    public void validate(DiagnosticSink sink) {
        SurveyValidator.validate(this, sink);
    }

    /**
     * One row per well with the header fields repeated on every row. Echo signals
     * and their features are not part of the table.
     */
    public Table toTable() {
        return SurveyTableProjection.project(this);
    }
}
