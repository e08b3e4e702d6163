package com.labware.echo.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.labware.echo.cli.model.DocumentKind;
import com.labware.echo.cli.model.ValidatedInspectOptions;
import com.labware.echo.labware.Labware;
import com.labware.echo.labware.PlateInfo;
import com.labware.echo.survey.EchoPlateSurvey;
import com.labware.echo.validation.CollectingDiagnosticSink;

/**
 * Responsible only for printing CLI output for the "inspect" command.
 * No validation, no execution.
 */
public class InspectResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(InspectResultsPrinter.class);

    public void printBanner(ValidatedInspectOptions v, DocumentKind kind) {
        log.info("=================================================");
        log.info("Echo XML Inspector");
        log.info("=================================================");
        log.info("Input: {}", v.getInput());
        log.info("Kind: {}", kind);
        log.info("CSV Output: {}", v.getCsvOutput() != null ? v.getCsvOutput() : "None");
        log.info("Rewrite Output: {}", v.getRewriteOutput() != null ? v.getRewriteOutput() : "None");
        log.info("=================================================");
    }

    public void printLabware(Labware labware) {
        log.info("Plate types: {}", labware.size());
        log.info("  Source: {}", labware.getSourcePlates().stream().map(PlateInfo::getPlatetype).toList());
        log.info("  Destination: {}", labware.getDestinationPlates().stream().map(PlateInfo::getPlatetype).toList());
        for (PlateInfo plate : labware.getPlates()) {
            log.info("  {} {} {}x{} capacity={}", plate.getPlatetype(), plate.getUsage().getCode(),
                    plate.getRows(), plate.getCols(), plate.getWellcapacity());
        }
    }

    public void printSurvey(EchoPlateSurvey survey, CollectingDiagnosticSink diagnostics) {
        log.info("Plate Type: {}", survey.getPlateType());
        log.info("Barcode: {}", survey.getPlateBarcode() != null ? survey.getPlateBarcode() : "None");
        log.info("Timestamp: {}", survey.getTimestamp());
        log.info("Instrument: {}", survey.getInstrumentSerialNumber());
        log.info("Data Format Version: {}", survey.getDataFormatVersion());
        log.info("Survey Grid: {}x{} ({} wells)", survey.getSurveyRows(), survey.getSurveyColumns(),
                survey.getSurveyTotalWells());
        long measured = survey.getWells().stream().filter(w -> w.getVolume() != null).count();
        log.info("Wells With Volume: {}", measured);
        for (CollectingDiagnosticSink.Diagnostic warning : diagnostics.getWarnings()) {
            log.warn("[{}] {}", warning.getCode(), warning.getMessage());
        }
    }

    public void printSuccess(ValidatedInspectOptions v, int rows) {
        log.info("=================================================");
        log.info("DOCUMENT VALID");
        log.info("=================================================");
        log.info("Table Rows: {}", rows);
        if (v.getCsvOutput() != null) {
            log.info("CSV written to: {}", v.getCsvOutput());
        }
        if (v.getRewriteOutput() != null) {
            log.info("XML written to: {}", v.getRewriteOutput());
        }
    }
}
