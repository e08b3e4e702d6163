package com.labware.echo.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.labware.echo.cli.exception.OptionsValidationException;
import com.labware.echo.cli.model.DocumentKind;
import com.labware.echo.cli.model.InspectOptions;
import com.labware.echo.cli.model.ValidatedInspectOptions;
import com.labware.echo.cli.output.InspectResultsPrinter;
import com.labware.echo.cli.output.TableCsvRenderer;
import com.labware.echo.cli.validation.InspectOptionsValidator;
import com.labware.echo.exception.EchoXmlException;
import com.labware.echo.labware.Labware;
import com.labware.echo.survey.EchoPlateSurvey;
import com.labware.echo.table.Table;
import com.labware.echo.util.FileWriteUtil;
import com.labware.echo.validation.CollectingDiagnosticSink;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that reads an Echo labware or plate survey file, validates it and
 * optionally exports its table projection or a canonical rewrite.
 *
 * Exit codes: 0 on success, 1 when the document cannot be read or fails
 * validation, 2 when the options are invalid.
 */
@Command(
        name = "inspect",
        mixinStandardHelpOptions = true,
        version = "echo-xml 1.0.0",
        description = "Validates an Echo labware (.elwx/.elw) or plate survey XML file and optionally exports it."
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_DOCUMENT = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private InspectOptions options;

    private final InspectOptionsValidator validator = new InspectOptionsValidator();
    private final InspectResultsPrinter printer = new InspectResultsPrinter();
    private final TableCsvRenderer csvRenderer = new TableCsvRenderer();

    @Override
    public Integer call() {
        ValidatedInspectOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(err -> log.error("{}", err));
            return EXIT_INVALID_OPTIONS;
        }

        try {
            byte[] raw = Files.readAllBytes(validated.getInput());
            DocumentKind kind = options.getKind() == DocumentKind.AUTO ? DocumentKind.detect(raw) : options.getKind();
            printer.printBanner(validated, kind);

            Table table;
            byte[] rewritten;
            if (kind == DocumentKind.LABWARE) {
                Labware labware = Labware.fromBytes(raw);
                printer.printLabware(labware);
                table = labware.toTable();
                rewritten = validated.getRewriteOutput() != null ? labware.toBytes() : null;
            } else {
                CollectingDiagnosticSink diagnostics = new CollectingDiagnosticSink();
                EchoPlateSurvey survey = EchoPlateSurvey.fromBytes(raw, diagnostics);
                printer.printSurvey(survey, diagnostics);
                table = survey.toTable();
                rewritten = validated.getRewriteOutput() != null ? survey.toBytes() : null;
            }

            if (validated.getCsvOutput() != null) {
                csvRenderer.write(table, validated.getCsvOutput());
            }
            if (rewritten != null) {
                FileWriteUtil.safeWrite(validated.getRewriteOutput(), rewritten);
            }

            printer.printSuccess(validated, table.rowCount());
            return EXIT_OK;

        } catch (EchoXmlException e) {
            log.error("Invalid document {}: {}", validated.getInput(), e.getMessage());
            return EXIT_INVALID_DOCUMENT;
        } catch (IOException e) {
            log.error("I/O failure while inspecting {}", validated.getInput(), e);
            return EXIT_INVALID_DOCUMENT;
        }
    }
}
