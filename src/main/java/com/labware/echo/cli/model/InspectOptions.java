package com.labware.echo.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "inspect" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class InspectOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "Labware (.elwx/.elw) or plate survey XML file")
	private Path input;

	@Option(names = { "--kind", "-k" }, defaultValue = "AUTO",
			description = "Document kind: AUTO, LABWARE or SURVEY (default: detected from the root element)")
	private DocumentKind kind;

	@Option(names = { "--csv" }, description = "Write the table projection to this CSV file")
	private Path csvOutput;

	@Option(names = { "--rewrite" }, description = "Re-serialize the validated document to this XML file")
	private Path rewriteOutput;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output files")
	private boolean force;

}
