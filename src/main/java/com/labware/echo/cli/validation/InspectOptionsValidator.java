package com.labware.echo.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.labware.echo.cli.exception.OptionsValidationException;
import com.labware.echo.cli.model.InspectOptions;
import com.labware.echo.cli.model.ValidatedInspectOptions;

public class InspectOptionsValidator {

	public ValidatedInspectOptions validate(InspectOptions o) {
		List<String> errors = new ArrayList<>();

		Path input = normalize(o.getInput());
		if (input == null) {
			errors.add("Input file is required (--input / -i).");
		} else if (!Files.isRegularFile(input)) {
			errors.add("Input file does not exist or is not a regular file: " + input);
		} else if (!Files.isReadable(input)) {
			errors.add("Input file is not readable: " + input);
		}

		Path csv = normalize(o.getCsvOutput());
		Path rewrite = normalize(o.getRewriteOutput());

		checkOutput("CSV output", csv, input, o.isForce(), errors);
		checkOutput("Rewrite output", rewrite, input, o.isForce(), errors);

		if (csv != null && csv.equals(rewrite)) {
			errors.add("--csv and --rewrite must name different files: " + csv);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedInspectOptions(input, csv, rewrite);
	}

	private static void checkOutput(String label, Path output, Path input, boolean force, List<String> errors) {
		if (output == null) {
			return;
		}
		if (output.equals(input)) {
			errors.add(label + " must not overwrite the input file: " + output);
		} else if (Files.isDirectory(output)) {
			errors.add(label + " is a directory: " + output);
		} else if (Files.exists(output) && !force) {
			errors.add(label + " already exists: " + output + ". Use --force to overwrite.");
		}
	}

	private static Path normalize(Path p) {
		return p == null ? null : p.toAbsolutePath().normalize();
	}
}
