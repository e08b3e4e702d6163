package com.labware.echo.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Normalized paths needed by the executor. Keeps InspectCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedInspectOptions {
    Path input;
    Path csvOutput;
    Path rewriteOutput;
}
