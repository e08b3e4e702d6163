package com.labware.echo.survey;

import static com.labware.echo.util.ModelChecks.nonNegative;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Measurements for one well ({@code <w>}).
 *
 * {@code volume} and {@code currentVolume} are {@code null} when the instrument
 * wrote {@code 0}. Grid indices are zero-based and never negative.
 */
@Value
public class WellSurvey {
    int row;
    int column;
    String well;
    Double volume;
    Double currentVolume;
    String status;
    String fluid;
    String fluidUnits;
    double meniscusX;
    double meniscusY;
    double fluidComposition;
    double dmsoHomogeneous;
    double dmsoInhomogeneous;
    double fluidThickness;
    double currentFluidThickness;
    double bottomThickness;
    double fluidThicknessHomogeneous;
    double fluidThicknessInhomogeneous;
    double outlier;
    String correctiveAction;
    EchoSignal echoSignal;

    @Builder(toBuilder = true)
    public WellSurvey(int row, int column, @NonNull String well, Double volume, Double currentVolume,
                      @NonNull String status, @NonNull String fluid, @NonNull String fluidUnits,
                      double meniscusX, double meniscusY, double fluidComposition, double dmsoHomogeneous,
                      double dmsoInhomogeneous, double fluidThickness, double currentFluidThickness,
                      double bottomThickness, double fluidThicknessHomogeneous,
                      double fluidThicknessInhomogeneous, double outlier, @NonNull String correctiveAction,
                      @NonNull EchoSignal echoSignal) {
        this.row = nonNegative("row", row);
        this.column = nonNegative("column", column);
        this.well = well;
        this.volume = volume;
        this.currentVolume = currentVolume;
        this.status = status;
        this.fluid = fluid;
        this.fluidUnits = fluidUnits;
        this.meniscusX = meniscusX;
        this.meniscusY = meniscusY;
        this.fluidComposition = fluidComposition;
        this.dmsoHomogeneous = dmsoHomogeneous;
        this.dmsoInhomogeneous = dmsoInhomogeneous;
        this.fluidThickness = fluidThickness;
        this.currentFluidThickness = currentFluidThickness;
        this.bottomThickness = bottomThickness;
        this.fluidThicknessHomogeneous = fluidThicknessHomogeneous;
        this.fluidThicknessInhomogeneous = fluidThicknessInhomogeneous;
        this.outlier = outlier;
        this.correctiveAction = correctiveAction;
        this.echoSignal = echoSignal;
    }
}
