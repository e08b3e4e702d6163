package com.labware.echo.survey;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One acoustic feature detected in a well's echo ({@code <f>}).
 */
@Value
@Builder
public class SignalFeature {
    @NonNull
    String featureType;
    /**
     * Time of flight.
     */
    double tof;
    /**
     * Peak-to-peak voltage.
     */
    double vpp;
}
