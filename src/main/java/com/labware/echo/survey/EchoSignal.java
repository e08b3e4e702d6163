package com.labware.echo.survey;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Instrument signal record for one well ({@code <e>}); features keep scan order.
 */
@Value
@Builder
public class EchoSignal {
    @NonNull
    String signalType;
    double transducerX;
    double transducerY;
    double transducerZ;
    @Singular
    List<SignalFeature> features;
}
