package com.example.footprint.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class GasContribution {
    String gasName;
    double massKg;
    double gwpFactor;
    double co2e;
}
