package com.di.pgproof.sandbox;

import lombok.Value;

/**
 * One table copied into a sandbox, with the number of rows that landed there.
 */
@Value
public class SampledTable {
    String name;
    long rowCount;
    double samplePercent;
}
