package com.floodsampler.core.sampling;

public enum GaugeCorroboration {
    OFF,
    LENIENT,
    STRICT
}
