package com.lennon.splitshift.core;

import com.lennon.splitshift.spi.ShiftEngine;
import com.lennon.splitshift.spi.SplitShiftEngine;

public final class SplitShift {
    private static final ShiftEngine DEFAULT = new SplitShiftEngine();

    private SplitShift() {}

    public static ShiftEngine build(){
        // engine is stateless, share one instance
        return DEFAULT;
    }
}
