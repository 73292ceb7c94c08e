package com.pbscache.core.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Rounding {
    private Rounding() {
    }

    static double twoDecimals(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
