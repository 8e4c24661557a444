package ai.codegauge.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MetricRounding {
    private MetricRounding() {}

    /**
     * Rounds to two decimals using the exact binary value of {@code value}, ties to even. 2.675 is stored as
     * 2.67499999... and therefore rounds to 2.67.
     */
    public static double round2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
