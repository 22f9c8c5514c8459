package com.github.lpjava;

import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.type.context.NumberContext;

import java.math.BigDecimal;

/**
 * Miscellaneous utilities.
 */
public class Util {
    private Util() {
    }

    /**
     * Helper to build a new {@link ExpressionsBasedModel} for ojAlgo, with a default set of options to control
     * rounding of the solution values.
     *
     * @return the built model
     */
    public static ExpressionsBasedModel newModel() {
        var options = new Optimisation.Options();
        options.solution = NumberContext.of(14, 9);
        return new ExpressionsBasedModel(options);
    }

    /**
     * Format a coefficient or bound in plain decimal notation, without trailing zeroes. Used when writing model
     * files for external solvers, which don't all accept scientific notation.
     *
     * @param value a finite number
     * @return e.g. <code>"10"</code>, <code>"-0.5"</code>
     * @throws IllegalArgumentException if <code>value</code> is infinite or NaN
     */
    public static String format(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("not a finite number: " + value);
        }
        return toBigDecimal(value).toPlainString();
    }

    /**
     * Convert a double to a {@link BigDecimal} for ojAlgo, stripping the trailing zeroes.
     *
     * @param value a finite number
     * @return the equivalent {@link BigDecimal}
     */
    public static BigDecimal toBigDecimal(double value) {
        var decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        return decimal.signum() == 0 ? BigDecimal.ZERO : decimal;
    }
}
