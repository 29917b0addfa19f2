package org.puneet.searchspace.parameter;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Precision;

import java.util.List;
import java.util.Objects;

/**
 * Numeric parameter over the closed interval {@code [lower, upper]}, optionally
 * searched on a log10 or logit scale. Range parameters are never hierarchical.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class RangeParameter extends Parameter {

    private final double lower;
    private final double upper;
    private final boolean logScale;
    private final boolean logitScale;
    private final Integer digits;

    /**
     * Creates a linear-scale range parameter.
     *
     * @param name the parameter name
     * @param parameterType INT or FLOAT
     * @param lower inclusive lower bound
     * @param upper inclusive upper bound
     * @throws IllegalArgumentException if the definition is invalid
     */
    public RangeParameter(String name, ParameterType parameterType, double lower, double upper) {
        this(name, parameterType, lower, upper, false, false, null, false, null);
    }

    /**
     * Creates a range parameter with all options.
     *
     * @param name the parameter name
     * @param parameterType INT or FLOAT
     * @param lower inclusive lower bound
     * @param upper inclusive upper bound
     * @param logScale whether the parameter is searched on a log10 scale
     * @param logitScale whether the parameter is searched on a logit scale
     * @param digits number of decimal digits FLOAT values are rounded to, may be null
     * @param fidelity whether the parameter is a fidelity parameter
     * @param targetValue target fidelity value, may be null
     * @throws IllegalArgumentException if the definition is invalid
     */
    public RangeParameter(String name, ParameterType parameterType, double lower, double upper,
                          boolean logScale, boolean logitScale, Integer digits,
                          boolean fidelity, Number targetValue) {
        super(name, parameterType, fidelity, targetValue, null);

        if (!parameterType.isNumeric()) {
            throw new IllegalArgumentException(
                "RangeParameter " + name + " must be of type INT or FLOAT, got: " + parameterType);
        }
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw new IllegalArgumentException(
                "Bounds of parameter " + name + " must be finite, got: [" + lower + ", " + upper + "]");
        }
        if (lower >= upper) {
            throw new IllegalArgumentException(
                "Upper bound of parameter " + name + " must be strictly larger than lower bound, got: ["
                    + lower + ", " + upper + "]");
        }
        if (parameterType == ParameterType.INT && (lower != Math.rint(lower) || upper != Math.rint(upper))) {
            throw new IllegalArgumentException(
                "Bounds of INT parameter " + name + " must be integers, got: [" + lower + ", " + upper + "]");
        }
        if (parameterType == ParameterType.INT && (lower < Integer.MIN_VALUE || upper > Integer.MAX_VALUE)) {
            throw new IllegalArgumentException(
                "Bounds of INT parameter " + name + " must fit in a 32-bit int, got: ["
                    + lower + ", " + upper + "]");
        }
        if (logScale && logitScale) {
            throw new IllegalArgumentException(
                "Parameter " + name + " cannot be both log-scale and logit-scale");
        }
        if (logScale && lower <= 0.0) {
            throw new IllegalArgumentException(
                "Log-scale parameter " + name + " requires a positive lower bound, got: " + lower);
        }
        if (logitScale) {
            if (parameterType == ParameterType.INT) {
                throw new IllegalArgumentException("Logit-scale parameter " + name + " cannot be of type INT");
            }
            if (lower <= 0.0 || upper >= 1.0) {
                throw new IllegalArgumentException(
                    "Logit-scale parameter " + name + " requires bounds inside (0, 1), got: ["
                        + lower + ", " + upper + "]");
            }
        }
        if (digits != null && digits < 0) {
            throw new IllegalArgumentException(
                "Digits of parameter " + name + " must be non-negative, got: " + digits);
        }

        this.lower = lower;
        this.upper = upper;
        this.logScale = logScale;
        this.logitScale = logitScale;
        this.digits = digits;

        requireTargetValueInDomain();
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.RANGE;
    }

    @Override
    public boolean validate(Object value) {
        if (!isValidType(value)) {
            return false;
        }
        double v = ((Number) value).doubleValue();
        return !Double.isNaN(v) && v >= lower && v <= upper;
    }

    @Override
    public Object cast(Object value) {
        Object cast = super.cast(value);
        if (cast instanceof Double && digits != null) {
            return Precision.round((Double) cast, digits);
        }
        return cast;
    }

    /**
     * Midpoint of the domain on its search scale: linear, log10 or logit. INT
     * parameters are offset by 0.5 before the truncating cast.
     */
    @Override
    public Object midpoint() {
        double value;
        if (logScale) {
            value = FastMath.pow(10.0, (FastMath.log10(lower) + FastMath.log10(upper)) / 2.0);
        } else if (logitScale) {
            value = expit((logit(lower) + logit(upper)) / 2.0);
        } else {
            value = (lower + upper) / 2.0;
        }
        return castWithIntegerOffset(value);
    }

    @Override
    public Object sample(RandomGenerator rng) {
        double value = lower + rng.nextDouble() * (upper - lower);
        return castWithIntegerOffset(value);
    }

    private Object castWithIntegerOffset(double value) {
        if (getParameterType() == ParameterType.INT) {
            // keeps the truncating cast centred on the interval
            value += 0.5;
        }
        return cast(value);
    }

    private static double logit(double p) {
        return FastMath.log(p / (1.0 - p));
    }

    private static double expit(double x) {
        return 1.0 / (1.0 + FastMath.exp(-x));
    }

    @Override
    public RangeParameter copy() {
        return new RangeParameter(getName(), getParameterType(), lower, upper, logScale, logitScale,
                digits, isFidelity(), (Number) getTargetValue());
    }

    @Override
    public String domainRepr() {
        return "range=[" + formatNumber(getParameterType(), lower) + ", "
                + formatNumber(getParameterType(), upper) + "]";
    }

    @Override
    public List<String> getFlags() {
        List<String> flags = super.getFlags();
        if (logScale) {
            flags.add(0, "log_scale");
        }
        if (logitScale) {
            flags.add(0, "logit_scale");
        }
        return flags;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public boolean isLogScale() {
        return logScale;
    }

    public boolean isLogitScale() {
        return logitScale;
    }

    /**
     * Rounding digits for FLOAT values.
     *
     * @return the number of digits, or null when values are not rounded
     */
    public Integer getDigits() {
        return digits;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        RangeParameter that = (RangeParameter) o;
        return Double.compare(that.lower, lower) == 0 &&
               Double.compare(that.upper, upper) == 0 &&
               logScale == that.logScale &&
               logitScale == that.logitScale &&
               Objects.equals(digits, that.digits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), lower, upper, logScale, logitScale, digits);
    }
}
