package com.catalog.crossmatch.schema;

import com.catalog.crossmatch.error.CatalogueValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

/**
 * Brings multi-frequency catalogue values to a single target frequency.
 *
 * <p>Values are linearly interpolated between the two nearest bracketing frequencies, or
 * extrapolated from the two nearest frequencies when the target lies outside the covered
 * range. Error terms propagate as {@code sqrt((e1 * w1)^2 + (e2 * w2)^2)}.</p>
 */
public final class FrequencyInterpolator {
    private static final Logger log = LoggerFactory.getLogger(FrequencyInterpolator.class);

    private FrequencyInterpolator() {
    }

    /**
     * Picks the frequency pair and weights for {@code targetMHz}.
     *
     * @param catalogue   catalogue name for error messages
     * @param tags        frequency tags, at least one
     * @param targetMHz   frequency to interpolate to
     * @param extrapolate whether a target outside the covered range is allowed
     */
    public static Weights weightsFor(String catalogue, List<String> tags, double targetMHz, boolean extrapolate) {
        if (tags.isEmpty()) {
            throw new IllegalArgumentException("at least one frequency is required");
        }
        List<String> sorted = tags.stream().sorted(Comparator.comparingDouble(Double::parseDouble)).toList();
        if (sorted.size() == 1) {
            return new Weights(sorted.get(0), sorted.get(0), 1.0, 0.0);
        }
        for (String tag : sorted) {
            if (Double.parseDouble(tag) == targetMHz) {
                return new Weights(tag, tag, 1.0, 0.0);
            }
        }

        double min = Double.parseDouble(sorted.get(0));
        double max = Double.parseDouble(sorted.get(sorted.size() - 1));
        String low;
        String high;
        if (targetMHz < min || targetMHz > max) {
            if (!extrapolate) {
                throw new CatalogueValidationException(catalogue, null, "target frequency " + targetMHz
                        + " MHz lies outside the catalogue range [" + min + ", " + max + "] MHz");
            }
            boolean below = targetMHz < min;
            low = below ? sorted.get(0) : sorted.get(sorted.size() - 2);
            high = below ? sorted.get(1) : sorted.get(sorted.size() - 1);
            log.warn("frequency.extrapolated catalogue={} target={} range=[{}, {}]", catalogue, targetMHz, min, max);
        } else {
            int upper = 1;
            while (Double.parseDouble(sorted.get(upper)) < targetMHz) {
                upper++;
            }
            low = sorted.get(upper - 1);
            high = sorted.get(upper);
        }
        double f1 = Double.parseDouble(low);
        double f2 = Double.parseDouble(high);
        return new Weights(low, high, (f2 - targetMHz) / (f2 - f1), (targetMHz - f1) / (f2 - f1));
    }

    /**
     * Linear combination {@code value = lowWeight * low + highWeight * high}.
     */
    public record Weights(String lowTag, String highTag, double lowWeight, double highWeight) {

        public boolean isSingle() {
            return lowTag.equals(highTag);
        }

        public double value(double low, double high) {
            return isSingle() ? low : lowWeight * low + highWeight * high;
        }

        public double error(double lowError, double highError) {
            return isSingle() ? lowError : Math.hypot(lowError * lowWeight, highError * highWeight);
        }
    }
}
