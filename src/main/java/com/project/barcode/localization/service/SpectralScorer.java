package com.project.barcode.localization.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;
import org.springframework.stereotype.Component;

/**
 * Scores a binarized scanline by its high-frequency energy: the sum of the magnitudes of every
 * Fourier coefficient except the DC term. Striped textures such as barcodes score high, flat
 * areas score close to zero.
 */
@Component
public class SpectralScorer {

    private final FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);

    // Twiddle tables for lengths the radix-2 transform cannot handle, keyed by length.
    private final Map<Integer, DftPlan> plans = new ConcurrentHashMap<>();

    /**
     * @return the raw score when it is strictly greater than {@code threshold}, otherwise exactly 0.0
     */
    public double score(double[] scanline, double threshold) {
        double raw = rawScore(scanline);
        return raw > threshold ? raw : 0.0;
    }

    public double rawScore(double[] scanline) {
        Complex[] spectrum = transform(scanline);
        double sum = 0.0;
        for (int k = 1; k < spectrum.length; k++) {
            sum += spectrum[k].abs();
        }
        return sum;
    }

    /** Unnormalized forward DFT of the real input, exactly {@code scanline.length} coefficients. */
    Complex[] transform(double[] scanline) {
        if (scanline.length == 0) {
            return new Complex[0];
        }
        if (ArithmeticUtils.isPowerOfTwo(scanline.length)) {
            return fft.transform(scanline, TransformType.FORWARD);
        }
        return plans.computeIfAbsent(scanline.length, DftPlan::new).apply(scanline);
    }

    private static final class DftPlan {

        private final int n;
        private final double[] cos;
        private final double[] sin;

        private DftPlan(int n) {
            this.n = n;
            this.cos = new double[n];
            this.sin = new double[n];
            for (int m = 0; m < n; m++) {
                double angle = 2.0 * Math.PI * m / n;
                cos[m] = Math.cos(angle);
                sin[m] = Math.sin(angle);
            }
        }

        private Complex[] apply(double[] x) {
            Complex[] out = new Complex[n];
            for (int k = 0; k < n; k++) {
                double re = 0.0, im = 0.0;
                for (int t = 0; t < n; t++) {
                    if (x[t] == 0.0) continue;
                    int m = (int) ((long) t * k % n);
                    re += x[t] * cos[m];
                    im -= x[t] * sin[m];
                }
                out[k] = new Complex(re, im);
            }
            return out;
        }
    }
}
