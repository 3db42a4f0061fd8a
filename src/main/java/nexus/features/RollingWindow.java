package nexus.features;

import nexus.data.Observation;

import java.util.List;

/**
 * Trailing simple means. The window at index d covers [d - w + 1, d], clipped at the start of the
 * sequence, so early positions average over fewer values instead of being undefined.
 * Unset values (NaN) are skipped; a window with no set value yields NaN.
 */
public final class RollingWindow {

    private RollingWindow() {
    }

    public static double trailingMean(double[] values, int index, int window) {
        checkWindow(window);
        int start = Math.max(0, index - window + 1);
        double sum = 0;
        int count = 0;
        for (int i = start; i <= index; i++) {
            if (!Double.isNaN(values[i])) {
                sum += values[i];
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    public static double[] trailingMeans(double[] values, int window) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = trailingMean(values, i, window);
        return out;
    }

    /** Mean of {@code column} over the last {@code window} observations of the sequence. */
    public static double trailingMean(List<Observation> sequence, String column, int window) {
        checkWindow(window);
        int end = sequence.size() - 1;
        int start = Math.max(0, end - window + 1);
        double sum = 0;
        int count = 0;
        for (int i = start; i <= end; i++) {
            double v = sequence.get(i).get(column);
            if (!Double.isNaN(v)) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    private static void checkWindow(int window) {
        if (window < 1) throw new IllegalArgumentException("window must be >= 1, got " + window);
    }
}
