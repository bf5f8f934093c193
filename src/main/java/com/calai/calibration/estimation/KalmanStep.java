package com.calai.calibration.estimation;

/**
 * Pure random-walk Kalman step. The series filter is a fold of this over the ordered days.
 */
public final class KalmanStep {

    private final KalmanConfig config;

    public KalmanStep(KalmanConfig config) {
        this.config = config;
    }

    /**
     * @param prev state after the last processed day, null before the first measurement
     * @param z    measurement for this day, null or NaN when missing
     * @param gap  days elapsed since the last processed day
     * @return next state, or null while no measurement has been seen yet
     */
    public KalmanState step(KalmanState prev, Double z, int gap) {
        boolean hasZ = z != null && !Double.isNaN(z);

        if (prev == null) {
            // 第一筆量測：x̂₀ = z、P₀ = R
            return hasZ ? new KalmanState(z, config.measurementVariance(), 0.0, true) : null;
        }
        if (gap < 0) throw new IllegalArgumentException("KALMAN_GAP_NEGATIVE");

        double xPred = prev.estimate();
        double pPred = prev.variance() + gap * config.processVariance();

        if (!hasZ) {
            return new KalmanState(xPred, pPred, 0.0, false);
        }

        double k = pPred / (pPred + config.measurementVariance());
        double x = xPred + k * (z - xPred);
        double p = (1.0 - k) * pPred;
        return new KalmanState(x, p, k, true);
    }
}
