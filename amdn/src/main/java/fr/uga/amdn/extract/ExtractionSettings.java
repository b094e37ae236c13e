package fr.uga.amdn.extract;

/**
 * Parameters of an extraction run.
 */
public final class ExtractionSettings {

    public static final int DEFAULT_OCCURRENCE_THRESHOLD = 1;
    public static final int DEFAULT_TIMEOUT_SEC = 300;
    public static final double DEFAULT_WEIGHT_SCALE = 1000.0;

    private final int occurrenceThreshold;
    private final int timeoutSec;
    private final double weightScale;
    private final boolean parallelBuild;

    public ExtractionSettings(int occurrenceThreshold, int timeoutSec, double weightScale, boolean parallelBuild) {
        if (occurrenceThreshold < 0) {
            throw new IllegalArgumentException("The occurrence threshold cannot be negative: " + occurrenceThreshold);
        }
        if (timeoutSec <= 0) {
            throw new IllegalArgumentException("The solver timeout must be positive: " + timeoutSec);
        }
        if (!(weightScale > 0.0) || Double.isInfinite(weightScale)) {
            throw new IllegalArgumentException("The weight scale must be strictly positive: " + weightScale);
        }
        this.occurrenceThreshold = occurrenceThreshold;
        this.timeoutSec = timeoutSec;
        this.weightScale = weightScale;
        this.parallelBuild = parallelBuild;
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(DEFAULT_OCCURRENCE_THRESHOLD, DEFAULT_TIMEOUT_SEC, DEFAULT_WEIGHT_SCALE, true);
    }

    public ExtractionSettings withOccurrenceThreshold(int threshold) {
        return new ExtractionSettings(threshold, this.timeoutSec, this.weightScale, this.parallelBuild);
    }

    public ExtractionSettings withTimeoutSec(int timeout) {
        return new ExtractionSettings(this.occurrenceThreshold, timeout, this.weightScale, this.parallelBuild);
    }

    public ExtractionSettings withWeightScale(double scale) {
        return new ExtractionSettings(this.occurrenceThreshold, this.timeoutSec, scale, this.parallelBuild);
    }

    public ExtractionSettings withParallelBuild(boolean parallel) {
        return new ExtractionSettings(this.occurrenceThreshold, this.timeoutSec, this.weightScale, parallel);
    }

    public int getOccurrenceThreshold() {
        return this.occurrenceThreshold;
    }

    public int getTimeoutSec() {
        return this.timeoutSec;
    }

    public double getWeightScale() {
        return this.weightScale;
    }

    public boolean isParallelBuild() {
        return this.parallelBuild;
    }

    @Override
    public String toString() {
        return "threshold=" + this.occurrenceThreshold + ", timeout=" + this.timeoutSec + "s, scale="
            + this.weightScale + ", parallel=" + this.parallelBuild;
    }
}
