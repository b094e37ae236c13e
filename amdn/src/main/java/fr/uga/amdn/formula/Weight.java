package fr.uga.amdn.formula;

/**
 * Weight of a constraint: either a strictly positive soft score or the hard marker. The hard marker only becomes a
 * number when the constraints are encoded.
 */
public final class Weight {

    public static final Weight HARD = new Weight(Double.NaN, true);

    private final double value;
    private final boolean hard;

    private Weight(double value, boolean hard) {
        this.value = value;
        this.hard = hard;
    }

    public static Weight soft(double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("A soft weight must be finite and strictly positive, got " + value);
        }
        return new Weight(value, false);
    }

    public boolean isHard() {
        return this.hard;
    }

    public double getValue() {
        if (this.hard) {
            throw new IllegalStateException("A hard weight has no numeric value before encoding");
        }
        return this.value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Weight)) {
            return false;
        }
        Weight other = (Weight) o;
        return this.hard == other.hard && (this.hard || Double.compare(this.value, other.value) == 0);
    }

    @Override
    public int hashCode() {
        return this.hard ? 1 : Double.hashCode(this.value);
    }

    @Override
    public String toString() {
        return this.hard ? "HARD" : Double.toString(this.value);
    }
}
