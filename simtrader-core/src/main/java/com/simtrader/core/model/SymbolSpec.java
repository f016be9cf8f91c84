package com.simtrader.core.model;

/**
 * Static trading properties of a symbol: price precision, volume limits and
 * contract sizing used for profit and margin.
 */
public record SymbolSpec(
    String name,
    int digits,
    double point,
    double volumeMin,
    double volumeStep,
    double volumeMax,
    double contractSize,
    double marginRate,
    int stopsLevel
) {
    private static final double EPSILON = 1e-9;

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Volume lies within [min, max] and on the step grid starting at min.
     */
    public boolean isValidVolume(double volume) {
        if (volume < volumeMin - EPSILON || volume > volumeMax + EPSILON) {
            return false;
        }
        double steps = (volume - volumeMin) / volumeStep;
        return Math.abs(steps - Math.rint(steps)) < 1e-6;
    }

    /**
     * Distance between two prices expressed in points.
     */
    public double points(double priceDistance) {
        return Math.abs(priceDistance) / point;
    }

    public double normalizePrice(double price) {
        double scale = Math.pow(10, digits);
        return Math.round(price * scale) / scale;
    }

    public static class Builder {
        private final String name;
        private int digits = 5;
        private double point = 0.00001;
        private double volumeMin = 0.01;
        private double volumeStep = 0.01;
        private double volumeMax = 100;
        private double contractSize = 100_000;
        private double marginRate = 1;
        private int stopsLevel;

        private Builder(String name) {
            this.name = name;
        }

        public Builder digits(int digits) { this.digits = digits; return this; }
        public Builder point(double point) { this.point = point; return this; }
        public Builder volumeMin(double volumeMin) { this.volumeMin = volumeMin; return this; }
        public Builder volumeStep(double volumeStep) { this.volumeStep = volumeStep; return this; }
        public Builder volumeMax(double volumeMax) { this.volumeMax = volumeMax; return this; }
        public Builder contractSize(double contractSize) { this.contractSize = contractSize; return this; }
        public Builder marginRate(double marginRate) { this.marginRate = marginRate; return this; }
        public Builder stopsLevel(int stopsLevel) { this.stopsLevel = stopsLevel; return this; }

        public SymbolSpec build() {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
            if (point <= 0) throw new IllegalArgumentException("point must be positive");
            if (volumeStep <= 0) throw new IllegalArgumentException("volumeStep must be positive");
            if (volumeMin <= 0 || volumeMax < volumeMin) {
                throw new IllegalArgumentException("volume range is invalid: " + volumeMin + ".." + volumeMax);
            }
            if (contractSize <= 0) throw new IllegalArgumentException("contractSize must be positive");
            return new SymbolSpec(name, digits, point, volumeMin, volumeStep, volumeMax,
                    contractSize, marginRate, stopsLevel);
        }
    }
}
