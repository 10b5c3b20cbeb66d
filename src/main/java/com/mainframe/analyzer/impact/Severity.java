package com.mainframe.analyzer.impact;

public enum Severity {
    CRITICAL(3.0),
    HIGH(2.0),
    MEDIUM(1.0),
    LOW(0.5);

    private final double testingWeight;

    Severity(double testingWeight) {
        this.testingWeight = testingWeight;
    }

    public double getTestingWeight() {
        return testingWeight;
    }

    public boolean isHighRisk() {
        return this == CRITICAL || this == HIGH;
    }
}
