package com.awardengine.facts;

import java.util.Locale;

/**
 * Current value of one key figure. Only the field matching the metric's kind
 * is ever written; the others stay at their zero/empty defaults.
 */
public final class MetricValue {

    private int count;
    private double timer;
    private String label;

    MetricValue() {
        wipe();
    }

    public int getCount() {
        return count;
    }

    public double getTimer() {
        return timer;
    }

    public String getLabel() {
        return label;
    }

    void setCount(int count) {
        this.count = count;
    }

    void setTimer(double timer) {
        this.timer = timer;
    }

    void setLabel(String label) {
        this.label = label;
    }

    void wipe() {
        count = 0;
        timer = 0.0;
        label = null;
    }

    /**
     * Human-readable rendering of whichever field is populated.
     */
    public String display() {
        if (label != null && !label.isEmpty()) {
            return label;
        }
        if (timer > 0) {
            return String.format(Locale.ROOT, "%.2f", timer);
        }
        if (count > 0) {
            return Integer.toString(count);
        }
        return "(no value)";
    }

    @Override
    public String toString() {
        return display();
    }
}
