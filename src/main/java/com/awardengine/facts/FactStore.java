package com.awardengine.facts;

import com.awardengine.contract.MetricId;
import com.awardengine.contract.MetricKind;
import com.awardengine.contract.MetricScope;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

/**
 * Key figures: one {@link MetricValue} per {@link MetricId}, all created up front.
 *
 * Mutation primitives are typed and validated: using an operation on a metric
 * of another kind throws, as does any write that would leave a count negative or a timer
 * negative or non-finite. Not thread-safe; the owner serializes access.
 */
public class FactStore implements FactReader {

    private final EnumMap<MetricId, MetricValue> values = new EnumMap<>(MetricId.class);

    public FactStore() {
        for (MetricId id : MetricId.values()) {
            values.put(id, new MetricValue());
        }
    }

    @Override
    public int count(MetricId id) {
        id.requireKind(MetricKind.COUNT);
        return values.get(id).getCount();
    }

    @Override
    public double timer(MetricId id) {
        id.requireKind(MetricKind.TIMER);
        return values.get(id).getTimer();
    }

    @Override
    public String label(MetricId id) {
        id.requireKind(MetricKind.LABEL);
        return values.get(id).getLabel();
    }

    public void setCountAbsolute(MetricId id, int value) {
        id.requireKind(MetricKind.COUNT);
        values.get(id).setCount(requireNonNegative(id, value));
    }

    public void addCountDelta(MetricId id, int delta) {
        id.requireKind(MetricKind.COUNT);
        MetricValue slot = values.get(id);
        int updated;
        try {
            updated = Math.addExact(slot.getCount(), delta);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("count overflow for " + id.getValue(), ex);
        }
        slot.setCount(requireNonNegative(id, updated));
    }

    public void keepMaximumCount(MetricId id, int candidate) {
        id.requireKind(MetricKind.COUNT);
        MetricValue slot = values.get(id);
        if (candidate > slot.getCount()) {
            slot.setCount(candidate);
        }
    }

    public void setTimerAbsolute(MetricId id, double seconds) {
        id.requireKind(MetricKind.TIMER);
        values.get(id).setTimer(requireNonNegative(id, seconds));
    }

    public void keepMaximumTimer(MetricId id, double candidate) {
        id.requireKind(MetricKind.TIMER);
        requireNonNegative(id, candidate);
        MetricValue slot = values.get(id);
        if (candidate > slot.getTimer()) {
            slot.setTimer(candidate);
        }
    }

    public void setLabel(MetricId id, String text) {
        id.requireKind(MetricKind.LABEL);
        values.get(id).setLabel(text);
    }

    public void wipe(MetricId id) {
        values.get(id).wipe();
    }

    /** Resets every INSTANCE metric. GLOBAL metrics belong to progress storage and are left alone. */
    public void wipeAllInstanceMetrics() {
        values.forEach((id, slot) -> {
            if (id.scope() == MetricScope.INSTANCE) {
                slot.wipe();
            }
        });
    }

    /** Every metric with its display value, in declaration order. */
    public List<KeyFigure> keyFigures() {
        List<KeyFigure> out = new ArrayList<>(values.size());
        values.forEach((id, slot) -> out.add(new KeyFigure(id, id.kind(), id.scope(), slot.display())));
        return out;
    }

    public FactSnapshot snapshot(boolean catalogLoaded) {
        List<FactSnapshot.Slot> slots = new ArrayList<>(values.size());
        values.forEach((id, slot) -> slots.add(
            new FactSnapshot.Slot(id, slot.getCount(), slot.getTimer(), slot.getLabel())));
        return new FactSnapshot(catalogLoaded, slots);
    }

    /**
     * Writes every slot of the snapshot back through the absolute setters.
     * Metrics absent from the snapshot are left untouched. Nothing is written
     * if any slot holds a negative count or a negative or non-finite timer.
     */
    public void restore(FactSnapshot snapshot) {
        for (FactSnapshot.Slot slot : snapshot.slots()) {
            requireNonNegative(slot.metric(), slot.count());
            requireNonNegative(slot.metric(), slot.timer());
        }
        for (FactSnapshot.Slot slot : snapshot.slots()) {
            switch (slot.metric().kind()) {
                case COUNT -> setCountAbsolute(slot.metric(), slot.count());
                case TIMER -> setTimerAbsolute(slot.metric(), slot.timer());
                case LABEL -> setLabel(slot.metric(), slot.label());
            }
        }
    }

    private static int requireNonNegative(MetricId id, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(
                "count for " + id.getValue() + " must not be negative, got " + value);
        }
        return value;
    }

    private static double requireNonNegative(MetricId id, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(
                "timer for " + id.getValue() + " must be finite and not negative, got " + value);
        }
        return value;
    }
}
