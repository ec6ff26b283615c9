package com.awardengine.rules;

import com.awardengine.contract.MetricId;
import com.awardengine.contract.MetricKind;
import com.awardengine.facts.FactReader;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Predicate over the key figures, expressed as data so a catalog can be
 * validated, described and tested without running arbitrary code.
 *
 * Conditions must be pure and cheap: they are re-evaluated for every pending
 * award on every heartbeat and must never write to the fact store.
 */
public sealed interface AwardCondition {

    boolean test(FactReader facts);

    /** Metrics read by this condition, paired with the kind the condition expects. */
    Set<MetricRef> references();

    /** Readable expression, e.g. {@code WipeoutsCount >= 8}. */
    String describe();

    record MetricRef(MetricId metric, MetricKind expectedKind) {}

    static AwardCondition countAtLeast(MetricId metric, int threshold) {
        return new CountAtLeast(metric, threshold);
    }

    static AwardCondition countAbove(MetricId metric, int threshold) {
        return new CountAbove(metric, threshold);
    }

    static AwardCondition countEquals(MetricId metric, int value) {
        return new CountEquals(metric, value);
    }

    static AwardCondition timerBelow(MetricId metric, double seconds) {
        return new TimerBelow(metric, seconds);
    }

    static AwardCondition labelEquals(MetricId metric, String text) {
        return new LabelEquals(metric, text);
    }

    static AwardCondition allOf(AwardCondition... conditions) {
        return new AllOf(List.of(conditions));
    }

    static AwardCondition anyOf(AwardCondition... conditions) {
        return new AnyOf(List.of(conditions));
    }

    record CountAtLeast(MetricId metric, int threshold) implements AwardCondition {
        public CountAtLeast {
            Objects.requireNonNull(metric, "metric is required");
        }

        @Override
        public boolean test(FactReader facts) {
            return facts.count(metric) >= threshold;
        }

        @Override
        public Set<MetricRef> references() {
            return Set.of(new MetricRef(metric, MetricKind.COUNT));
        }

        @Override
        public String describe() {
            return metric.getValue() + " >= " + threshold;
        }
    }

    record CountAbove(MetricId metric, int threshold) implements AwardCondition {
        public CountAbove {
            Objects.requireNonNull(metric, "metric is required");
        }

        @Override
        public boolean test(FactReader facts) {
            return facts.count(metric) > threshold;
        }

        @Override
        public Set<MetricRef> references() {
            return Set.of(new MetricRef(metric, MetricKind.COUNT));
        }

        @Override
        public String describe() {
            return metric.getValue() + " > " + threshold;
        }
    }

    record CountEquals(MetricId metric, int value) implements AwardCondition {
        public CountEquals {
            Objects.requireNonNull(metric, "metric is required");
        }

        @Override
        public boolean test(FactReader facts) {
            return facts.count(metric) == value;
        }

        @Override
        public Set<MetricRef> references() {
            return Set.of(new MetricRef(metric, MetricKind.COUNT));
        }

        @Override
        public String describe() {
            return metric.getValue() + " == " + value;
        }
    }

    /** Strictly below: a timer equal to the limit does not qualify. */
    record TimerBelow(MetricId metric, double seconds) implements AwardCondition {
        public TimerBelow {
            Objects.requireNonNull(metric, "metric is required");
        }

        @Override
        public boolean test(FactReader facts) {
            return facts.timer(metric) < seconds;
        }

        @Override
        public Set<MetricRef> references() {
            return Set.of(new MetricRef(metric, MetricKind.TIMER));
        }

        @Override
        public String describe() {
            return metric.getValue() + " < " + String.format(Locale.ROOT, "%.2f", seconds);
        }
    }

    /** An unset label never matches. */
    record LabelEquals(MetricId metric, String text) implements AwardCondition {
        public LabelEquals {
            Objects.requireNonNull(metric, "metric is required");
            Objects.requireNonNull(text, "text is required");
        }

        @Override
        public boolean test(FactReader facts) {
            return text.equals(facts.label(metric));
        }

        @Override
        public Set<MetricRef> references() {
            return Set.of(new MetricRef(metric, MetricKind.LABEL));
        }

        @Override
        public String describe() {
            return metric.getValue() + " == '" + text + "'";
        }
    }

    record AllOf(List<AwardCondition> conditions) implements AwardCondition {
        public AllOf {
            conditions = List.copyOf(conditions);
            if (conditions.isEmpty()) {
                throw new IllegalArgumentException("allOf needs at least one condition");
            }
        }

        @Override
        public boolean test(FactReader facts) {
            for (AwardCondition condition : conditions) {
                if (!condition.test(facts)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Set<MetricRef> references() {
            return conditions.stream()
                .flatMap(c -> c.references().stream())
                .collect(Collectors.toUnmodifiableSet());
        }

        @Override
        public String describe() {
            return conditions.stream()
                .map(AwardCondition::describe)
                .collect(Collectors.joining(" AND ", "(", ")"));
        }
    }

    record AnyOf(List<AwardCondition> conditions) implements AwardCondition {
        public AnyOf {
            conditions = List.copyOf(conditions);
            if (conditions.isEmpty()) {
                throw new IllegalArgumentException("anyOf needs at least one condition");
            }
        }

        @Override
        public boolean test(FactReader facts) {
            for (AwardCondition condition : conditions) {
                if (condition.test(facts)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Set<MetricRef> references() {
            return conditions.stream()
                .flatMap(c -> c.references().stream())
                .collect(Collectors.toUnmodifiableSet());
        }

        @Override
        public String describe() {
            return conditions.stream()
                .map(AwardCondition::describe)
                .collect(Collectors.joining(" OR ", "(", ")"));
        }
    }
}
