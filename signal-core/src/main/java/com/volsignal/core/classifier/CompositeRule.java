package com.volsignal.core.classifier;

import com.volsignal.core.model.CompositeSignal;
import com.volsignal.core.model.GroupFiring;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of a priority cascade: when {@code condition} holds, the verdict is
 * {@code outcome} applied to the same facts.
 */
public record CompositeRule(
    String id,
    Predicate<Facts> condition,
    Function<Facts, CompositeSignal> outcome
) {
    public static CompositeRule of(String id, Predicate<Facts> condition, CompositeSignal outcome) {
        return new CompositeRule(id, condition, f -> outcome);
    }

    public boolean matches(Facts facts) {
        return condition.test(facts);
    }

    public CompositeSignal apply(Facts facts) {
        return outcome.apply(facts);
    }

    /**
     * Everything a rule may look at.
     *
     * @param groups        per-group ACTION counts and groups firing
     * @param vixDiscount   vixpiration window active outside the OpEx window
     * @param opexAmplifier inside the OpEx window
     */
    public record Facts(GroupFiring groups, boolean vixDiscount, boolean opexAmplifier) {}
}
