package com.cppbonsai.parser;

import java.util.ArrayList;
import java.util.List;

import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.parser.extract.Extractor;

import lombok.Value;

/**
 * Ordered, declarative mapping from (native kind, position) to an extraction strategy.
 *
 * The first matching rule wins, so specific rules must be added before generic ones. A pair that
 * no rule matches is undecided and treated as an unrecognized construct.
 */
public final class DispatchTable {

    public enum Outcome {
        MAP,
        DROP,
        UNDECIDED
    }

    @Value
    public static class Decision {
        public static final Decision UNDECIDED = new Decision(Outcome.UNDECIDED, null);

        Outcome outcome;
        /** Present only for {@link Outcome#MAP}. */
        Extractor extractor;
    }

    private final List<DispatchRule> rules;

    private DispatchTable(List<DispatchRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public Decision decide(CursorKind kind, Position position) {
        for (DispatchRule rule : rules) {
            if (rule.matches(kind, position)) {
                return rule.isDrop() ? new Decision(Outcome.DROP, null) : new Decision(Outcome.MAP, rule.getExtractor());
            }
        }
        return Decision.UNDECIDED;
    }

    public List<DispatchRule> getRules() {
        return rules;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<DispatchRule> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder rule(DispatchRule rule) {
            rules.add(rule);
            return this;
        }

        public Builder map(Extractor extractor, Position... positions) {
            return rule(DispatchRule.map(extractor, positions));
        }

        public Builder drop(CursorKind kind, Position... positions) {
            return rule(DispatchRule.drop(kind, positions));
        }

        public DispatchTable build() {
            return new DispatchTable(rules);
        }
    }
}
