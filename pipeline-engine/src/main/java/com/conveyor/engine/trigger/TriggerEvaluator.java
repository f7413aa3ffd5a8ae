package com.conveyor.engine.trigger;

import com.conveyor.engine.model.Event;
import com.conveyor.engine.model.TriggerCondition;
import com.conveyor.engine.model.TriggerPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Decides whether a trigger predicate accepts an event.
 *
 * Evaluation is pure: the decision depends only on the (predicate, event)
 * pair. The glob cache only saves recompiling patterns and never changes
 * a result.
 *
 * A malformed pattern or event never throws out of this class. It yields
 * an ineligible decision carrying the problem as its diagnostic, and a
 * WARN line in the log.
 */
@Component
public class TriggerEvaluator {

    private static final Logger log = LoggerFactory.getLogger(TriggerEvaluator.class);

    /** Patterns come from submitted templates, so the cache stops growing at this size. */
    static final int MAX_CACHED_GLOBS = 1024;

    private final Map<String, Pattern> globs = new ConcurrentHashMap<>();

    public TriggerDecision evaluate(TriggerPredicate predicate, Event event) {
        try {
            if (event == null || event.type() == null) {
                throw new EvaluationException("Event has no type");
            }
            if (predicate == null || predicate.isEmpty()) {
                return TriggerDecision.allow();
            }
            for (TriggerCondition condition : predicate.conditions()) {
                if (matches(condition, event)) {
                    return TriggerDecision.allow();
                }
            }
            return TriggerDecision.noMatch("No trigger condition matches " + describe(event));
        } catch (EvaluationException e) {
            log.warn("Trigger evaluation failed, treating as not eligible: {}", e.getMessage());
            return TriggerDecision.malformed(e.getMessage());
        }
    }

    public boolean isEligible(TriggerPredicate predicate, Event event) {
        return evaluate(predicate, event).eligible();
    }

    // ------------------------------------------------------------------
    // Matching
    // ------------------------------------------------------------------

    private boolean matches(TriggerCondition condition, Event event) {
        if (condition == null) {
            throw new EvaluationException("Trigger predicate contains an empty condition");
        }
        if (!condition.events().isEmpty() && !condition.events().contains(event.type())) {
            return false;
        }
        if (!condition.status().isEmpty() && !condition.status().contains(event.effectiveStatus())) {
            return false;
        }
        // Check every pattern list even after a miss so malformed globs always surface.
        boolean refMatches    = anyMatch(condition.refs(), event.ref());
        boolean branchMatches = anyMatch(condition.branches(), event.branch());
        return refMatches && branchMatches;
    }

    private boolean anyMatch(List<String> patterns, String value) {
        if (patterns.isEmpty()) return true;
        boolean matched = false;
        for (String pattern : patterns) {
            Pattern compiled = glob(pattern);
            if (value != null && compiled.matcher(value).matches()) {
                matched = true;
            }
        }
        return matched;
    }

    private Pattern glob(String pattern) {
        Pattern cached = globs.get(pattern == null ? "" : pattern);
        if (cached != null) return cached;
        Pattern compiled = GlobPattern.compile(pattern);
        if (globs.size() < MAX_CACHED_GLOBS) {
            globs.putIfAbsent(pattern, compiled);
        }
        return compiled;
    }

    int cachedGlobs() {
        return globs.size();
    }

    private static String describe(Event event) {
        StringBuilder sb = new StringBuilder(event.type().value());
        if (event.ref() != null)    sb.append(" ref=").append(event.ref());
        if (event.branch() != null) sb.append(" branch=").append(event.branch());
        sb.append(" status=").append(event.effectiveStatus().value());
        return sb.toString();
    }
}
