package com.scratchodds.infrastructure.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered list of extraction strategies for one field. Strategies are tried in order and
 * the first non-empty result wins; later strategies are not evaluated.
 *
 * @param <T> field type
 */
public final class FieldChain<T> {

    private static final Logger logger = LoggerFactory.getLogger(FieldChain.class);

    private final String fieldName;
    private final List<Step<T>> steps;

    private FieldChain(String fieldName, List<Step<T>> steps) {
        this.fieldName = fieldName;
        this.steps = List.copyOf(steps);
    }

    public static <T> FieldChain<T> named(String fieldName) {
        return new FieldChain<>(fieldName, List.of());
    }

    /**
     * Returns a new chain with the strategy appended.
     */
    public FieldChain<T> then(String stepName, Function<PageText, Optional<T>> strategy) {
        List<Step<T>> next = new ArrayList<>(steps);
        next.add(new Step<>(stepName, strategy));
        return new FieldChain<>(fieldName, next);
    }

    public Optional<T> resolve(PageText page) {
        for (Step<T> step : steps) {
            Optional<T> value = step.strategy().apply(page);
            if (value.isPresent()) {
                logger.debug("{} resolved by {} step: {}", fieldName, step.name(), value.get());
                return value;
            }
        }
        logger.debug("{} not found on page", fieldName);
        return Optional.empty();
    }

    public T resolveOrDefault(PageText page, T defaultValue) {
        return resolve(page).orElse(defaultValue);
    }

    public String getFieldName() {
        return fieldName;
    }

    public List<String> getStepNames() {
        return steps.stream().map(Step::name).toList();
    }

    private record Step<T>(String name, Function<PageText, Optional<T>> strategy) {}
}
