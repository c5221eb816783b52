package com.example.ticker.service;

import com.example.ticker.domain.TimeTicker;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TickerFunctionRegistryTest {

    @Test
    void registersInjectedFunctionsByName() {
        TickerFunction report = named("report");
        TickerFunctionRegistry registry = new TickerFunctionRegistry(Optional.of(List.of(report, named("cleanup"))));
        registry.init();

        assertThat(registry.get("report")).isSameAs(report);
        assertThat(registry.get("missing")).isNull();
        assertThat(registry.get(null)).isNull();
        assertThat(registry.availableNames()).containsExactly("cleanup", "report");
    }

    @Test
    void firstRegistrationWinsOnDuplicateName() {
        TickerFunction first = named("report");
        TickerFunction second = named("report");
        TickerFunctionRegistry registry = new TickerFunctionRegistry(Optional.of(List.of(first, second)));
        registry.init();

        assertThat(registry.get("report")).isSameAs(first);
    }

    @Test
    void namesAreTrimmedOnRegistrationAndLookup() {
        TickerFunction padded = named("  report ");
        TickerFunctionRegistry registry = new TickerFunctionRegistry(Optional.of(List.of(padded)));
        registry.init();

        assertThat(registry.availableNames()).containsExactly("report");
        assertThat(registry.get("report")).isSameAs(padded);
        assertThat(registry.get(" report")).isSameAs(padded);
        assertThat(registry.get("  ")).isNull();
    }

    @Test
    void namesThatDoNotFitTheFunctionColumnAreRejected() {
        TickerFunctionRegistry registry = new TickerFunctionRegistry(Optional.empty());
        String tooLong = "f".repeat(TimeTicker.FUNCTION_NAME_LENGTH + 1);

        assertThrows(IllegalArgumentException.class, () -> registry.register(named(tooLong)));
        assertThat(registry.get(tooLong)).isNull();
    }

    @Test
    void blankNamesAreRejected() {
        TickerFunctionRegistry registry = new TickerFunctionRegistry(Optional.empty());
        registry.init();

        assertThrows(IllegalArgumentException.class, () -> registry.register(named(" ")));
        assertThrows(IllegalArgumentException.class, () -> registry.register(null));
        assertThat(registry.availableNames()).isEmpty();
    }

    private static TickerFunction named(String name) {
        return new TickerFunction() {
            @Override
            public void execute(TickerContext context, JsonNode request) {
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
