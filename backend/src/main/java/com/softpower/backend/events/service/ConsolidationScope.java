package com.softpower.backend.events.service;

import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Either a single country or every country listed under {@code consolidation.countries}.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConsolidationScope {

    private final String country;

    public static ConsolidationScope country(String country) {
        return new ConsolidationScope(country == null ? "" : country.trim());
    }

    public static ConsolidationScope configured() {
        return new ConsolidationScope(null);
    }

    public boolean isConfigured() {
        return country == null;
    }

    public List<String> resolve(List<String> configuredCountries) {
        if (isConfigured()) {
            return configuredCountries == null ? List.of() : configuredCountries;
        }
        return List.of(country);
    }

    @Override
    public String toString() {
        return isConfigured() ? "configured countries" : country;
    }
}
