package com.softpower.backend.events.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.Map;

@Converter
public class CountMapConverter extends JsonAttributeConverter<Map<String, Integer>> {
    public CountMapConverter() {
        super(new TypeReference<>() {
        });
    }
}
