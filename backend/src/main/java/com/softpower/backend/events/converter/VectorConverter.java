package com.softpower.backend.events.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.List;

@Converter
public class VectorConverter extends JsonAttributeConverter<List<Double>> {
    public VectorConverter() {
        super(new TypeReference<>() {
        });
    }
}
