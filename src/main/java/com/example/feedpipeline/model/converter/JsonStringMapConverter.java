package com.example.feedpipeline.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class JsonStringMapConverter extends AbstractJsonConverter<Map<String, String>> {

    public JsonStringMapConverter() {
        super(new TypeReference<>() {
        });
    }

    @Override
    protected Map<String, String> empty() {
        return new LinkedHashMap<>();
    }
}
