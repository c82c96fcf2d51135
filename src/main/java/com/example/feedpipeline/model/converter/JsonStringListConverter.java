package com.example.feedpipeline.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class JsonStringListConverter extends AbstractJsonConverter<List<String>> {

    public JsonStringListConverter() {
        super(new TypeReference<>() {
        });
    }

    @Override
    protected List<String> empty() {
        return new ArrayList<>();
    }
}
