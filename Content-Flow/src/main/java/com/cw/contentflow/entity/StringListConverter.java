package com.cw.contentflow.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * List&lt;String&gt; ↔ 줄바꿈 구분 문자열
 */
@Converter
public class StringListConverter implements AttributeConverter<List<String>, String> {

    @Override
    public String convertToDatabaseColumn(List<String> values) {
        if (values == null || values.isEmpty()) return "";
        return String.join("\n", values);
    }

    @Override
    public List<String> convertToEntityAttribute(String joined) {
        if (joined == null || joined.isBlank()) return new ArrayList<>();
        return new ArrayList<>(Arrays.stream(joined.split("\n"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList());
    }
}
