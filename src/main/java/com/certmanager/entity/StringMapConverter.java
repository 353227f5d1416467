package com.certmanager.entity;

import com.fasterxml.jackson.core.type.TypeReference;

import javax.persistence.Converter;
import java.util.Map;

@Converter
public class StringMapConverter extends JsonMapConverter<String> {
    public StringMapConverter() {
        super(new TypeReference<Map<String, String>>() {
        });
    }
}
