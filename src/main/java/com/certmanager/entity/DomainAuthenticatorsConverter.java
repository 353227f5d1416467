package com.certmanager.entity;

import com.fasterxml.jackson.core.type.TypeReference;

import javax.persistence.Converter;
import java.util.Map;

@Converter
public class DomainAuthenticatorsConverter extends JsonMapConverter<Long> {
    public DomainAuthenticatorsConverter() {
        super(new TypeReference<Map<String, Long>>() {
        });
    }
}
