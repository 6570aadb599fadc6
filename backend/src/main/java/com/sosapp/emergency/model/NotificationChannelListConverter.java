package com.sosapp.emergency.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Converter
public class NotificationChannelListConverter implements AttributeConverter<List<NotificationChannel>, String> {

    @Override
    public String convertToDatabaseColumn(List<NotificationChannel> channels) {
        if (channels == null || channels.isEmpty()) {
            return "";
        }
        return channels.stream().map(Enum::name).collect(Collectors.joining(","));
    }

    @Override
    public List<NotificationChannel> convertToEntityAttribute(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ArrayList<>();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(NotificationChannel::valueOf)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
