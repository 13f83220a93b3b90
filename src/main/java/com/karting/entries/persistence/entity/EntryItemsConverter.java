package com.karting.entries.persistence.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.karting.entries.domain.EntryItem;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Stores {@code entry_items} as a JSON array of stable tags, e.g. {@code ["engine","tyres"]}.
 * Reads also accept rows written by older code: display labels instead of tags,
 * a JSON array encoded twice, or a bare comma-separated list.
 */
@Converter
public class EntryItemsConverter implements AttributeConverter<List<EntryItem>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(List<EntryItem> items) {
        List<String> tags = new ArrayList<>();
        if (items != null) {
            items.forEach(item -> tags.add(item.getTag()));
        }
        try {
            return MAPPER.writeValueAsString(tags);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize entry items " + tags, e);
        }
    }

    @Override
    public List<EntryItem> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(EntryItem.canonicalise(readValues(column.trim())));
    }

    private static List<String> readValues(String column) {
        try {
            JsonNode node = MAPPER.readTree(column);
            if (node.isTextual()) {
                return readValues(node.asText());
            }
            if (node.isArray()) {
                List<String> values = new ArrayList<>();
                for (JsonNode element : node) {
                    values.add(element.isObject() && element.has("name")
                            ? element.get("name").asText()
                            : element.asText());
                }
                return values;
            }
            return MAPPER.convertValue(node, new TypeReference<List<String>>() {});
        } catch (Exception notJson) {
            return Arrays.stream(column.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
    }
}
