package com.uno.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores an ordered card list as comma-separated card labels.
 */
@Converter
public class CardListConverter implements AttributeConverter<List<Card>, String> {

    private static final String SEPARATOR = ",";

    @Override
    public String convertToDatabaseColumn(List<Card> cards) {
        if (cards == null || cards.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Card card : cards) {
            if (sb.length() > 0) {
                sb.append(SEPARATOR);
            }
            sb.append(card.label());
        }
        return sb.toString();
    }

    @Override
    public List<Card> convertToEntityAttribute(String column) {
        List<Card> cards = new ArrayList<>();
        if (column == null || column.isBlank()) {
            return cards;
        }
        for (String label : column.split(SEPARATOR)) {
            cards.add(Card.parse(label));
        }
        return cards;
    }
}
