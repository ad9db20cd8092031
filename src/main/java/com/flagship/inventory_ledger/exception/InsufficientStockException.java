package com.flagship.inventory_ledger.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when an outgoing movement would drive an item below zero.
 * Carries every short item so callers can report them all at once.
 */
public class InsufficientStockException extends RuntimeException {

    private final List<Shortfall> shortfalls;

    public InsufficientStockException(List<Shortfall> shortfalls) {
        super(buildMessage(shortfalls));
        this.shortfalls = List.copyOf(shortfalls);
    }

    public static InsufficientStockException single(String itemId, String itemName, int required, int available) {
        return new InsufficientStockException(List.of(Shortfall.of(itemId, itemName, required, available)));
    }

    public List<Shortfall> getShortfalls() {
        return shortfalls;
    }

    private static String buildMessage(List<Shortfall> shortfalls) {
        return "Insufficient stock: " + shortfalls.stream()
                .map(s -> String.format("%s (%s) required=%d available=%d short=%d",
                        s.getItemName(), s.getItemId(), s.getRequired(), s.getAvailable(), s.getShortfall()))
                .collect(Collectors.joining("; "));
    }
}
