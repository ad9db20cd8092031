package com.flagship.inventory_ledger.common;

import com.flagship.inventory_ledger.config.InventoryProperties;
import com.flagship.inventory_ledger.exception.IdentifierExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.function.Predicate;

/**
 * Generates prefixed random identifiers and checks them against existing rows
 * before handing them out.
 *
 * The check is not atomic with the later insert; the primary key constraint
 * remains the final guard.
 */
@Component
@Slf4j
public class CodeGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private final SecureRandom random = new SecureRandom();
    private final int maxAttempts;

    public CodeGenerator(InventoryProperties properties) {
        this(properties.getCodeMaxAttempts());
    }

    CodeGenerator(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * Returns a fresh code for the given prefix.
     *
     * @param prefix identifier format
     * @param exists existence check against the owning table
     * @throws IdentifierExhaustedException if every attempt collided
     */
    public String generate(CodePrefix prefix, Predicate<String> exists) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = randomCode(prefix);
            if (!exists.test(candidate)) {
                return candidate;
            }
            log.debug("Identifier collision on attempt {}: {}", attempt, candidate);
        }
        throw new IdentifierExhaustedException(prefix.prefix(), maxAttempts);
    }

    String randomCode(CodePrefix prefix) {
        StringBuilder sb = new StringBuilder(prefix.prefix());
        for (int i = 0; i < prefix.length(); i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
