package com.di.pgproof.apply;

import com.di.pgproof.util.InputValidator;

import java.util.OptionalLong;

/**
 * Apply namespaces are named {@code apply_<recommendation id>_<epoch seconds>}; the suffix is what
 * age-based cleanup reads back.
 */
final class ApplySchemaNames {

    static final String PREFIX = "apply_";
    static final String LIKE_PATTERN = "apply\\_%";

    private static final int EPOCH_DIGITS = 10;

    private ApplySchemaNames() {
    }

    static String forRecommendation(String recommendationId, long epochSeconds) {
        String id = recommendationId.trim().replace('-', '_').replaceAll("[^a-zA-Z0-9_]", "_");
        int room = InputValidator.MAX_IDENTIFIER_LENGTH - PREFIX.length() - 1 - EPOCH_DIGITS;
        if (id.length() > room) {
            id = id.substring(0, room);
        }
        return InputValidator.validateIdentifier(PREFIX + id + "_" + epochSeconds, "apply schema name");
    }

    /**
     * @return the embedded epoch seconds, or empty for names that do not follow the convention
     */
    static OptionalLong parseEpochSeconds(String schemaName) {
        if (schemaName == null || !schemaName.startsWith(PREFIX)) {
            return OptionalLong.empty();
        }
        int idx = schemaName.lastIndexOf('_');
        if (idx < PREFIX.length()) {
            return OptionalLong.empty();
        }
        String suffix = schemaName.substring(idx + 1);
        if (suffix.isEmpty() || !suffix.chars().allMatch(Character::isDigit)) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(suffix));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
