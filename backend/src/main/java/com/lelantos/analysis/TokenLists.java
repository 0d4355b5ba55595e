package com.lelantos.analysis;

import java.util.List;
import java.util.Objects;

final class TokenLists {

    private TokenLists() {
    }

    /** Trimmed, non-blank, first occurrence of each address, input order kept. */
    static List<String> clean(List<String> tokens) {
        if (tokens == null) {
            return List.of();
        }
        return tokens.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(t -> !t.isEmpty())
                .distinct()
                .toList();
    }
}
