package com.bizflow.process.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

@AllArgsConstructor
@Getter
public enum BizFlowFieldType {
    STRING("string"),
    INT("int"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    ENUM("enum");

    private final String keyword;

    public static Optional<BizFlowFieldType> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.keyword.equals(normalized))
                .findFirst();
    }
}
