package com.purchasingpower.calcforge.formula;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * TypeScript rendering of one formula.
 *
 * <p>An unsupported translation has no expression; the calling code must emit a
 * runtime-error stub. A supported translation may still carry problems for parts
 * that were replaced by runtime-error calls (opaque or sheet-less ranges).
 */
@Value
@Builder
public class TranslationResult {

    boolean supported;

    String expression;

    @Builder.Default
    List<String> problems = List.of();

    public static TranslationResult supported(String expression, List<String> problems) {
        return TranslationResult.builder()
                .supported(true)
                .expression(expression)
                .problems(List.copyOf(problems))
                .build();
    }

    public static TranslationResult unsupported(String reason) {
        return TranslationResult.builder()
                .supported(false)
                .problems(List.of(reason))
                .build();
    }

    /**
     * Supported and free of runtime-error stubs.
     */
    public boolean isClean() {
        return supported && problems.isEmpty();
    }
}
