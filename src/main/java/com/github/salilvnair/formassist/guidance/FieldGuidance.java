package com.github.salilvnair.formassist.guidance;

import java.util.List;

/**
 * Canned wording for one field: what a valid answer looks like, sample answers, the help reply and the
 * question used to ask for it.
 */
public record FieldGuidance(
        String explanation,
        List<String> examples,
        String help,
        String prompt
) {

    public FieldGuidance {
        examples = examples == null ? List.of() : List.copyOf(examples);
    }
}
