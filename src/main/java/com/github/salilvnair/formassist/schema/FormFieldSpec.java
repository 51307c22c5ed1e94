package com.github.salilvnair.formassist.schema;

public record FormFieldSpec(
        String name,
        FieldType type,
        String description,
        int order,
        boolean required,
        FieldConstraints constraints
) {

    public FormFieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Field type cannot be null for field: " + name);
        }
        constraints = constraints == null ? FieldConstraints.none() : constraints;
    }

    public String label() {
        return name.replace('_', ' ');
    }

    public String rulesSummary() {
        String rules = constraints.summary();
        if (type == FieldType.DATE) {
            rules = "none".equals(rules) ? "date in YYYY-MM-DD format" : rules + "; date in YYYY-MM-DD format";
        }
        return (required ? "required" : "optional") + "; " + rules;
    }
}
