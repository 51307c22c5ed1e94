package com.github.salilvnair.formassist.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable set of form fields. Field order is also the elicitation order.
 */
public final class FormSchema {

    private final List<FormFieldSpec> fields;
    private final Map<String, Integer> indexByName;

    public FormSchema(List<FormFieldSpec> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Form schema needs at least one field");
        }
        Map<String, Integer> index = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        int previousOrder = Integer.MIN_VALUE;
        for (int i = 0; i < fields.size(); i++) {
            FormFieldSpec field = fields.get(i);
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException("Duplicate form field name: " + field.name());
            }
            if (field.order() <= previousOrder) {
                throw new IllegalArgumentException("Field order must be strictly increasing, violated at: " + field.name());
            }
            previousOrder = field.order();
            index.put(field.name(), i);
        }
        this.fields = List.copyOf(fields);
        this.indexByName = Collections.unmodifiableMap(index);
    }

    public List<FormFieldSpec> fields() {
        return fields;
    }

    public FormFieldSpec fieldAt(int index) {
        return fields.get(index);
    }

    public FormFieldSpec firstField() {
        return fields.get(0);
    }

    public Optional<FormFieldSpec> field(String name) {
        Integer index = name == null ? null : indexByName.get(name);
        return index == null ? Optional.empty() : Optional.of(fields.get(index));
    }

    public Optional<String> nextField(String name) {
        Integer index = name == null ? null : indexByName.get(name);
        if (index == null || index + 1 >= fields.size()) {
            return Optional.empty();
        }
        return Optional.of(fields.get(index + 1).name());
    }

    public boolean isRequired(String name) {
        return field(name).map(FormFieldSpec::required).orElse(false);
    }

    public boolean contains(String name) {
        return name != null && indexByName.containsKey(name);
    }

    public List<String> requiredFieldNames() {
        List<String> required = new ArrayList<>();
        for (FormFieldSpec field : fields) {
            if (field.required()) {
                required.add(field.name());
            }
        }
        return required;
    }
}
