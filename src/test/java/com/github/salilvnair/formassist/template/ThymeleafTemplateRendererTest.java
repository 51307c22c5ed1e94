package com.github.salilvnair.formassist.template;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.github.salilvnair.formassist.support.TestConstants.USER_TEXT_NAME;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ThymeleafTemplateRendererTest {

    private final ThymeleafTemplateRenderer renderer = new ThymeleafTemplateRenderer();

    @Test
    void rendersDoubleBraceVariables() {
        String rendered = renderer.render("User: {{user_input}}", Map.of("user_input", USER_TEXT_NAME));

        assertEquals("User: " + USER_TEXT_NAME, rendered);
    }

    @Test
    void nativeInliningStillWorks() {
        String rendered = renderer.render("Field: [[${field_name}]]", Map.of("field_name", "email"));

        assertEquals("Field: email", rendered);
    }

    @Test
    void repeatedPlaceholdersResolveEverywhere() {
        String rendered = renderer.render("{{field_name}} / ({{field_name}})", Map.of("field_name", "age"));

        assertEquals("age / (age)", rendered);
    }

    @Test
    void preservesSpecialCharactersInResolvedValues() {
        String value = "amt$3500 {approved}\\path";
        String rendered = renderer.render("Value: {{user_input}}", Map.of("user_input", value));

        assertEquals("Value: " + value, rendered);
    }

    @Test
    void blankTemplateIsReturnedAsIs() {
        assertEquals("", renderer.render(null, Map.of()));
        assertEquals("  ", renderer.render("  ", null));
    }
}
