package com.github.salilvnair.formassist.template;

import org.springframework.stereotype.Component;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders plain-text prompt templates. Prompt resources use {@code {{var}}} placeholders, which are
 * rewritten to native {@code [[${var}]]} inlining before processing.
 */
@Component
public class ThymeleafTemplateRenderer {

    private static final Pattern DOUBLE_BRACE_PATTERN = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");

    private final SpringTemplateEngine templateEngine;

    public ThymeleafTemplateRenderer() {
        StringTemplateResolver resolver = new StringTemplateResolver();
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCacheable(false);

        SpringTemplateEngine engine = new SpringTemplateEngine();
        engine.setTemplateResolver(resolver);
        engine.setEnableSpringELCompiler(true);
        this.templateEngine = engine;
    }

    public String render(String template, Map<String, Object> variables) {
        String raw = template == null ? "" : template;
        if (raw.isBlank()) {
            return raw;
        }
        Context context = new Context();
        if (variables != null) {
            context.setVariables(variables);
        }
        String rendered = templateEngine.process(normalizeTemplate(raw), context);
        return rendered == null ? "" : rendered;
    }

    String normalizeTemplate(String template) {
        Matcher matcher = DOUBLE_BRACE_PATTERN.matcher(template);
        StringBuffer out = new StringBuffer();
        while (matcher.find()) {
            String inline = "[[${" + matcher.group(1).trim() + "}]]";
            matcher.appendReplacement(out, Matcher.quoteReplacement(inline));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
