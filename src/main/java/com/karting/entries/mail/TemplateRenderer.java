package com.karting.entries.mail;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal placeholder substitution over classpath HTML templates.
 * <p>
 * {@code {{name}}} is replaced by the HTML-escaped model value (empty when absent).
 * {@code {{#name}}...{{/name}}} is kept only when the model value is present and not
 * {@code false}/blank.
 */
@Slf4j
@Component
public class TemplateRenderer {

    private static final Pattern SECTION = Pattern.compile("\\{\\{#(\\w+)}}(.*?)\\{\\{/\\1}}", Pattern.DOTALL);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public String render(MailTemplate template, Map<String, ?> model) {
        String source = cache.computeIfAbsent(template.getResourcePath(), TemplateRenderer::load);
        return substitute(source, model);
    }

    public String renderSubject(MailTemplate template, Map<String, ?> model) {
        return substitute(template.getSubjectPattern(), model);
    }

    static String substitute(String source, Map<String, ?> model) {
        Matcher sections = SECTION.matcher(source);
        StringBuilder withSections = new StringBuilder();
        while (sections.find()) {
            String body = isPresent(model.get(sections.group(1))) ? sections.group(2) : "";
            sections.appendReplacement(withSections, Matcher.quoteReplacement(body));
        }
        sections.appendTail(withSections);

        Matcher placeholders = PLACEHOLDER.matcher(withSections);
        StringBuilder out = new StringBuilder();
        while (placeholders.find()) {
            Object value = model.get(placeholders.group(1));
            String text = value == null ? "" : HtmlUtils.htmlEscape(value.toString());
            placeholders.appendReplacement(out, Matcher.quoteReplacement(text));
        }
        placeholders.appendTail(out);
        return out.toString();
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return !value.toString().isBlank();
    }

    private static String load(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        try (InputStream in = resource.getInputStream()) {
            String html = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            log.debug("Loaded mail template path={} length={}", path, html.length());
            return html;
        } catch (IOException e) {
            throw new UncheckedIOException("Mail template not found: " + path, e);
        }
    }
}
