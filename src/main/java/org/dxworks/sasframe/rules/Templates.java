package org.dxworks.sasframe.rules;

import org.dxworks.sasframe.construct.Construct;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {name}} placeholders from a construct: its attributes plus {@code kind}, {@code id},
 * {@code line} and {@code text}. Unknown placeholders are left in place.
 */
public final class Templates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z][A-Za-z0-9_]*)}");

    private Templates() {
        // utility class
    }

    public static String render(String template, Construct construct) {
        if (template == null || template.indexOf('{') < 0) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            Object value = valueOf(matcher.group(1), construct);
            String replacement = value == null ? matcher.group() : format(value);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /** The placeholder name when the template is exactly one placeholder, otherwise null. */
    public static String solePlaceholder(String template) {
        if (template == null) {
            return null;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        return matcher.matches() ? matcher.group(1) : null;
    }

    public static Object valueOf(String name, Construct construct) {
        return switch (name) {
            case "kind" -> construct.kind.name();
            case "id" -> construct.id;
            case "line" -> construct.span.line;
            case "text" -> construct.text;
            default -> construct.attribute(name);
        };
    }

    private static String format(Object value) {
        if (value instanceof List) {
            return String.join(", ", ((List<?>) value).stream().map(String::valueOf).toArray(String[]::new));
        }
        return String.valueOf(value);
    }
}
