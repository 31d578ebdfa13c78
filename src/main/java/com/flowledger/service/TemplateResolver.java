package com.flowledger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowledger.model.ExecutionContext;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {{token}} references in step inputs with values from the
 * execution context.
 *
 * Tokens:
 *   {{trigger.type}}            → "manual" / "schedule_tick" / "runtime_record_created"
 *   {{trigger.entity}}          → trigger entity logical name ("" when none)
 *   {{run.id}}, {{run.attempt}} → run identifier, 1-based attempt number
 *   {{now.iso}}                 → attempt clock as ISO-8601
 *   {{trigger.payload.a.b}}, {{trigger.a.b}}, {{payload.a.b}} → payload value at a.b
 *
 * A string that is exactly one token becomes the token's JSON value (so a
 * number stays a number). Tokens inside longer strings are replaced by their
 * text. A token that does not resolve is left as written. Resolution never throws.
 */
@Component
public class TemplateResolver {

    private static final Pattern TOKEN_PATTERN = Pattern.compile("\\{\\{([^}]*)\\}\\}");
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Returns a resolved deep copy of {@code value}; the input is not modified.
     */
    public JsonNode resolve(JsonNode value, ExecutionContext context) {
        if (value == null) {
            return null;
        }
        if (value.isTextual()) {
            return resolveTextNode(value.asText(), context);
        }
        if (value.isArray()) {
            ArrayNode resolved = NODES.arrayNode(value.size());
            for (JsonNode item : value) {
                resolved.add(resolve(item, context));
            }
            return resolved;
        }
        if (value.isObject()) {
            ObjectNode resolved = NODES.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                resolved.set(field.getKey(), resolve(field.getValue(), context));
            }
            return resolved;
        }
        return value.deepCopy();
    }

    /**
     * Resolves tokens embedded in a plain string, always producing text.
     */
    public String resolveText(String template, ExecutionContext context) {
        if (template == null || !template.contains("{{")) {
            return template;
        }
        Matcher matcher = TOKEN_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            JsonNode tokenValue = tokenValue(matcher.group(1).trim(), context);
            String replacement = tokenValue == null ? matcher.group() : textOf(tokenValue);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private JsonNode resolveTextNode(String text, ExecutionContext context) {
        String trimmed = text.trim();
        Matcher single = TOKEN_PATTERN.matcher(trimmed);
        if (single.matches()) {
            JsonNode tokenValue = tokenValue(single.group(1).trim(), context);
            if (tokenValue != null) {
                return tokenValue.deepCopy();
            }
        }
        return NODES.textNode(resolveText(text, context));
    }

    private JsonNode tokenValue(String token, ExecutionContext context) {
        if (token.isEmpty()) {
            return null;
        }
        switch (token) {
            case "trigger.type":
                return context.getTriggerType() == null ? null : NODES.textNode(context.getTriggerType().value());
            case "trigger.entity":
                return NODES.textNode(context.getTriggerEntityLogicalName() == null
                        ? "" : context.getTriggerEntityLogicalName());
            case "run.id":
                return context.getRunId() == null ? null : NODES.textNode(context.getRunId().toString());
            case "run.attempt":
                return NODES.numberNode(context.getAttemptNumber());
            case "now.iso":
                return context.getNow() == null ? null : NODES.textNode(context.getNow().toString());
            default:
                return PayloadPaths.resolve(context.getTriggerPayload(), payloadPath(token));
        }
    }

    private String payloadPath(String token) {
        if (token.startsWith("trigger.payload.")) {
            return token.substring("trigger.payload.".length());
        }
        if (token.startsWith("trigger.")) {
            return token.substring("trigger.".length());
        }
        if (token.startsWith("payload.")) {
            return token;
        }
        return null;
    }

    private String textOf(JsonNode node) {
        if (node.isNull()) return "null";
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
