package io.github.mcallistertyler.weather.dashboard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.github.mcallistertyler.weather.dashboard.domain.Quantity;
import java.util.function.Function;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

@Component
public class FieldResolver {

    public Double resolve(Quantity quantity, JsonNode section, int index, Double defaultValue) {
        JsonNode value = firstPresent(quantity, alias -> element(section, alias, index), JsonNode::isNumber);
        if (value == null) {
            return defaultValue;
        }
        return value.asDouble();
    }

    public Integer resolveInt(Quantity quantity, JsonNode section, int index, Integer defaultValue) {
        JsonNode value = firstPresent(quantity, alias -> element(section, alias, index), FieldResolver::isWholeNumber);
        if (value == null) {
            return defaultValue;
        }
        return value.asInt();
    }

    public String resolveText(Quantity quantity, JsonNode section, int index, String defaultValue) {
        JsonNode value = firstPresent(quantity, alias -> element(section, alias, index), JsonNode::isTextual);
        if (value == null) {
            return defaultValue;
        }
        return value.asText();
    }

    public Double resolveCurrent(Quantity quantity, JsonNode section, Double defaultValue) {
        JsonNode value = firstPresent(quantity, alias -> field(section, alias), JsonNode::isNumber);
        if (value == null) {
            return defaultValue;
        }
        return value.asDouble();
    }

    public Integer resolveCurrentInt(Quantity quantity, JsonNode section, Integer defaultValue) {
        JsonNode value = firstPresent(quantity, alias -> field(section, alias), FieldResolver::isWholeNumber);
        if (value == null) {
            return defaultValue;
        }
        return value.asInt();
    }

    private static JsonNode firstPresent(Quantity quantity,
                                         Function<String, JsonNode> lookup,
                                         Predicate<JsonNode> accepts) {
        for (String alias : quantity.aliases()) {
            JsonNode candidate = lookup.apply(alias);
            if (accepts.test(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static JsonNode element(JsonNode section, String alias, int index) {
        if (section == null || index < 0) {
            return MissingNode.getInstance();
        }
        JsonNode array = section.path(alias);
        if (!array.isArray()) {
            return MissingNode.getInstance();
        }
        return array.path(index);
    }

    private static JsonNode field(JsonNode section, String alias) {
        return section == null ? MissingNode.getInstance() : section.path(alias);
    }

    private static boolean isWholeNumber(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.canConvertToInt();
        }
        if (!node.isNumber()) {
            return false;
        }
        double value = node.asDouble();
        return value == Math.rint(value) && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }
}
