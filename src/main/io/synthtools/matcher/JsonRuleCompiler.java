package io.synthtools.matcher;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.synthtools.matcher.inventory.AttributeValue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a rule list from its parsed configuration form (a Jackson tree decoded from YAML or JSON) into a
 * {@link RuleSet}.
 * A rule list is an array of entries, each of them an object:
 *   [
 *     { "device_type": "router" },
 *     { "site.site_name": { "regex": "^DC[0-9]+" } },
 *     { "any": [
 *         { "all": [ { "site.site_name": "siteA" }, { "device_type": "router" } ] },
 *         { "all": [ { "site.site_name": "siteB" }, { "device_type": "gateway" } ] }
 *     ] },
 *     { "one_of_each": { "asn": [ 1, 2 ], "country": [ "US" ] } },
 *     { "limit": 10 }
 *   ]
 * An entry with several attribute keys is the AND of its per-key rules. "any" and "all" nest to any depth;
 * "one_of_each" and "limit" may only appear once each, at the top level of the list. "=limit" is accepted as a
 * spelling of "limit".
 */
public class JsonRuleCompiler {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private JsonRuleCompiler() { }

    /**
     * Verify the syntax of a rule list
     * @param source rule list, as a JSON String
     * @return null if the rule list is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            compile(source);
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final JsonNode source) {
        try {
            compile(source);
            return null;
        } catch (ConfigurationException e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * @param source rule list, as a JSON String
     * @return the compiled rule set
     * @throws IOException if the source isn't syntactically valid JSON
     * @throws ConfigurationException if the rule list is malformed
     */
    public static RuleSet compile(final String source) throws IOException {
        return compile(OBJECT_MAPPER.readTree(source), Configuration.defaults());
    }

    public static RuleSet compile(final JsonNode source) {
        return compile(source, Configuration.defaults());
    }

    /**
     * @param source the rule list array
     * @param configuration engine configuration
     * @return the compiled rule set
     * @throws ConfigurationException if the rule list is malformed
     */
    public static RuleSet compile(final JsonNode source, final Configuration configuration) {
        if (source == null || !source.isArray()) {
            barf("Rule list must be an array");
        }
        final List<Rule> entries = new ArrayList<>();
        Integer limit = null;
        for (JsonNode entry : source) {
            if (isLimitEntry(entry)) {
                if (limit != null) {
                    barf("Only one '" + Constants.LIMIT + "' entry is allowed in a rule list");
                }
                limit = parseLimit(entry.elements().next());
            } else {
                entries.add(parseEntry(entry, true));
            }
        }
        return RuleSet.of(entries, limit, configuration);
    }

    private static boolean isLimitEntry(final JsonNode entry) {
        if (!entry.isObject()) {
            return false;
        }
        final Iterator<String> names = entry.fieldNames();
        while (names.hasNext()) {
            if (Constants.isLimitKey(names.next())) {
                if (entry.size() != 1) {
                    barf("'" + Constants.LIMIT + "' must be the only key of its entry");
                }
                return true;
            }
        }
        return false;
    }

    /**
     * @param node the value of a limit key
     * @return the limit, a positive integer
     */
    static int parseLimit(final JsonNode node) {
        if (!node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() < 1) {
            barf("'" + Constants.LIMIT + "' must be a positive integer, got " + node);
        }
        return node.intValue();
    }

    private static Rule parseEntry(final JsonNode entry, final boolean topLevel) {
        if (!entry.isObject()) {
            barf("Rule entry must be an object, got " + entry);
        }
        if (entry.size() == 0) {
            barf("Empty rule entry");
        }

        final Iterator<Map.Entry<String, JsonNode>> fields = entry.fields();
        final List<Rule> rules = new ArrayList<>();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final String key = field.getKey();
            if (Constants.RESERVED_RULE_KEYS.contains(key)) {
                if (entry.size() != 1) {
                    barf("'" + key + "' must be the only key of its entry");
                }
                return parseReserved(key, field.getValue(), topLevel);
            }
            rules.add(parseAttribute(key, field.getValue()));
        }
        return rules.size() == 1 ? rules.get(0) : Rule.allOf(rules);
    }

    private static Rule parseReserved(final String key, final JsonNode value, final boolean topLevel) {
        switch (key) {
        case Constants.ANY_OF:
            return Rule.anyOf(parseNested(key, value));
        case Constants.ALL_OF:
            return Rule.allOf(parseNested(key, value));
        case Constants.ONE_OF_EACH:
            if (!topLevel) {
                barf("'" + Constants.ONE_OF_EACH + "' is only allowed at the top level of a rule list");
            }
            return parseOneOfEach(value);
        default:
            // limit entries are taken out before parseEntry runs at the top level
            barf("'" + key + "' is only allowed at the top level of a rule list");
            return null;
        }
    }

    private static List<Rule> parseNested(final String key, final JsonNode value) {
        if (!value.isArray()) {
            barf("Value of '" + key + "' must be an array of rules");
        }
        final List<Rule> rules = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            rules.add(parseEntry(element, false));
        }
        return rules;
    }

    private static OneOfEach parseOneOfEach(final JsonNode value) {
        if (!value.isObject()) {
            barf("Value of '" + Constants.ONE_OF_EACH + "' must be an object mapping attributes to value lists");
        }
        final Map<String, List<String>> bindings = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isArray()) {
                barf("'" + Constants.ONE_OF_EACH + "' attribute '" + field.getKey() + "' must list its values");
            }
            final List<String> values = new ArrayList<>(field.getValue().size());
            for (JsonNode element : field.getValue()) {
                values.add(scalar(field.getKey(), element));
            }
            bindings.put(field.getKey(), values);
        }
        return Rule.oneOfEach(bindings);
    }

    private static Rule parseAttribute(final String attribute, final JsonNode value) {
        if (value.isObject()) {
            final JsonNode regex = value.get(Constants.REGEX);
            if (value.size() != 1 || regex == null) {
                barf("Unknown operator for attribute '" + attribute + "': " + value);
            }
            if (!regex.isTextual()) {
                barf("'" + Constants.REGEX + "' for attribute '" + attribute + "' must be a string");
            }
            return Rule.regexMatch(attribute, regex.asText());
        }
        return Rule.directMatch(attribute, scalar(attribute, value));
    }

    private static String scalar(final String attribute, final JsonNode value) {
        if (!value.isValueNode() || value.isNull()) {
            barf("Value for attribute '" + attribute + "' must be a string, number or boolean, got " + value);
        }
        return AttributeValue.canonicalString(value);
    }

    private static void barf(final String msg) throws ConfigurationException {
        throw new ConfigurationException(msg);
    }
}
