package twig.core.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSyntaxException;
import twig.core.exception.ParseException;
import twig.core.type.Result;
import twig.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses run configurations written as JSON objects:
 *
 * <pre>
 * {
 *     "suites": ["com.acme.StackSuite", "com.acme.QueueSpec"],
 *     "test_name": "push adds an element",
 *     "include_tags": ["fast"],
 *     "exclude_tags": ["slow", "twig.Ignore"],
 *     "num_threads": 4,
 *     "config": { "db_url": "jdbc:h2:mem:test", "retries": 3 }
 * }
 * </pre>
 *
 * Only "suites" is required. Values in "config" are kept as strings, numbers or booleans.
 */
public final class JsonRunConfigurationParser implements RunConfigurationParser {
    private static final String SUITES_KEY = "suites";
    private static final String TEST_NAME_KEY = "test_name";
    private static final String INCLUDE_TAGS_KEY = "include_tags";
    private static final String EXCLUDE_TAGS_KEY = "exclude_tags";
    private static final String NUM_THREADS_KEY = "num_threads";
    private static final String CONFIG_KEY = "config";

    @Override
    public Result<RunConfiguration> parseRunConfiguration(String document) {
        ObjectChecker.assertNonNull(document);

        try {
            JsonElement parsedDocument = JsonParser.parseString(document);
            if (!parsedDocument.isJsonObject()) {
                return Result.error(createParseFailureMessage("run configuration is not a JSON object"));
            }
            JsonObject json = parsedDocument.getAsJsonObject();

            RunConfiguration.Builder builder = RunConfiguration.newBuilder()
                    .suiteClassNames(parseAsStringList(json, SUITES_KEY));

            if (json.has(TEST_NAME_KEY)) {
                builder.testName(parseAsString(json, TEST_NAME_KEY));
            }
            if (json.has(INCLUDE_TAGS_KEY)) {
                builder.includeTags(new LinkedHashSet<>(parseAsStringList(json, INCLUDE_TAGS_KEY)));
            }
            if (json.has(EXCLUDE_TAGS_KEY)) {
                builder.excludeTags(new LinkedHashSet<>(parseAsStringList(json, EXCLUDE_TAGS_KEY)));
            }
            if (json.has(NUM_THREADS_KEY)) {
                int numThreads = parseAsInt(json, NUM_THREADS_KEY);
                if (numThreads <= 0) {
                    return Result.error(createParseFailureMessage("expected " + NUM_THREADS_KEY + " to be strictly positive"));
                }
                builder.numThreads(numThreads);
            }
            if (json.has(CONFIG_KEY)) {
                builder.configMap(parseConfigMap(parseAsJsonObject(json, CONFIG_KEY)));
            }

            return Result.successful(builder.build());
        } catch (JsonSyntaxException e) {
            return Result.error(createParseFailureMessage("malformed JSON: " + e.getMessage()));
        } catch (ParseException e) {
            return Result.error(createParseFailureMessage(e.getMessage()));
        } catch (IllegalStateException e) {
            return Result.error(createParseFailureMessage(e.getMessage()));
        }
    }

    private static Map<String, Object> parseConfigMap(JsonObject json) throws ParseException {
        Map<String, Object> configMap = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            if (!entry.getValue().isJsonPrimitive()) {
                throw new ParseException("expected " + CONFIG_KEY + "." + entry.getKey() + " to be a String, Number or Boolean");
            }
            JsonPrimitive primitive = entry.getValue().getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                configMap.put(entry.getKey(), primitive.getAsBoolean());
            } else if (primitive.isNumber()) {
                configMap.put(entry.getKey(), primitive.getAsNumber());
            } else {
                configMap.put(entry.getKey(), primitive.getAsString());
            }
        }
        return configMap;
    }

    private static String createParseFailureMessage(String cause) {
        return "Failed to parse run configuration: " + cause;
    }

    private static int parseAsInt(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new ParseException("expected " + attribute + " to be a Number");
        }
        return element.getAsInt();
    }

    private static String parseAsString(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new ParseException("expected " + attribute + " to be a String");
        }
        return element.getAsString();
    }

    private static List<String> parseAsStringList(JsonObject json, String attribute) throws ParseException {
        JsonArray array = parseAsJsonArray(json, attribute);
        List<String> values = new ArrayList<>();
        for (JsonElement element : array) {
            if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
                throw new ParseException("expected every element of " + attribute + " to be a String");
            }
            values.add(element.getAsString());
        }
        return values;
    }

    private static JsonObject parseAsJsonObject(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonObject()) {
            throw new ParseException("expected " + attribute + " to be a JSON Object");
        }
        return element.getAsJsonObject();
    }

    private static JsonArray parseAsJsonArray(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonArray()) {
            throw new ParseException("expected " + attribute + " to be a JSON Array");
        }
        return element.getAsJsonArray();
    }

    private static JsonElement getElementFromAttribute(JsonObject json, String attribute) throws ParseException {
        if (!json.has(attribute)) {
            throw new ParseException("missing " + attribute);
        }
        return json.get(attribute);
    }
}
