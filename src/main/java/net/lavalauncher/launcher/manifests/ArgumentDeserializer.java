package net.lavalauncher.launcher.manifests;

import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

public class ArgumentDeserializer implements JsonDeserializer<Argument> {
    private static final Type RULE_LIST_TYPE = new TypeToken<List<Rule>>() {
    }.getType();

    @Override
    public Argument deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) throws JsonParseException {
        if (json.isJsonPrimitive()) {
            return new Argument.Plain(json.getAsString());
        } else if (!json.isJsonObject()) {
            throw new JsonParseException("Argument must be a string or an object: " + json);
        }

        var object = json.getAsJsonObject();
        List<Rule> rules = object.has("rules") ? context.deserialize(object.get("rules"), RULE_LIST_TYPE) : List.of();
        if (rules == null) {
            rules = List.of();
        }

        var value = object.get("value");
        List<String> tokens;
        if (value == null || value.isJsonNull()) {
            throw new JsonParseException("Argument object without value: " + json);
        } else if (value.isJsonArray()) {
            tokens = toStrings(value.getAsJsonArray());
        } else if (value.isJsonPrimitive()) {
            tokens = List.of(value.getAsString());
        } else {
            throw new JsonParseException("Argument value must be a string or an array of strings: " + value);
        }

        return new Argument.Conditional(rules, tokens);
    }

    private static List<String> toStrings(JsonArray array) {
        var result = new ArrayList<String>(array.size());
        for (var element : array) {
            if (!element.isJsonPrimitive()) {
                throw new JsonParseException("Argument value arrays may only contain strings: " + array);
            }
            result.add(element.getAsString());
        }
        return result;
    }
}
