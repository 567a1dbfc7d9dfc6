package net.lavalauncher.launcher.manifests;

import com.google.gson.annotations.JsonAdapter;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the {@code arguments.game} or {@code arguments.jvm} list of a version manifest.
 * <p>
 * In JSON an entry is either a plain string, or an object with a list of rules and a value that is
 * itself either a string or an array of strings. Both are normalized into rules plus tokens by
 * {@link ArgumentDeserializer}.
 */
@JsonAdapter(ArgumentDeserializer.class)
public sealed interface Argument {
    List<String> tokens();

    List<Rule> rules();

    default boolean isIncluded(RuleContext context) {
        return Rule.allSatisfied(rules(), context);
    }

    /**
     * Concatenates the tokens of all arguments whose rules are satisfied, in declaration order.
     */
    static List<String> flatten(List<Argument> arguments, RuleContext context) {
        var result = new ArrayList<String>();
        for (var argument : arguments) {
            if (argument.isIncluded(context)) {
                result.addAll(argument.tokens());
            }
        }
        return result;
    }

    record Plain(String value) implements Argument {
        @Override
        public List<String> tokens() {
            return List.of(value);
        }

        @Override
        public List<Rule> rules() {
            return List.of();
        }
    }

    record Conditional(List<Rule> rules, List<String> tokens) implements Argument {
        public Conditional {
            rules = List.copyOf(rules);
            tokens = List.copyOf(tokens);
        }
    }
}
