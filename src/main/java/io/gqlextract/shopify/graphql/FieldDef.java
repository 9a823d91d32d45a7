package io.gqlextract.shopify.graphql;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One field of an introspected object type (or of the root query type).
 */
@Getter
@AllArgsConstructor
public final class FieldDef {

    private final String name;
    private final boolean deprecated;
    /** Argument names in declaration order. */
    private final List<String> argumentNames;
    private final TypeRef type;

    public boolean hasArguments() {
        return !argumentNames.isEmpty();
    }

    public boolean acceptsArgument(String argumentName) {
        return argumentNames.contains(argumentName);
    }

    /**
     * Parses an introspection {@code __Field} object.
     */
    @SuppressWarnings("unchecked")
    public static FieldDef fromJson(Map<String, Object> json) {
        List<String> args = new ArrayList<>();
        Object rawArgs = json.get("args");
        if (rawArgs instanceof List) {
            for (Object arg : (List<Object>) rawArgs) {
                if (arg instanceof Map) {
                    args.add((String) ((Map<String, Object>) arg).get("name"));
                }
            }
        }
        return new FieldDef(
                (String) json.get("name"),
                Boolean.TRUE.equals(json.get("isDeprecated")),
                Collections.unmodifiableList(args),
                TypeRef.fromJson(json.get("type")));
    }
}
