package io.gqlextract.shopify.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One entry of a response's {@code errors[]} array.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GraphQLError {

    public static final String ACCESS_DENIED = "ACCESS_DENIED";
    public static final String MISSING_REQUIRED_ARGUMENTS = "missingRequiredArguments";

    private String message;
    /** Field path from the root query field down; strings and list indices */
    private List<Object> path;
    /** {@code extensions.code}, null when the server sent none */
    private String code;

    /** True when the error names at least one field. */
    public boolean hasUsablePath() {
        return path != null && !path.isEmpty();
    }

    /** True when the error is scoped to the root query field itself. */
    public boolean isTopLevel() {
        return path != null && path.size() == 1;
    }

    @SuppressWarnings("unchecked")
    public static GraphQLError fromJson(Map<String, Object> json) {
        GraphQLError error = new GraphQLError();
        error.setMessage(json.get("message") != null ? json.get("message").toString() : null);
        Object path = json.get("path");
        if (path instanceof List) {
            error.setPath(new ArrayList<>((List<Object>) path));
        }
        Object extensions = json.get("extensions");
        if (extensions instanceof Map) {
            Object code = ((Map<String, Object>) extensions).get("code");
            error.setCode(code != null ? code.toString() : null);
        }
        return error;
    }
}
