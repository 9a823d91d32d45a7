package io.gqlextract.shopify.graphql.exception;

import java.util.List;

/**
 * Fatal failure while extracting one entity.
 * <p>
 * Carries the entity name, the offending GraphQL path (when the failure is tied to a field)
 * and the server error code, so the caller can log and decide whether the run goes on.
 * Recoverable conditions (pruned fields, skipped entities) never surface as this exception.
 * </p>
 */
public class ExtractionException extends RuntimeException {

    private final String entity;
    private final List<Object> path;
    private final String code;

    public ExtractionException(String entity, String message) {
        this(entity, null, null, message, null);
    }

    public ExtractionException(String entity, String message, Throwable cause) {
        this(entity, null, null, message, cause);
    }

    public ExtractionException(String entity, List<Object> path, String code, String message) {
        this(entity, path, code, message, null);
    }

    public ExtractionException(String entity, List<Object> path, String code, String message, Throwable cause) {
        super(describe(entity, path, code, message), cause);
        this.entity = entity;
        this.path = path;
        this.code = code;
    }

    public String getEntity() {
        return entity;
    }

    public List<Object> getPath() {
        return path;
    }

    public String getCode() {
        return code;
    }

    private static String describe(String entity, List<Object> path, String code, String message) {
        StringBuilder sb = new StringBuilder();
        if (entity != null) {
            sb.append('[').append(entity).append("] ");
        }
        sb.append(message);
        if (path != null) {
            sb.append(" (path ").append(path).append(')');
        }
        if (code != null) {
            sb.append(" (code ").append(code).append(')');
        }
        return sb.toString();
    }
}
