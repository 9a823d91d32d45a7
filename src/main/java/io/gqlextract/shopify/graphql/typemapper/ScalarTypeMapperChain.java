package io.gqlextract.shopify.graphql.typemapper;

import io.gqlextract.shopify.graphql.PropertyType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Selects the scalar mapper for a GraphQL scalar name.
 *
 * <p>Mappers are checked in priority order (lower priority values first).
 * The first mapper that can handle the scalar is used.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ScalarTypeMapperChain chain = ScalarTypeMapperChain.defaultChain();
 * PropertyType type = chain.mapType("DateTime"); // TIMESTAMP
 * }</pre>
 */
public class ScalarTypeMapperChain {

    private final List<ScalarTypeMapper> mappers = new ArrayList<>();

    /**
     * Chain with the built-in mappers: Boolean, DateTime, Float, Int and the string fallback.
     */
    public static ScalarTypeMapperChain defaultChain() {
        return new ScalarTypeMapperChain()
                .addMapper(new BooleanTypeMapper())
                .addMapper(new DateTimeTypeMapper())
                .addMapper(new FloatTypeMapper())
                .addMapper(new IntTypeMapper())
                .addMapper(new DefaultTypeMapper());
    }

    /**
     * Adds a mapper to the chain.
     * Mappers are automatically sorted by priority after adding.
     *
     * @param mapper Mapper to add
     * @return This chain instance for method chaining
     */
    public ScalarTypeMapperChain addMapper(ScalarTypeMapper mapper) {
        mappers.add(mapper);
        mappers.sort(Comparator.comparingInt(ScalarTypeMapper::getPriority));
        return this;
    }

    /**
     * Maps a scalar name using the first matching mapper.
     *
     * @param scalarName GraphQL scalar name
     * @return property type, STRING when no mapper matches
     */
    public PropertyType mapType(String scalarName) {
        for (ScalarTypeMapper mapper : mappers) {
            if (mapper.canHandle(scalarName)) {
                return mapper.mapType(scalarName);
            }
        }
        return PropertyType.STRING;
    }

    /**
     * Returns all registered mappers in priority order.
     */
    public List<ScalarTypeMapper> getMappers() {
        return new ArrayList<>(mappers);
    }
}
