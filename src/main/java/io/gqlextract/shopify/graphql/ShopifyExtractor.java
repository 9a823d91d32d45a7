package io.gqlextract.shopify.graphql;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.base.Ticker;
import io.gqlextract.shopify.graphql.config.ExtractorSettings;
import io.gqlextract.shopify.graphql.config.SystemPropertyConfiguration;
import io.gqlextract.shopify.graphql.exception.ExtractionException;
import io.gqlextract.shopify.graphql.interfaces.RecordEmitter;
import io.gqlextract.shopify.graphql.interfaces.Sleeper;
import io.gqlextract.shopify.graphql.service.AccessTokenAuthenticator;
import io.gqlextract.shopify.graphql.service.AdaptivePaginator;
import io.gqlextract.shopify.graphql.service.BulkJobManager;
import io.gqlextract.shopify.graphql.service.EntityDiscoverer;
import io.gqlextract.shopify.graphql.service.EntityExtractor;
import io.gqlextract.shopify.graphql.service.ErrorRecovery;
import io.gqlextract.shopify.graphql.service.GraphQLClient;
import io.gqlextract.shopify.graphql.service.HttpRequestBuilder;
import io.gqlextract.shopify.graphql.service.HttpRequestExecutor;
import io.gqlextract.shopify.graphql.service.IntrospectionService;
import io.gqlextract.shopify.graphql.service.QueryBuilder;
import io.gqlextract.shopify.graphql.service.TypeResolver;
import io.gqlextract.shopify.graphql.typemapper.ScalarTypeMapperChain;
import io.gqlextract.shopify.model.EntityDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point of an extraction run against one store.
 *
 * <p><b>Workflow:</b></p>
 * <ol>
 *   <li>Introspect the remote type system (once per instance)</li>
 *   <li>Discover the extractable entities</li>
 *   <li>Apply the catalog selection</li>
 *   <li>Extract the selected entities one after the other</li>
 * </ol>
 *
 * <p>Discovery is cached per instance. Selections and pruned fields apply to a single
 * {@link #run} and do not carry over to the next one.</p>
 *
 * <p>A fatal failure of one entity is logged with the entity name, then either rethrown
 * or skipped depending on {@code abortOnEntityFailure}.</p>
 */
public class ShopifyExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ShopifyExtractor.class);

    private final ExtractorSettings settings;
    private final GraphQLClient graphQLClient;
    private final QueryBuilder queryBuilder = new QueryBuilder();
    private final IntrospectionService introspectionService;
    private final Sleeper sleeper;
    private final Ticker ticker;
    private final Supplier<Catalog> catalog = Suppliers.memoize(this::buildCatalog);

    public ShopifyExtractor(ExtractorSettings settings) {
        this(settings,
                new GraphQLClient(
                        new HttpRequestBuilder(settings, new AccessTokenAuthenticator(settings.getAccessToken())),
                        new HttpRequestExecutor()),
                Sleeper.UNINTERRUPTIBLE,
                Ticker.systemTicker());
    }

    public ShopifyExtractor(ExtractorSettings settings, GraphQLClient graphQLClient, Sleeper sleeper, Ticker ticker) {
        this.settings = settings;
        this.graphQLClient = graphQLClient;
        this.sleeper = sleeper;
        this.ticker = ticker;
        this.introspectionService = new IntrospectionService(graphQLClient, queryBuilder);
    }

    /**
     * Extractor configured from {@code shopify.extractor.*} system properties.
     */
    public static ShopifyExtractor fromSystemProperties() {
        return new ShopifyExtractor(ExtractorSettings.from(new SystemPropertyConfiguration()));
    }

    /**
     * @return every extractable entity of the store
     */
    public List<EntityDescriptor> discover() {
        return catalog.get().entities;
    }

    /**
     * Runs the extraction.
     *
     * @param emitter     output seam
     * @param checkpoints stored checkpoint per entity name; may be null
     * @param selections  selected top-level fields per entity name; null extracts every entity
     *                    with every field, otherwise only the listed entities are extracted
     *                    (a null field set selects every field of that entity)
     */
    public void run(RecordEmitter emitter, Map<String, String> checkpoints, Map<String, Set<String>> selections) {
        Catalog current = catalog.get();
        Map<String, String> state = checkpoints != null ? checkpoints : Collections.emptyMap();
        for (EntityDescriptor discovered : current.entities) {
            EntityDescriptor entity = discovered.copy();
            if (selections != null) {
                if (!selections.containsKey(entity.getName())) {
                    continue;
                }
                Set<String> fields = selections.get(entity.getName());
                if (fields != null) {
                    entity.select(fields);
                }
            }
            try {
                current.extractor.extract(entity, state.get(entity.getName()), emitter);
            } catch (ExtractionException e) {
                logger.error("Extraction of {} failed: {}", entity.getName(), e.getMessage());
                if (settings.isAbortOnEntityFailure()) {
                    throw e;
                }
            }
        }
    }

    private Catalog buildCatalog() {
        IntrospectionSchema introspection = introspectionService.getSchema();
        TypeResolver typeResolver = new TypeResolver(introspection, ScalarTypeMapperChain.defaultChain(), settings);
        List<EntityDescriptor> entities = new EntityDiscoverer(typeResolver).discover(introspection);
        EntityExtractor extractor = new EntityExtractor(
                graphQLClient,
                queryBuilder,
                typeResolver,
                new AdaptivePaginator(sleeper),
                new BulkJobManager(graphQLClient, queryBuilder, settings, sleeper, ticker),
                new ErrorRecovery(settings),
                settings);
        return new Catalog(Collections.unmodifiableList(entities), extractor);
    }

    private static final class Catalog {
        private final List<EntityDescriptor> entities;
        private final EntityExtractor extractor;

        private Catalog(List<EntityDescriptor> entities, EntityExtractor extractor) {
            this.entities = entities;
            this.extractor = extractor;
        }
    }
}
