package io.gqlextract.shopify.freemarker;

import io.gqlextract.shopify.freemarker.exception.FreeMarkerException;
import io.gqlextract.shopify.freemarker.exception.FreeMarkerFormatException;
import freemarker.template.*;
import lombok.Getter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Application-wide singleton for Freemarker template engine configuration and execution.
 * <p>
 * - Renders GraphQL documents (paged queries, bulk mutations, status polls) from classpath templates.
 * - Compiled templates are cached by source text, since the same few documents are rendered on every page.
 * - Provides conversion between Java objects and Freemarker {@code TemplateModel}s.
 * </p>
 */
public class FreeMarkerEngine {

    /** Singleton instance of engine for global access. */
    @Getter
    private static final FreeMarkerEngine instance = new FreeMarkerEngine();

    /** Freemarker configuration: thread-safe, global per application. */
    private static final Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);

    static {
        cfg.setBooleanFormat("c");
        cfg.setNumberFormat("computer");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        cfg.setDefaultEncoding("UTF-8");
    }

    private final Map<String, Template> compiled = new LinkedHashMap<>();

    private FreeMarkerEngine() {
    }

    /**
     * Renders a Freemarker template string with provided variable bindings.
     *
     * @param template  The template text as a string.
     * @param variables Bindings (variable name -> TemplateModel).
     * @return The rendered template result as a trimmed string.
     * @throws FreeMarkerFormatException If the template fails to compile or renders with error.
     */
    public String process(String template, Map<String, TemplateModel> variables)
            throws FreeMarkerFormatException {
        StringWriter stringWriter = new StringWriter();
        try {
            getTemplate(template).process(variables, stringWriter);
        } catch (IOException | TemplateException ex) {
            throw new FreeMarkerFormatException(ex.getMessage(), ex);
        }
        return stringWriter.toString().trim();
    }

    /**
     * Compiles (or returns the cached compilation of) a Freemarker template.
     *
     * @param templateText Plain template source code.
     * @return The compiled Freemarker Template object.
     * @throws FreeMarkerException If the template cannot be parsed.
     */
    public synchronized Template getTemplate(String templateText) {
        Template template = compiled.get(templateText);
        if (template != null) {
            return template;
        }
        try {
            template = new Template("graphql", templateText, cfg);
        } catch (IOException e) {
            throw new FreeMarkerException(e.getMessage(), e);
        }
        compiled.put(templateText, template);
        return template;
    }

    /**
     * Converts a Java object to a Freemarker TemplateModel, for use as a variable in templates.
     *
     * @param value Arbitrary Java object (strings, collections, beans).
     * @return Corresponding TemplateModel for Freemarker binding.
     * @throws FreeMarkerException If the value cannot be wrapped.
     */
    public static TemplateModel convert(Object value) {
        try {
            return cfg.getObjectWrapper().wrap(value);
        } catch (TemplateModelException e) {
            throw new FreeMarkerException("Cannot bind " + value + " to a template", e);
        }
    }

}
