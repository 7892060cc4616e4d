package com.datachain.json;

import com.datachain.exception.DefinitionParseException;
import com.datachain.exception.SemanticModelException;
import com.datachain.orchestrator.CompilationResult;
import com.datachain.query.Query;
import com.datachain.semantic.SemanticModel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON reading and writing for queries, semantic models and results.
 *
 * <p>Property names are snake_case ({@code kpi_refs}, {@code time_grain}),
 * comparators are their SQL symbols, enum names are case-insensitive, and
 * polymorphic values carry a {@code kind} tag. Unknown properties are
 * rejected so that a misspelled field is reported rather than ignored.
 *
 * <p>Example query:
 * <pre>
 * {
 *   "dimensions": [{"table": "customers", "column": "customer_name"}],
 *   "kpi_refs": ["total_revenue"],
 *   "dimension_filters": [{"field": "customers.region", "comparator": "IN", "value": ["North"]}],
 *   "order_by": [{"field": "total_revenue", "sorting": "DESC"}],
 *   "limit": 10
 * }
 * </pre>
 */
public class QueryJson {

    private final ObjectMapper mapper;

    public QueryJson() {
        this.mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Parses a query document.
     *
     * @param json the query JSON
     * @return the query
     * @throws DefinitionParseException if the document is malformed
     */
    public Query readQuery(String json) {
        try {
            return mapper.readValue(json, Query.class);
        } catch (JsonProcessingException e) {
            throw new DefinitionParseException("query", e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses and validates a semantic model document.
     *
     * @param json the model JSON
     * @return the validated model
     * @throws DefinitionParseException if the document is malformed
     * @throws SemanticModelException if the model fails its structural checks
     */
    public SemanticModel readSemanticModel(String json) {
        try {
            return mapper.readValue(json, SemanticModel.class);
        } catch (JsonProcessingException e) {
            SemanticModelException modelError = findModelError(e);
            if (modelError != null) {
                throw modelError;
            }
            throw new DefinitionParseException("semantic model", e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a semantic model from a file.
     *
     * @see #readSemanticModel(String)
     */
    public SemanticModel readSemanticModel(Path path) {
        try {
            return readSemanticModel(Files.readString(path));
        } catch (IOException e) {
            throw new DefinitionParseException("semantic model", "cannot read " + path, e);
        }
    }

    /**
     * Writes a compilation result as the JSON answer returned to a caller:
     * {@code sql}, {@code trace} and {@code warnings} on success, {@code errors}
     * and {@code trace} on failure.
     *
     * @param result the compilation result
     * @return JSON text
     */
    public String writeResult(CompilationResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("success", result.isSuccess());
        if (result.isSuccess()) {
            root.put("sql", result.sql());
        } else {
            root.set("errors", mapper.valueToTree(result.errors()));
        }
        ArrayNode trace = root.putArray("trace");
        result.trace().forEach(trace::add);
        ArrayNode warnings = root.putArray("warnings");
        result.warnings().forEach(warnings::add);
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize compilation result", e);
        }
    }

    private static SemanticModelException findModelError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SemanticModelException modelError) {
                return modelError;
            }
            current = current.getCause();
        }
        return null;
    }
}
