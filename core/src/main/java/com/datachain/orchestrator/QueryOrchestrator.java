package com.datachain.orchestrator;

import com.datachain.config.CompilerSettings;
import com.datachain.generator.SQLGenerator;
import com.datachain.json.QueryJson;
import com.datachain.logical.SqlQuery;
import com.datachain.planner.QueryPlanner;
import com.datachain.query.Query;
import com.datachain.query.QueryContext;
import com.datachain.resolver.QueryResolver;
import com.datachain.resolver.ResolvedQuery;
import com.datachain.semantic.SemanticModel;
import com.datachain.validation.QueryError;
import com.datachain.validation.QueryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Compiles queries against one semantic model.
 *
 * <p>Stages run in order and compilation stops at the first stage that
 * reports errors:
 * <ol>
 *   <li>structure validation</li>
 *   <li>reference validation</li>
 *   <li>resolution</li>
 *   <li>join path validation</li>
 *   <li>planning (analysis, then AST assembly)</li>
 *   <li>SQL generation</li>
 * </ol>
 *
 * <p>Each call gets its own {@link QueryContext}; the orchestrator itself holds
 * only the immutable model and stateless stages, so it can be shared.
 *
 * <p>Example usage:
 * <pre>
 *   QueryOrchestrator orchestrator = new QueryOrchestrator(model);
 *   CompilationResult result = orchestrator.compile(query);
 *   if (result.isSuccess()) {
 *       executor.executeQuery(result.sql());
 *   } else {
 *       result.errors().forEach(System.err::println);
 *   }
 * </pre>
 */
public class QueryOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(QueryOrchestrator.class);

    private final SemanticModel model;
    private final QueryValidator validator;
    private final QueryResolver resolver;
    private final QueryPlanner planner;
    private final SQLGenerator generator;
    private final QueryJson json;

    /**
     * Creates an orchestrator configured from system properties.
     *
     * @param model the semantic model
     */
    public QueryOrchestrator(SemanticModel model) {
        this(model, CompilerSettings.fromSystemProperties());
    }

    public QueryOrchestrator(SemanticModel model, CompilerSettings settings) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.validator = new QueryValidator();
        this.resolver = new QueryResolver();
        this.planner = new QueryPlanner(settings);
        this.generator = new SQLGenerator(settings);
        this.json = new QueryJson();
    }

    public SemanticModel getModel() {
        return model;
    }

    /**
     * Compiles a query to DuckDB SQL.
     *
     * @param query the query
     * @return the SQL and AST, or the errors of the first failing stage
     * @throws com.datachain.exception.QueryResolutionException if a validated
     *         reference fails to resolve
     */
    public CompilationResult compile(Query query) {
        Objects.requireNonNull(query, "query must not be null");
        QueryContext ctx = new QueryContext();

        List<QueryError> errors = validator.validateStructure(query, ctx);
        if (!errors.isEmpty()) {
            return fail("structure validation", errors, ctx);
        }

        errors = validator.validateReferences(query, model, ctx);
        if (!errors.isEmpty()) {
            return fail("reference validation", errors, ctx);
        }

        ResolvedQuery resolved = resolver.resolve(query, model, ctx);

        errors = validator.validateJoinPath(model, ctx);
        if (!errors.isEmpty()) {
            return fail("join path validation", errors, ctx);
        }

        planner.analyseContext(resolved, ctx, model);
        SqlQuery ast = planner.plan(resolved, ctx, model);
        String sql = generator.generate(ast);

        ctx.trace("generated " + sql.length() + " characters of SQL");
        logger.debug("Compiled query over {} (CTE: {})", ctx.getTables(), ctx.requiresCte());
        return CompilationResult.success(sql, ast, ctx);
    }

    /**
     * Parses a JSON query and compiles it.
     *
     * @param queryJson the query document
     * @return the compilation result
     * @throws com.datachain.exception.DefinitionParseException if the JSON is malformed
     */
    public CompilationResult compile(String queryJson) {
        return compile(json.readQuery(queryJson));
    }

    private static CompilationResult fail(String stage, List<QueryError> errors, QueryContext ctx) {
        logger.debug("Query rejected at {} with {} error(s)", stage, errors.size());
        return CompilationResult.failure(errors, ctx);
    }
}
