package org.saiql.engine;

import org.saiql.engine.lang.QueryLexer;
import org.saiql.engine.lang.QueryParser;
import org.saiql.engine.lang.Surface;
import org.saiql.engine.lang.Token;
import org.saiql.engine.lang.ast.QueryAst;
import org.saiql.engine.optimizer.IndexMetadata;
import org.saiql.engine.optimizer.OptimizationLevel;
import org.saiql.engine.optimizer.Optimizer;
import org.saiql.engine.optimizer.OptimizerResult;
import org.saiql.engine.plan.PlanBuilder;
import org.saiql.engine.plan.PlanNode;
import org.saiql.engine.plan.SinkNode;
import org.saiql.engine.store.SchemaCatalog;
import org.saiql.engine.transpiler.GeneratedSql;
import org.saiql.engine.transpiler.SQLDialects;
import org.saiql.engine.transpiler.SQLGenerator;
import org.saiql.engine.types.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles symbolic queries into parameterized SQL for one backend.
 *
 * <p>Pipeline: lex, parse, validate and build the plan, optimize, generate.
 * Every stage is a pure function of its inputs, so the compiler is stateless
 * and safe for concurrent use; identical inputs give identical output.
 * The optimizer handed to the constructor runs at
 * {@link OptimizationLevel#STANDARD}; other levels use their built-in rule sets.
 *
 * <pre>{@code
 * QueryCompiler compiler = new QueryCompiler(TypeRegistry.standard(), QueryFirewall.allowAll());
 * CompiledQuery query = compiler.compile("*COUNT[orders]::*|status='completed'>>oQ",
 *         Surface.SYMBOLIC, DialectId.DUCKDB, catalog, IndexMetadata.unavailable(), CompileOptions.defaults());
 * }</pre>
 */
public final class QueryCompiler {

    private static final Logger log = LoggerFactory.getLogger(QueryCompiler.class);

    private final TypeRegistry typeRegistry;
    private final QueryFirewall firewall;
    private final Optimizer optimizer;

    public QueryCompiler(TypeRegistry typeRegistry, QueryFirewall firewall) {
        this(typeRegistry, firewall, Optimizer.standard());
    }

    public QueryCompiler(TypeRegistry typeRegistry, QueryFirewall firewall, Optimizer optimizer) {
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "Type registry cannot be null");
        this.firewall = Objects.requireNonNull(firewall, "Query firewall cannot be null");
        this.optimizer = Objects.requireNonNull(optimizer, "Optimizer cannot be null");
    }

    /**
     * Compiles one statement.
     *
     * @throws QueryCompileException with the failing stage's reason code
     */
    public CompiledQuery compile(String queryText, Surface surface, DialectId target, SchemaCatalog schema,
                                 IndexMetadata indexHints, CompileOptions options) {
        Objects.requireNonNull(queryText, "Query text cannot be null");
        Objects.requireNonNull(surface, "Surface cannot be null");
        Objects.requireNonNull(target, "Target dialect cannot be null");
        Objects.requireNonNull(schema, "Schema catalog cannot be null");
        Objects.requireNonNull(indexHints, "Index metadata cannot be null");
        Objects.requireNonNull(options, "Compile options cannot be null");

        Instant started = options.clock().instant();
        List<Token> tokens = new QueryLexer(queryText, surface).tokenize();
        String normalized = QueryLexer.normalize(tokens);
        log.debug("Lexed {} tokens: {}", tokens.size(), normalized);

        QueryAst ast = new QueryParser(tokens, surface).parse();
        log.debug("Parsed: {}", ast);

        PlanNode plan = new PlanBuilder(schema, firewall).build(ast, normalized);
        log.debug("Plan: {}", plan);

        OptimizerResult optimized = optimizerFor(options.optimizationLevel())
                .optimize(plan, indexHints, options.budget());
        log.debug("Optimized plan: {}", optimized.plan());

        SQLGenerator generator = new SQLGenerator(SQLDialects.forId(target), typeRegistry,
                options.allowOverrides(), options.deferUnsupported());
        GeneratedSql generated = generator.generate(optimized.plan());

        List<CompileWarning> warnings = new ArrayList<>(optimized.warnings());
        warnings.addAll(generated.warnings());
        CompileStatus status = generated.requiresOverride() ? CompileStatus.REQUIRES_OVERRIDE : CompileStatus.READY;
        if (status == CompileStatus.REQUIRES_OVERRIDE) {
            log.debug("Compiled with deferred features for {}: {}", target, warnings);
        }
        Duration compileTime = Duration.between(started, options.clock().instant());
        log.debug("Compiled for {} in {} us, estimated cost {}", target, compileTime.toNanos() / 1000,
                optimized.explain().estimatedCost());
        return new CompiledQuery(target, generated.sql(), generated.parameters(), warnings, optimized.explain(),
                status, plan instanceof SinkNode sink ? sink.format() : null, generated.resultColumns(), compileTime);
    }

    private Optimizer optimizerFor(OptimizationLevel level) {
        return level == OptimizationLevel.STANDARD ? optimizer : Optimizer.forLevel(level);
    }
}
