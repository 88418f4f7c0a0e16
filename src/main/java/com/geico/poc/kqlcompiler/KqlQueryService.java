package com.geico.poc.kqlcompiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.geico.poc.kqlcompiler.dto.CompileResponse;
import com.geico.poc.kqlcompiler.model.Query;
import com.geico.poc.kqlcompiler.normalizer.AstNormalizer;
import com.geico.poc.kqlcompiler.parser.KqlParseException;
import com.geico.poc.kqlcompiler.parser.KqlParser;
import com.geico.poc.kqlcompiler.transpiler.SqlTranspiler;
import com.geico.poc.kqlcompiler.transpiler.TranspileException;
import com.geico.poc.kqlcompiler.transpiler.TranspiledQuery;
import com.geico.poc.kqlcompiler.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class KqlQueryService {

    private static final Logger log = LoggerFactory.getLogger(KqlQueryService.class);

    public static final String PARSER_UNAVAILABLE = "KQL parser not configured";
    public static final String INVALID_TREE = "Unrecognized parse tree";
    public static final String TRANSPILE_FAILED = "SQL generation failed";

    @Autowired
    private AstNormalizer normalizer;

    @Autowired
    private SqlTranspiler transpiler;

    @Autowired(required = false)
    private KqlParser parser;

    /**
     * Parse KQL text with the configured parser, then compile the tree.
     */
    public CompileResponse translate(String kql) {
        if (kql == null || kql.trim().isEmpty()) {
            return CompileResponse.error("Empty query");
        }
        if (parser == null) {
            return CompileResponse.error(PARSER_UNAVAILABLE,
                    "Set kql-compiler.parser.command or post a parse tree to /api/kql/compile");
        }

        JsonNode tree;
        try {
            tree = parser.parse(kql);
        } catch (KqlParseException e) {
            log.error("❌ KQL parse failed [{}]: {}", e.getTag(), e.getDetail());
            return CompileResponse.error(e.getTag(), e.getDetail());
        }
        return compile(tree);
    }

    /**
     * Compile an already-parsed tree to SQL.
     */
    public CompileResponse compile(JsonNode ast) {
        ValidationResult report = new ValidationResult();
        Optional<Query> query = normalizer.normalize(ast, report);
        if (!query.isPresent()) {
            return CompileResponse.error(INVALID_TREE,
                    "Expected {\"statements\": [{\"TabularExpression\": {\"source\": ..., \"operations\": [...]}}]}");
        }
        if (report.hasErrors()) {
            log.warn(report.getErrorMessage());
        }

        TranspiledQuery result;
        try {
            result = transpiler.transpile(query.get());
        } catch (TranspileException e) {
            log.error("❌ Cannot generate SQL for {}: {}", query.get(), e.getMessage());
            return CompileResponse.error(TRANSPILE_FAILED, e.getMessage());
        }

        report.addWarnings(result.getWarnings());
        log.debug("✅ Compiled {} -> {}", query.get(), result.getSql());
        return new CompileResponse(result.getSql(), report.getWarnings(), report.getErrors());
    }
}
