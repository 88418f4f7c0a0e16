package com.geico.poc.kqlcompiler.dto;

import com.fasterxml.jackson.databind.JsonNode;

public class CompileRequest {
    private JsonNode ast;
    private String query;

    public CompileRequest() {
    }

    public JsonNode getAst() {
        return ast;
    }

    public void setAst(JsonNode ast) {
        this.ast = ast;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }
}
