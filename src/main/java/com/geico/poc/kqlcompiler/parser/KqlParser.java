package com.geico.poc.kqlcompiler.parser;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Produces the parse tree consumed by the normalizer from KQL text.
 */
public interface KqlParser {

    /**
     * @param kql one KQL query
     * @return the parser's tree, rooted at its statement list
     * @throws KqlParseException if the query does not parse
     */
    JsonNode parse(String kql) throws KqlParseException;
}
