package com.geico.poc.kqlcompiler.config;

import com.geico.poc.kqlcompiler.parser.KqlParser;
import com.geico.poc.kqlcompiler.parser.ProcessKqlParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the external KQL parser when a parser command is configured.
 * Without one, only pre-parsed trees can be compiled.
 */
@Configuration
public class ParserConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ParserConfiguration.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "kql-compiler.parser", name = "command")
    public KqlParser kqlParser(KqlCompilerConfig config) {
        KqlCompilerConfig.ParserConfig parser = config.getParser();
        log.info("🔧 Configuring external KQL parser: {} (timeout {} ms)", parser.getCommand(), parser.getTimeoutMs());
        return new ProcessKqlParser(parser.getCommand(), parser.getTimeoutMs());
    }
}
