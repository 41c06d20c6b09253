package org.rostilos.codeinsights.schema.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.rostilos.codeinsights.schema.codec.CodeInsightsJsonCodec;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CodeInsightsSchemaConfig {

    @Value("${codeinsights.schema.pretty-print:false}")
    private boolean prettyPrint;

    /**
     * Mapper dedicated to Code Insights payloads. Application-wide inclusion or naming
     * settings must not reach the wire format.
     */
    @Bean
    public ObjectMapper codeInsightsObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
        return objectMapper;
    }

    @Bean
    public CodeInsightsJsonCodec codeInsightsJsonCodec(@Qualifier("codeInsightsObjectMapper") ObjectMapper objectMapper) {
        return new CodeInsightsJsonCodec(objectMapper);
    }
}
