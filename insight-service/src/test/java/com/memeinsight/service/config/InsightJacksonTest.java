package com.memeinsight.service.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memeinsight.common.model.ScoringWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InsightJacksonTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
        .withBean(Jackson2ObjectMapperBuilderCustomizer.class, () -> new InsightConfig().insightJacksonCustomizer());

    @Test
    @DisplayName("the customized mapper keeps Boot's lenient defaults")
    void keepsBootDefaults() {
        runner.run(context -> {
            ObjectMapper mapper = context.getBean(ObjectMapper.class);

            assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
            ScoringWeights weights = mapper.readValue(
                "{\"volume\":0.5,\"sentiment\":0.3,\"momentum\":0.1,\"shortInterest\":0.1,\"note\":\"x\"}",
                ScoringWeights.class);
            assertEquals(new ScoringWeights(0.5, 0.3, 0.1, 0.1), weights);
        });
    }

    @Test
    @DisplayName("instants are written as ISO-8601 text")
    void isoInstants() {
        runner.run(context -> {
            ObjectMapper mapper = context.getBean(ObjectMapper.class);

            assertEquals("\"2024-03-04T15:00:00Z\"", mapper.writeValueAsString(Instant.parse("2024-03-04T15:00:00Z")));
        });
    }
}
