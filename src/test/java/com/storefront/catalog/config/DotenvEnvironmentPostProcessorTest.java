package com.storefront.catalog.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.SpringApplication;
import org.springframework.core.Ordered;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class DotenvEnvironmentPostProcessorTest {

    @Test
    void should_LeaveEnvironmentUntouched_When_NoEnvFileExists() {
        assumeFalse(Files.exists(Path.of(".env")), "a local .env file is present");
        MockEnvironment env = new MockEnvironment();
        DotenvEnvironmentPostProcessor processor = new DotenvEnvironmentPostProcessor();

        processor.postProcessEnvironment(env, new SpringApplication());

        assertThat(env.getPropertySources().contains(DotenvEnvironmentPostProcessor.PROPERTY_SOURCE_NAME)).isFalse();
        assertThat(processor.getOrder()).isEqualTo(Ordered.HIGHEST_PRECEDENCE);
    }
}
