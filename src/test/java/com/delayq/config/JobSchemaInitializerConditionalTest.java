package com.delayq.config;

import com.delayq.JobSchemaInitializer;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class JobSchemaInitializerConditionalTest {

    // Without a real database the initializer only logs, because migration errors are not fatal here.
    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withPropertyValues("delayq.database.fail-on-migration-error=false")
            .withUserConfiguration(JobSchemaInitializer.class)
            .withBean(DataSource.class, () -> mock(DataSource.class));

    @Test
    void shouldCreateSchemaInitializerByDefault() {
        contextRunner.run(context -> assertFalse(context.getBeansOfType(JobSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldSkipSchemaInitializerWhenConfigured() {
        contextRunner.withPropertyValues("delayq.database.skip-create=true")
                .run(context -> assertTrue(context.getBeansOfType(JobSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldFailStartupWhenMigrationFailsByDefault() {
        contextRunner.withPropertyValues("delayq.database.fail-on-migration-error=true")
                .run(context -> assertTrue(context.getStartupFailure() != null));
    }
}
