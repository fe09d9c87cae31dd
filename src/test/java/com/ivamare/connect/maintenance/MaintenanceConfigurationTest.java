package com.ivamare.connect.maintenance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

@DisplayName("MaintenanceConfiguration")
class MaintenanceConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(MaintenanceConfiguration.class))
        .withUserConfiguration(MaintenanceTasksConfig.class);

    @Test
    @DisplayName("should not schedule maintenance unless enabled")
    void shouldBeDisabledByDefault() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(MaintenanceConfiguration.class));
    }

    @Test
    @DisplayName("should schedule maintenance when enabled")
    void shouldBeEnabledByProperty() {
        contextRunner
            .withPropertyValues("connect.maintenance.enabled=true")
            .run(context -> assertThat(context).hasSingleBean(MaintenanceConfiguration.class));
    }

    @Test
    @DisplayName("should keep the schedule alive when a cleanup run fails")
    void shouldSurviveCleanupFailure() {
        MessageLogCleanup cleanup = mock(MessageLogCleanup.class);
        SchemaRefreshTask refresh = mock(SchemaRefreshTask.class);
        when(cleanup.run()).thenThrow(new IllegalStateException("db down"));
        MaintenanceConfiguration configuration = new MaintenanceConfiguration(cleanup, refresh);

        assertDoesNotThrow(configuration::cleanupMessageLog);
        configuration.refreshSchemas();

        verify(refresh).run();
    }

    @Configuration
    static class MaintenanceTasksConfig {
        @Bean
        public MessageLogCleanup messageLogCleanup() {
            return mock(MessageLogCleanup.class);
        }

        @Bean
        public SchemaRefreshTask schemaRefreshTask() {
            return mock(SchemaRefreshTask.class);
        }
    }
}
