package com.apiplatform.controller.config;

import com.apiplatform.controller.eventhub.EventHub;
import com.apiplatform.controller.eventhub.EventHubSchema;
import com.apiplatform.controller.eventhub.SQLiteBackend;
import com.apiplatform.controller.eventlistener.EventHubAdapter;
import com.apiplatform.controller.eventlistener.EventSource;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * EventHub configuration
 * Binds gateway.controller.eventhub.* and wires the hub and its event source
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "gateway.controller.eventhub")
@Data
public class EventHubConfig {

    // How often the poller checks organization versions
    private Duration pollInterval = Duration.ofSeconds(1);

    // How often expired events are deleted
    private Duration cleanupInterval = Duration.ofMinutes(10);

    // Events older than this are eligible for cleanup
    private Duration retentionPeriod = Duration.ofHours(1);

    // Wait per background loop on close before interrupting it
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    @Bean(destroyMethod = "close")
    public EventHub eventHub(DataSource dataSource) {
        EventHubSchema.migrate(dataSource);

        SQLiteBackend backend = new SQLiteBackend(dataSource, this);
        backend.initialize();
        log.info("EventHub bean created with SQLite backend");
        return backend;
    }

    @Bean(destroyMethod = "close")
    public EventSource eventSource(EventHub eventHub) {
        return new EventHubAdapter(eventHub);
    }
}
