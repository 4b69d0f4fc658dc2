package com.guildauction.config;

import com.guildauction.persistence.EmbeddedPersistenceBackend;
import com.guildauction.persistence.JpaPersistenceBackend;
import com.guildauction.persistence.PersistenceGateway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Clock;

/**
 * Wires the two storage backends behind the failover gateway.
 * The embedded store's DataSource stays private so Boot keeps auto-configuring the primary one.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public EmbeddedPersistenceBackend embeddedPersistenceBackend(AuctionProperties properties) {
        AuctionProperties.Persistence settings = properties.getPersistence();
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                settings.getEmbeddedUrl(), settings.getEmbeddedUsername(), settings.getEmbeddedPassword());
        dataSource.setDriverClassName("org.h2.Driver");
        return new EmbeddedPersistenceBackend(new JdbcTemplate(dataSource));
    }

    @Bean
    public PersistenceGateway persistenceGateway(JpaPersistenceBackend primary,
                                                 EmbeddedPersistenceBackend secondary,
                                                 AuctionProperties properties,
                                                 Clock clock) {
        PersistenceGateway gateway = new PersistenceGateway(primary, secondary, properties.getPersistence(), clock);
        gateway.initialize();
        return gateway;
    }
}
