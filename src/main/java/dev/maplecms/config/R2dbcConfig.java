package dev.maplecms.config;

import dev.maplecms.config.converter.JsonToMetadataConverter;
import dev.maplecms.config.converter.MetadataToJsonConverter;
import dev.maplecms.config.converter.MetadataToStringConverter;
import dev.maplecms.config.converter.StringToMetadataConverter;
import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.convert.R2dbcCustomConversions;
import org.springframework.data.r2dbc.dialect.DialectResolver;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.util.List;

@Configuration(proxyBeanMethods = false)
@EnableR2dbcRepositories(basePackages = "dev.maplecms.repository")
public class R2dbcConfig {

    @Value("${app.schema.file:schema.sql}")
    private String schemaFile;

    /**
     * Applies {@code app.schema.file} on startup when {@code app.schema.init=true}.
     * The statements are idempotent ({@code CREATE TABLE IF NOT EXISTS}).
     */
    @Bean
    @ConditionalOnProperty(name = "app.schema.init", havingValue = "true")
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(schemaFile)));
        return initializer;
    }

    /**
     * Programmatic transactions for units that must be retried as a whole
     * (slug resolution followed by the write).
     */
    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager transactionManager) {
        return TransactionalOperator.create(transactionManager);
    }

    @Bean
    @Profile("!dev")
    public R2dbcCustomConversions r2dbcCustomConversions(ConnectionFactory connectionFactory) {
        var dialect = DialectResolver.getDialect(connectionFactory);
        return R2dbcCustomConversions.of(dialect, List.of(
                new JsonToMetadataConverter(),
                new MetadataToJsonConverter()
        ));
    }

    @Bean
    @Profile("dev")
    public R2dbcCustomConversions r2dbcCustomConversionsH2(ConnectionFactory connectionFactory) {
        var dialect = DialectResolver.getDialect(connectionFactory);
        return R2dbcCustomConversions.of(dialect, List.of(
                new StringToMetadataConverter(),
                new MetadataToStringConverter()
        ));
    }
}
