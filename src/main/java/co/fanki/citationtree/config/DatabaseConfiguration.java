package co.fanki.citationtree.config;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.spi.JdbiPlugin;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.List;

/**
 * Database configuration for JDBI3 with PostgreSQL.
 *
 * <p>The PostgreSQL plugin maps Java arrays to SQL arrays, which the
 * repositories rely on to bind node id sets as a single
 * {@code = ANY(:ids)} parameter.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class DatabaseConfiguration {

    /**
     * Creates and configures the JDBI instance.
     *
     * @param dataSource the data source to use
     * @param plugins list of JDBI plugins to install
     * @return configured JDBI instance
     */
    @Bean
    public Jdbi jdbi(
            final DataSource dataSource,
            final List<JdbiPlugin> plugins) {

        final Jdbi jdbi = Jdbi.create(dataSource);

        plugins.forEach(jdbi::installPlugin);

        return jdbi;
    }

    /**
     * Provides the PostgreSQL plugin for JDBI.
     *
     * @return PostgreSQL plugin
     */
    @Bean
    public JdbiPlugin postgresPlugin() {
        return new PostgresPlugin();
    }

}
