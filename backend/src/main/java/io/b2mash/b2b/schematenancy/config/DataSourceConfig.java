package io.b2mash.b2b.schematenancy.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Two pools against the same database. The app pool hands out connections wrapped in a {@code
 * ConnectionSchemaContext}; the migration pool is used by Flyway only, so migrations never disturb
 * the search path of a borrowed context.
 */
@Configuration
public class DataSourceConfig {

  @Bean(name = "appDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.app")
  public HikariDataSource appDataSource() {
    return new HikariDataSource();
  }

  @Bean(name = "migrationDataSource")
  @ConfigurationProperties("spring.datasource.migration")
  public HikariDataSource migrationDataSource() {
    return new HikariDataSource();
  }
}
