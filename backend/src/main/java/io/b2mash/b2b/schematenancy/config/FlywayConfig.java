package io.b2mash.b2b.schematenancy.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayConfig {

  /** Migrates the shared schema holding the tenant and domain routing tables. */
  @Bean(initMethod = "migrate")
  public Flyway globalFlyway(
      @Qualifier("migrationDataSource") DataSource migrationDataSource,
      TenancyProperties properties) {
    return Flyway.configure()
        .dataSource(migrationDataSource)
        .locations("classpath:db/migration/global")
        .schemas(properties.publicSchemaName())
        .baselineOnMigrate(true)
        .load();
  }
}
