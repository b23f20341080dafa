package io.b2mash.b2b.schematenancy.multitenancy;

import io.b2mash.b2b.schematenancy.config.TenancyProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TenancyProperties.class)
public class MultiTenancyConfig {

  @Bean
  SchemaNameValidator schemaNameValidator(TenancyProperties properties) {
    return new SchemaNameValidator(
        properties.publicSchemaName(), properties.reservedSchemaNames());
  }

  @Bean
  SchemaStatements schemaStatements(SchemaNameValidator schemaNameValidator) {
    return new SchemaStatements(schemaNameValidator);
  }
}
