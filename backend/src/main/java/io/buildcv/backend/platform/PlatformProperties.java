package io.buildcv.backend.platform;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection settings for the database platform API and for reaching the databases it creates.
 *
 * @param baseUrl platform API root, e.g. {@code https://api.turso.tech/v1}
 * @param organization platform organization that owns the tenant databases
 * @param apiToken bearer token for the platform API
 * @param group placement group passed on database creation
 * @param jdbcUrlTemplate JDBC URL of a tenant database, with {@code {hostname}} and {@code
 *     {dbName}} placeholders
 * @param jdbcUsername user name presented together with the issued credential
 */
@ConfigurationProperties(prefix = "buildcv.platform")
public record PlatformProperties(
    @DefaultValue("https://api.turso.tech/v1") String baseUrl,
    String organization,
    String apiToken,
    @DefaultValue("default") String group,
    @DefaultValue("jdbc:postgresql://{hostname}:5432/{dbName}?sslmode=require")
        String jdbcUrlTemplate,
    @DefaultValue("buildcv") String jdbcUsername) {

  public String jdbcUrl(String hostname, String dbName) {
    return jdbcUrlTemplate.replace("{hostname}", hostname).replace("{dbName}", dbName);
  }
}
