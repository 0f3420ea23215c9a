package io.buildcv.backend.platform;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Platform client for the Turso Platform API. Databases are created in the configured
 * organization and group; credentials are database-scoped JWTs.
 */
@Component
public class TursoPlatformClient implements DatabasePlatformClient {

  private static final Logger log = LoggerFactory.getLogger(TursoPlatformClient.class);

  private static final Map<String, Object> TOKEN_PERMISSIONS =
      Map.of("permissions", Map.of("read_attach", Map.of("databases", List.of("*"))));

  private final RestClient restClient;
  private final PlatformProperties properties;

  @Autowired
  public TursoPlatformClient(PlatformProperties properties) {
    this(RestClient.builder(), properties);
  }

  TursoPlatformClient(RestClient.Builder builder, PlatformProperties properties) {
    this.properties = properties;
    this.restClient =
        builder
            .baseUrl(properties.baseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiToken())
            .build();
  }

  @Override
  public PlatformDatabase createDatabase(String name, String group) {
    log.info("Creating platform database {} in group {}", name, group);
    var response =
        call(
            "create database " + name,
            () ->
                restClient
                    .post()
                    .uri("/organizations/{org}/databases", properties.organization())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("name", name, "group", group))
                    .retrieve()
                    .onStatus(
                        status -> status.isSameCodeAs(HttpStatus.CONFLICT),
                        (request, res) -> {
                          throw new DatabaseAlreadyExistsException(name);
                        })
                    .body(DatabaseResponse.class));
    return toPlatformDatabase(name, response);
  }

  @Override
  public PlatformDatabase getDatabase(String name) {
    var response =
        call(
            "get database " + name,
            () ->
                restClient
                    .get()
                    .uri(
                        "/organizations/{org}/databases/{name}", properties.organization(), name)
                    .retrieve()
                    .body(DatabaseResponse.class));
    return toPlatformDatabase(name, response);
  }

  @Override
  public String createAuthToken(String databaseName, boolean readOnly) {
    String authorization = readOnly ? "read-only" : "full-access";
    var response =
        call(
            "create " + authorization + " token for " + databaseName,
            () ->
                restClient
                    .post()
                    .uri(
                        "/organizations/{org}/databases/{name}/auth/tokens?authorization={auth}",
                        properties.organization(),
                        databaseName,
                        authorization)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(TOKEN_PERMISSIONS)
                    .retrieve()
                    .body(TokenResponse.class));
    if (response == null || response.jwt() == null || response.jwt().isBlank()) {
      throw new PlatformApiException("No token returned for database " + databaseName);
    }
    return response.jwt();
  }

  private <T> T call(String action, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientException e) {
      log.warn("Platform API call failed: {}: {}", action, e.getMessage());
      throw new PlatformApiException("Platform API call failed: " + action, e);
    }
  }

  private static PlatformDatabase toPlatformDatabase(String name, DatabaseResponse response) {
    if (response == null
        || response.database() == null
        || response.database().hostname() == null) {
      throw new PlatformApiException("No hostname returned for database " + name);
    }
    return new PlatformDatabase(name, response.database().hostname());
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record DatabaseResponse(DatabaseInfo database) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record DatabaseInfo(
      @JsonProperty("Name") @JsonAlias("name") String name,
      @JsonProperty("Hostname") @JsonAlias("hostname") String hostname) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TokenResponse(String jwt) {}
}
