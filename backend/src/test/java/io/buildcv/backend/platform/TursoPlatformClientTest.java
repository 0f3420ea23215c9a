package io.buildcv.backend.platform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class TursoPlatformClientTest {

  private static final String BASE = "https://platform.test/v1/organizations/acme/databases";

  private MockRestServiceServer server;
  private TursoPlatformClient client;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    client =
        new TursoPlatformClient(
            builder,
            new PlatformProperties(
                "https://platform.test/v1",
                "acme",
                "secret",
                "default",
                "jdbc:postgresql://{hostname}:5432/{dbName}",
                "buildcv"));
  }

  @Test
  void createDatabase_postsNameAndGroupAndReturnsHostname() {
    server
        .expect(requestTo(BASE))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer secret"))
        .andExpect(
            content()
                .json(
                    """
                    {"name":"buildcv-0123456789ab","group":"default"}
                    """))
        .andRespond(
            withSuccess(
                """
                {"database":{"DbId":"42","Name":"buildcv-0123456789ab",
                 "Hostname":"buildcv-0123456789ab-acme.turso.io"}}
                """,
                MediaType.APPLICATION_JSON));

    var database = client.createDatabase("buildcv-0123456789ab", "default");

    assertThat(database.name()).isEqualTo("buildcv-0123456789ab");
    assertThat(database.hostname()).isEqualTo("buildcv-0123456789ab-acme.turso.io");
    server.verify();
  }

  @Test
  void createDatabase_conflictMeansAlreadyExists() {
    server.expect(requestTo(BASE)).andRespond(withStatus(HttpStatus.CONFLICT));

    assertThatThrownBy(() -> client.createDatabase("buildcv-0123456789ab", "default"))
        .isInstanceOfSatisfying(
            DatabaseAlreadyExistsException.class,
            e -> assertThat(e.getDatabaseName()).isEqualTo("buildcv-0123456789ab"));
  }

  @Test
  void createDatabase_serverErrorBecomesPlatformApiException() {
    server.expect(requestTo(BASE)).andRespond(withServerError());

    assertThatThrownBy(() -> client.createDatabase("buildcv-0123456789ab", "default"))
        .isInstanceOf(PlatformApiException.class)
        .isNotInstanceOf(DatabaseAlreadyExistsException.class);
  }

  @Test
  void getDatabase_acceptsLowercaseFields() {
    server
        .expect(requestTo(BASE + "/buildcv-0123456789ab"))
        .andExpect(method(HttpMethod.GET))
        .andRespond(
            withSuccess(
                """
                {"database":{"name":"buildcv-0123456789ab","hostname":"db.acme.test"}}
                """,
                MediaType.APPLICATION_JSON));

    assertThat(client.getDatabase("buildcv-0123456789ab").hostname()).isEqualTo("db.acme.test");
  }

  @Test
  void getDatabase_missingHostnameIsAnError() {
    server
        .expect(requestTo(BASE + "/buildcv-0123456789ab"))
        .andRespond(
            withSuccess(
                """
                {"database":{"Name":"buildcv-0123456789ab"}}
                """,
                MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.getDatabase("buildcv-0123456789ab"))
        .isInstanceOf(PlatformApiException.class)
        .hasMessageContaining("hostname");
  }

  @Test
  void createAuthToken_requestsReadOnlyOrFullAccess() {
    server
        .expect(requestTo(BASE + "/buildcv-0123456789ab/auth/tokens?authorization=read-only"))
        .andExpect(method(HttpMethod.POST))
        .andRespond(withSuccess("{\"jwt\":\"ro-jwt\"}", MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(BASE + "/buildcv-0123456789ab/auth/tokens?authorization=full-access"))
        .andExpect(method(HttpMethod.POST))
        .andRespond(withSuccess("{\"jwt\":\"rw-jwt\"}", MediaType.APPLICATION_JSON));

    assertThat(client.createAuthToken("buildcv-0123456789ab", true)).isEqualTo("ro-jwt");
    assertThat(client.createAuthToken("buildcv-0123456789ab", false)).isEqualTo("rw-jwt");
    server.verify();
  }

  @Test
  void createAuthToken_blankTokenIsAnError() {
    server
        .expect(requestTo(BASE + "/buildcv-0123456789ab/auth/tokens?authorization=full-access"))
        .andRespond(withSuccess("{\"jwt\":\"\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.createAuthToken("buildcv-0123456789ab", false))
        .isInstanceOf(PlatformApiException.class);
  }

  @Test
  void jdbcUrlFillsTemplate() {
    var properties =
        new PlatformProperties(
            null, "acme", "secret", "default", "jdbc:libsql://{hostname}/{dbName}", "buildcv");

    assertThat(properties.jdbcUrl("db.acme.test", "buildcv-1"))
        .isEqualTo("jdbc:libsql://db.acme.test/buildcv-1");
  }
}
