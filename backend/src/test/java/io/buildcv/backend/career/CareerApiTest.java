package io.buildcv.backend.career;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.buildcv.backend.multitenancy.SessionScopeResolver;
import io.buildcv.backend.platform.DatabasePlatformClient;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/** Career endpoints in an anonymous device session. */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CareerApiTest {

  private static final String DEVICE_HEADER = SessionScopeResolver.DEVICE_ID_HEADER;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private DatabasePlatformClient platformClient;

  private String deviceId;

  @BeforeEach
  void setUp() {
    deviceId = "device-" + UUID.randomUUID();
  }

  @Test
  void createJob_returns201WithLocation() throws Exception {
    mockMvc
        .perform(
            post("/api/jobs")
                .header(DEVICE_HEADER, deviceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"company":"  Acme  ","role":"Engineer","startDate":"2020-01-01",
                     "endDate":"","website":"https://acme.test"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", startsWith("/api/jobs/")))
        .andExpect(jsonPath("$.company").value("Acme"))
        .andExpect(jsonPath("$.endDate").doesNotExist());
  }

  @Test
  void jobLifecycle() throws Exception {
    String jobId = createJob("Acme", "2020-01-01");

    mockMvc
        .perform(
            put("/api/jobs/" + jobId)
                .header(DEVICE_HEADER, deviceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"company":"Acme Corp","role":"Lead","startDate":"2020-01-01"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.company").value("Acme Corp"));

    mockMvc
        .perform(get("/api/jobs/" + jobId).header(DEVICE_HEADER, deviceId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.role").value("Lead"));

    mockMvc
        .perform(delete("/api/jobs/" + jobId).header(DEVICE_HEADER, deviceId))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/jobs/" + jobId).header(DEVICE_HEADER, deviceId))
        .andExpect(status().isNotFound());
  }

  @Test
  void devicesDoNotSeeEachOthersData() throws Exception {
    createJob("Acme", "2020-01-01");

    mockMvc
        .perform(get("/api/jobs").header(DEVICE_HEADER, "device-" + UUID.randomUUID()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }

  @Test
  void highlightVisibilityAndSearch() throws Exception {
    String jobId = createJob("Acme", "2020-01-01");
    String fraud = createHighlight(jobId, "achievement", "Fraud model", "fintech");
    createHighlight(jobId, "project", "Ledger rewrite", "fintech");
    createHighlight(jobId, "achievement", "Clinic scheduling", "health");

    mockMvc
        .perform(
            post("/api/highlights/search")
                .header(DEVICE_HEADER, deviceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"types":["achievement"],"domains":["fintech"]}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].title").value("Fraud model"))
        .andExpect(jsonPath("$[0].job.company").value("Acme"));

    mockMvc
        .perform(patch("/api/highlights/" + fraud + "/visibility").header(DEVICE_HEADER, deviceId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.isHidden").value(true));

    mockMvc
        .perform(get("/api/highlights/domains").header(DEVICE_HEADER, deviceId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2));

    mockMvc
        .perform(get("/api/jobs/with-highlights").header(DEVICE_HEADER, deviceId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].highlights.length()").value(2));

    mockMvc
        .perform(get("/api/jobs").header(DEVICE_HEADER, deviceId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].highlightCount").value(3));
  }

  @Test
  void profileIsEmptyUntilSaved() throws Exception {
    mockMvc
        .perform(get("/api/profile").header(DEVICE_HEADER, deviceId))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(
            put("/api/profile")
                .header(DEVICE_HEADER, deviceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"fullName":"Ada Lovelace"}
                    """))
        .andExpect(status().isOk());

    mockMvc
        .perform(get("/api/profile").header(DEVICE_HEADER, deviceId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.fullName").value("Ada Lovelace"));
  }

  @Test
  void backupImportReportsPerRecordErrors() throws Exception {
    mockMvc
        .perform(
            post("/api/backup")
                .header(DEVICE_HEADER, deviceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"version":"1.0",
                     "jobs":[{"id":"job-1","company":"Acme","role":"Engineer",
                              "startDate":"2020-01-01"}],
                     "highlights":[
                       {"id":"h-1","jobId":"job-1","type":"project","title":"Ledger",
                        "content":"Rewrote the ledger","startDate":"2021-01-01","isHidden":false},
                       {"id":"h-2","jobId":"job-missing","type":"project","title":"Orphan",
                        "content":"No job","startDate":"2021-01-01","isHidden":false}],
                     "profile":{"fullName":"Ada Lovelace"}}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.jobsImported").value(1))
        .andExpect(jsonPath("$.highlightsImported").value(1))
        .andExpect(jsonPath("$.errors.length()").value(1));

    mockMvc
        .perform(get("/api/backup").header(DEVICE_HEADER, deviceId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.version").value("1.0"))
        .andExpect(jsonPath("$.jobs.length()").value(1))
        .andExpect(jsonPath("$.highlights[0].id").value("h-1"))
        .andExpect(jsonPath("$.profile.fullName").value("Ada Lovelace"));

    mockMvc
        .perform(delete("/api/backup").header(DEVICE_HEADER, deviceId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.jobsDeleted").value(1))
        .andExpect(jsonPath("$.highlightsDeleted").value(1));
  }

  @Test
  void backupWithNullListEntriesIsImported() throws Exception {
    mockMvc
        .perform(
            post("/api/backup")
                .header(DEVICE_HEADER, deviceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"version":"1.0","jobs":[],
                     "highlights":[
                       {"id":"h-1","type":"project","title":"Ledger","content":"Rewrote it",
                        "startDate":"2021-01-01","domains":["fintech",null],"skills":[null],
                        "isHidden":false}]}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.highlightsImported").value(1));

    mockMvc
        .perform(get("/api/highlights/domains").header(DEVICE_HEADER, deviceId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0]").value("fintech"));
  }

  @Test
  void backupWithoutVersionIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/backup")
                .header(DEVICE_HEADER, deviceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"jobs":[],"highlights":[]}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void invalidRequestsAreRejected() throws Exception {
    mockMvc.perform(get("/api/jobs")).andExpect(status().isBadRequest());
    mockMvc
        .perform(get("/api/jobs").header(DEVICE_HEADER, "bad id!"))
        .andExpect(status().isBadRequest());
    mockMvc
        .perform(
            post("/api/jobs")
                .header(DEVICE_HEADER, deviceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"company":"","role":"Engineer","startDate":"2020-01-01"}
                    """))
        .andExpect(status().isBadRequest());
    mockMvc
        .perform(
            post("/api/jobs")
                .header(DEVICE_HEADER, deviceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"company":"Acme","role":"Engineer","startDate":"January 2020"}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void signedInUserWithoutDatabaseGets404() throws Exception {
    mockMvc
        .perform(get("/api/jobs").with(jwt().jwt(token -> token.subject("user_no_db"))))
        .andExpect(status().isNotFound());
  }

  private String createJob(String company, String startDate) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/jobs")
                    .header(DEVICE_HEADER, deviceId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"company":"%s","role":"Engineer","startDate":"%s"}
                        """
                            .formatted(company, startDate)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private String createHighlight(String jobId, String type, String title, String domain)
      throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/highlights")
                    .header(DEVICE_HEADER, deviceId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"jobId":"%s","type":"%s","title":"%s","content":"Details of %s",
                         "startDate":"2021-01-01","domains":["%s"]}
                        """
                            .formatted(jobId, type, title, title, domain)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }
}
