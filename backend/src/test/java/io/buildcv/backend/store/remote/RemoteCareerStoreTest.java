package io.buildcv.backend.store.remote;

import static io.buildcv.backend.testutil.TestCareerData.highlight;
import static io.buildcv.backend.testutil.TestCareerData.job;
import static org.assertj.core.api.Assertions.assertThat;

import io.buildcv.backend.provisioning.TenantSchemaMigrator;
import io.buildcv.backend.store.AbstractCareerStoreTest;
import io.buildcv.backend.store.CareerStore;
import io.buildcv.backend.store.HighlightType;
import io.buildcv.backend.store.Profile;
import java.util.List;
import java.util.UUID;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.simple.JdbcClient;
import tools.jackson.databind.ObjectMapper;

class RemoteCareerStoreTest extends AbstractCareerStoreTest {

  private final TenantSchemaMigrator schemaMigrator = new TenantSchemaMigrator(null);

  private DataSource dataSource;

  @Override
  protected CareerStore newStore() {
    String dbName = "store-" + UUID.randomUUID();
    var h2 = new JdbcDataSource();
    h2.setURL("jdbc:h2:mem:" + dbName + ";DB_CLOSE_DELAY=-1");
    h2.setUser("sa");
    schemaMigrator.migrate(dbName, h2);
    dataSource = h2;
    return new RemoteCareerStore(h2, new ObjectMapper(), clock);
  }

  @Test
  void listFieldsAreStoredAsJsonText() {
    var created =
        store.createHighlight(
            highlight(null, HighlightType.PROJECT, "Ledger", List.of("fintech", "banking")));

    String domains =
        JdbcClient.create(dataSource)
            .sql("SELECT domains FROM highlights WHERE id = ?")
            .param(created.id())
            .query(String.class)
            .single();

    assertThat(domains).isEqualTo("[\"fintech\",\"banking\"]");
  }

  @Test
  void deletingJobRowDirectlyAlsoDetachesHighlights() {
    var acme = store.createJob(job("Acme", "2020-01-01"));
    var fraud =
        store.createHighlight(
            highlight(acme.id(), HighlightType.ACHIEVEMENT, "Fraud model", List.of("fintech")));

    JdbcClient.create(dataSource).sql("DELETE FROM jobs WHERE id = ?").param(acme.id()).update();

    assertThat(store.findHighlight(fraud.id()))
        .hasValueSatisfying(h -> assertThat(h.jobId()).isNull());
  }

  @Test
  void importCollectsProfileWriteFailure() {
    JdbcClient.create(dataSource).sql("DROP TABLE profile").update();

    var result =
        store.importAll(
            snapshot(
                List.of(snapshotJob("job-a")),
                List.of(snapshotHighlight("h-1", "job-a")),
                new Profile("Ada Lovelace", null)));

    assertThat(result.success()).isFalse();
    assertThat(result.jobsImported()).isEqualTo(1);
    assertThat(result.highlightsImported()).isEqualTo(1);
    assertThat(result.errors()).singleElement().asString().startsWith("Failed to import profile:");
    assertThat(store.findJob("job-a")).isPresent();
  }

  @Test
  void rerunningMigrationsIsANoOp() {
    assertThat(schemaMigrator.migrate("again", dataSource)).isZero();
  }
}
