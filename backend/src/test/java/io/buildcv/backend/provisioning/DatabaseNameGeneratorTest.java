package io.buildcv.backend.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DatabaseNameGeneratorTest {

  @Test
  void generatesDeterministicDatabaseName() {
    String name1 = DatabaseNameGenerator.generateDatabaseName("user_abc123");
    String name2 = DatabaseNameGenerator.generateDatabaseName("user_abc123");
    assertThat(name1).isEqualTo(name2);
  }

  @Test
  void generatesCorrectFormat() {
    String name = DatabaseNameGenerator.generateDatabaseName("user_test");
    assertThat(name).matches("^buildcv-[0-9a-f]{12}$");
  }

  @Test
  void differentPrincipalsProduceDifferentNames() {
    String name1 = DatabaseNameGenerator.generateDatabaseName("user_aaa");
    String name2 = DatabaseNameGenerator.generateDatabaseName("user_bbb");
    assertThat(name1).isNotEqualTo(name2);
  }

  @Test
  void rejectsNullPrincipalId() {
    assertThatThrownBy(() -> DatabaseNameGenerator.generateDatabaseName(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsBlankPrincipalId() {
    assertThatThrownBy(() -> DatabaseNameGenerator.generateDatabaseName("  "))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
