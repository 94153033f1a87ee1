package com.example.todo_authz.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class ClientPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(PropertiesConfig.class);

  @Test
  void missingValuesFallBackToDefaults() {
    contextRunner.run(
        context -> {
          final TupleStoreClientProperties tupleStore =
              context.getBean(TupleStoreClientProperties.class);
          assertThat(tupleStore.readUrl()).isEqualTo("http://keto:4466");
          assertThat(tupleStore.writeUrl()).isEqualTo("http://keto:4467");
          assertThat(tupleStore.checkEndpoints())
              .isEqualTo(TupleStoreClientProperties.DEFAULT_CHECK_ENDPOINTS);
          assertThat(context.getBean(IdentityClientProperties.class).identityPaths())
              .containsExactly("/admin/identities/{id}", "/identities/{id}");
          assertThat(context.getBean(RecordStoreClientProperties.class).tablePath())
              .isEqualTo("/rest/v1/todos");
          final OwnershipProperties ownership = context.getBean(OwnershipProperties.class);
          assertThat(ownership.subjectIdFor("u1")).isEqualTo("user:u1");
          assertThat(ownership.listPageSize()).isEqualTo(500);
          assertThat(context.getBean(AuthzProperties.class).userIdHeaderName())
              .isEqualTo("X-User-Id");
        });
  }

  @Test
  void bindsCheckEndpointDescriptorsInOrder() {
    contextRunner
        .withPropertyValues(
            "tuple-store.read-url=http://read.internal:4466",
            "tuple-store.check-endpoints[0].method=get",
            "tuple-store.check-endpoints[0].path=/check",
            "tuple-store.check-endpoints[1].path=/relation-tuples/check",
            "record-store.api-key=secret",
            "record-store.table=tasks",
            "ownership.subject-prefix=")
        .run(
            context -> {
              final TupleStoreClientProperties tupleStore =
                  context.getBean(TupleStoreClientProperties.class);
              assertThat(tupleStore.readUrl()).isEqualTo("http://read.internal:4466");
              assertThat(tupleStore.checkEndpoints())
                  .containsExactly(
                      new CheckEndpoint("GET", "/check"),
                      CheckEndpoint.post("/relation-tuples/check"));
              final RecordStoreClientProperties recordStore =
                  context.getBean(RecordStoreClientProperties.class);
              assertThat(recordStore.apiKey()).isEqualTo("secret");
              assertThat(recordStore.tablePath()).isEqualTo("/rest/v1/tasks");
              final OwnershipProperties ownership = context.getBean(OwnershipProperties.class);
              assertThat(ownership.subjectIdFor("u1")).isEqualTo("u1");
              assertThat(ownership.userIdFromSubject("u1")).isEqualTo("u1");
            });
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties({
    TupleStoreClientProperties.class,
    IdentityClientProperties.class,
    RecordStoreClientProperties.class,
    OwnershipProperties.class,
    AuthzProperties.class
  })
  static class PropertiesConfig {}
}
