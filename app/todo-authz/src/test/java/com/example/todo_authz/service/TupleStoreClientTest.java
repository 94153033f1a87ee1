package com.example.todo_authz.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.http.HttpMethod.DELETE;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.http.HttpMethod.PUT;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.todo_authz.config.CheckEndpoint;
import com.example.todo_authz.config.TupleStoreClientProperties;
import com.example.todo_authz.model.CheckQuery;
import com.example.todo_authz.model.ListPage;
import com.example.todo_authz.model.ListQuery;
import com.example.todo_authz.model.RelationTuple;
import com.example.todo_authz.model.SubjectRef;
import com.example.todo_authz.model.SubjectSet;
import com.example.todo_authz.model.SubjectTree;
import java.net.SocketTimeoutException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class TupleStoreClientTest {

  private static final String READ = "http://keto-read.test";
  private static final String WRITE = "http://keto-write.test";
  private static final String FALLBACK_LIST_URL =
      READ + "/relation-tuples?namespace=todos&object=7&relation=owner&subject_id=user%3Au1"
          + "&page_size=1";

  @Test
  void checkReturnsAllowedFromFirstServingCandidate() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(READ + "/relation-tuples/check/openapi"))
        .andExpect(method(POST))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));
    fixture
        .server
        .expect(requestTo(READ + "/relation-tuples/check"))
        .andExpect(method(POST))
        .andExpect(
            content()
                .json(
                    """
                    {"namespace":"todos","object":"7","relation":"owner","subject_id":"user:u1"}
                    """))
        .andRespond(withSuccess("{\"allowed\":true}", MediaType.APPLICATION_JSON));

    final boolean allowed = fixture.client.check(ownerCheck());

    assertThat(allowed).isTrue();
    verify(fixture.metrics).recordCheck(true, "endpoint");
    fixture.server.verify();
  }

  @Test
  void checkTreatsMissingAllowedFieldAsDenied() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(READ + "/relation-tuples/check/openapi"))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.check(ownerCheck())).isFalse();
  }

  @Test
  void checkTreatsNonBooleanAllowedFieldAsDenied() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(READ + "/relation-tuples/check/openapi"))
        .andRespond(withSuccess("{\"allowed\":\"yes\"}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.check(ownerCheck())).isFalse();
  }

  @Test
  void checkStopsSweepOnNonNotFoundStatus() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(READ + "/relation-tuples/check/openapi"))
        .andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.check(ownerCheck()))
        .isInstanceOf(TupleStoreIntegrationException.class)
        .extracting(ex -> ((TupleStoreIntegrationException) ex).reason())
        .isEqualTo(TupleStoreIntegrationException.Reason.BAD_GATEWAY);
    fixture.server.verify();
  }

  @Test
  void checkFallsBackToExactMatchListWhenEveryCandidateIsMissing() {
    final ClientFixture fixture = newFixture();
    expectAllCandidatesNotFound(fixture);
    fixture
        .server
        .expect(requestTo(FALLBACK_LIST_URL))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                """
                {"relation_tuples":[
                  {"namespace":"todos","object":"7","relation":"owner","subject_id":"user:u1"}
                ]}
                """,
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.check(ownerCheck())).isTrue();
    verify(fixture.metrics).recordCheck(true, "list_fallback");
    fixture.server.verify();
  }

  @Test
  void fallbackAgreesWithListForEmptyPage() {
    final ClientFixture fixture = newFixture();
    expectAllCandidatesNotFound(fixture);
    fixture
        .server
        .expect(requestTo(FALLBACK_LIST_URL))
        .andRespond(withSuccess("{\"relation_tuples\":[]}", MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(requestTo(FALLBACK_LIST_URL))
        .andRespond(withSuccess("{\"relation_tuples\":[]}", MediaType.APPLICATION_JSON));

    final boolean allowed = fixture.client.check(ownerCheck());
    final ListPage page =
        fixture.client.list(
            ListQuery.builder()
                .namespace("todos")
                .object("7")
                .relation("owner")
                .subjectId("user:u1")
                .pageSize(1)
                .build());

    assertThat(allowed).isFalse();
    assertThat(page.tuples()).isEmpty();
    fixture.server.verify();
  }

  @Test
  void fallbackFlattensSubjectSetWithoutRelation() {
    final ClientFixture fixture = newFixture();
    expectAllCandidatesNotFound(fixture);
    fixture
        .server
        .expect(
            requestTo(
                READ + "/relation-tuples?namespace=todos&object=7&relation=owner"
                    + "&subject_set=groups%3Ag1&page_size=1"))
        .andRespond(withSuccess("{\"relation_tuples\":[]}", MediaType.APPLICATION_JSON));

    final boolean allowed =
        fixture.client.check(
            new CheckQuery(
                "todos", "7", "owner", SubjectRef.set(new SubjectSet("groups", "g1", "")), null));

    assertThat(allowed).isFalse();
    fixture.server.verify();
  }

  @Test
  void checkReportsNoCheckEndpointWhenFallbackAlsoFails() {
    final ClientFixture fixture = newFixture();
    expectAllCandidatesNotFound(fixture);
    fixture.server.expect(requestTo(FALLBACK_LIST_URL)).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.check(ownerCheck()))
        .isInstanceOf(TupleStoreIntegrationException.class)
        .extracting(ex -> ((TupleStoreIntegrationException) ex).reason())
        .isEqualTo(TupleStoreIntegrationException.Reason.NO_CHECK_ENDPOINT);
    verify(fixture.metrics, never()).recordCheck(anyBoolean(), anyString());
  }

  @Test
  void checkUsesQueryParametersForGetCandidate() {
    final ClientFixture fixture =
        newFixture(List.of(new CheckEndpoint("GET", "/relation-tuples/check")));
    fixture
        .server
        .expect(
            requestTo(
                READ + "/relation-tuples/check?namespace=todos&object=7&relation=owner"
                    + "&subject_id=user%3Au1&max_depth=3"))
        .andExpect(method(GET))
        .andRespond(withSuccess("{\"allowed\":true}", MediaType.APPLICATION_JSON));

    final boolean allowed =
        fixture.client.check(
            new CheckQuery("todos", "7", "owner", SubjectRef.id("user:u1"), 3));

    assertThat(allowed).isTrue();
    fixture.server.verify();
  }

  @Test
  void checkMapsTimeoutToTimeoutException() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(READ + "/relation-tuples/check/openapi"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.check(ownerCheck()))
        .isInstanceOf(TupleStoreIntegrationException.class)
        .extracting(ex -> ((TupleStoreIntegrationException) ex).reason())
        .isEqualTo(TupleStoreIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void checkMapsMalformedBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(READ + "/relation-tuples/check/openapi"))
        .andRespond(withSuccess("{not-json", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.check(ownerCheck()))
        .isInstanceOf(TupleStoreIntegrationException.class)
        .extracting(ex -> ((TupleStoreIntegrationException) ex).reason())
        .isEqualTo(TupleStoreIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void listDecodesTuplesAndContinuationToken() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(
            requestTo(READ + "/relation-tuples?namespace=todos&relation=owner&page_size=1000"))
        .andRespond(
            withSuccess(
                """
                {"relation_tuples":[
                  {"namespace":"todos","object":"1","relation":"owner","subject_id":"user:a"},
                  {"namespace":"todos","object":"2","relation":"owner",
                   "subject_set":{"namespace":"groups","object":"g1","relation":"member"}}
                ],"next_page_token":"next-1"}
                """,
                MediaType.APPLICATION_JSON));

    final ListPage page =
        fixture.client.list(
            ListQuery.builder().namespace("todos").relation("owner").pageSize(1000).build());

    assertThat(page.tuples()).hasSize(2);
    assertThat(page.tuples().get(0).subject()).isEqualTo(SubjectRef.id("user:a"));
    assertThat(page.tuples().get(1).subject().subjectSet())
        .isEqualTo(new SubjectSet("groups", "g1", "member"));
    assertThat(page.nextPageToken()).isEqualTo("next-1");
  }

  @Test
  void listTreatsMissingCollectionAsEmptyPage() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(READ + "/relation-tuples?namespace=todos"))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    final ListPage page = fixture.client.list(ListQuery.builder().namespace("todos").build());

    assertThat(page.tuples()).isEmpty();
    assertThat(page.hasNextPage()).isFalse();
  }

  @Test
  void listMapsClientErrorToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(READ + "/relation-tuples?namespace=todos"))
        .andRespond(withStatus(HttpStatus.BAD_REQUEST));

    assertThatThrownBy(() -> fixture.client.list(ListQuery.builder().namespace("todos").build()))
        .isInstanceOf(TupleStoreIntegrationException.class)
        .extracting(ex -> ((TupleStoreIntegrationException) ex).reason())
        .isEqualTo(TupleStoreIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void expandBuildsRecursiveTree() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(
            requestTo(READ + "/relation-tuples/expand?namespace=todos&object=5&relation=owner"))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                """
                {"type":"union",
                 "subject_set":{"namespace":"todos","object":"5","relation":"owner"},
                 "children":[
                   {"type":"leaf","tuple":{"namespace":"todos","object":"5","relation":"owner",
                     "subject_id":"user:a"}}
                 ]}
                """,
                MediaType.APPLICATION_JSON));

    final SubjectTree tree = fixture.client.expand("todos", "5", "owner", null);

    assertThat(tree.type()).isEqualTo("union");
    assertThat(tree.subject().subjectSet()).isEqualTo(new SubjectSet("todos", "5", "owner"));
    assertThat(tree.children()).hasSize(1);
    assertThat(tree.children().get(0).type()).isEqualTo("leaf");
    assertThat(tree.children().get(0).subject()).isEqualTo(SubjectRef.id("user:a"));
  }

  @Test
  void expandMapsServerErrorToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(
            requestTo(
                READ + "/relation-tuples/expand?namespace=todos&object=5&relation=owner"
                    + "&max_depth=2"))
        .andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.expand("todos", "5", "owner", 2))
        .isInstanceOf(TupleStoreIntegrationException.class)
        .extracting(ex -> ((TupleStoreIntegrationException) ex).reason())
        .isEqualTo(TupleStoreIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void createTupleIsIdempotentWhenTupleAlreadyExists() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(WRITE + "/relation-tuples"))
        .andExpect(method(PUT))
        .andExpect(
            content()
                .json(
                    """
                    {"namespace":"todos","object":"9","relation":"owner","subject_id":"user:u1"}
                    """))
        .andRespond(withStatus(HttpStatus.CREATED));
    fixture
        .server
        .expect(requestTo(WRITE + "/relation-tuples"))
        .andExpect(method(PUT))
        .andRespond(withStatus(HttpStatus.CONFLICT));

    fixture.client.createTuple("todos", "9", "owner", "user:u1");
    fixture.client.createTuple("todos", "9", "owner", "user:u1");

    fixture.server.verify();
  }

  @Test
  void createTupleMapsServerErrorToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(WRITE + "/relation-tuples")).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.createTuple("todos", "9", "owner", "user:u1"))
        .isInstanceOf(TupleStoreIntegrationException.class)
        .extracting(ex -> ((TupleStoreIntegrationException) ex).reason())
        .isEqualTo(TupleStoreIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void deleteTupleAcceptsNoContent() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(
            requestTo(
                WRITE + "/relation-tuples?namespace=todos&object=9&relation=owner"
                    + "&subject_id=user%3Au1"))
        .andExpect(method(DELETE))
        .andRespond(withStatus(HttpStatus.NO_CONTENT));

    fixture.client.deleteTuple("todos", "9", "owner", "user:u1");

    fixture.server.verify();
  }

  @Test
  void deleteTupleUsesSubjectSetFieldsForIndirectSubject() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(
            requestTo(
                WRITE + "/relation-tuples?namespace=todos&object=9&relation=owner"
                    + "&subject_set.namespace=groups&subject_set.object=g1"
                    + "&subject_set.relation=member"))
        .andExpect(method(DELETE))
        .andRespond(withStatus(HttpStatus.NO_CONTENT));

    fixture.client.deleteTuple(
        new RelationTuple(
            "todos", "9", "owner", SubjectRef.set(new SubjectSet("groups", "g1", "member"))));

    fixture.server.verify();
  }

  @Test
  void deleteTupleMapsForbiddenToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(
            requestTo(
                WRITE + "/relation-tuples?namespace=todos&object=9&relation=owner"
                    + "&subject_id=user%3Au1"))
        .andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertThatThrownBy(() -> fixture.client.deleteTuple("todos", "9", "owner", "user:u1"))
        .isInstanceOf(TupleStoreIntegrationException.class)
        .extracting(ex -> ((TupleStoreIntegrationException) ex).reason())
        .isEqualTo(TupleStoreIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void listEncodesReservedCharactersInSubjectId() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(
            requestTo(
                READ + "/relation-tuples?namespace=todos&relation=owner"
                    + "&subject_id=user%3Aa%2Bb%26c%3Dd"))
        .andExpect(method(GET))
        .andRespond(withSuccess("{\"relation_tuples\":[]}", MediaType.APPLICATION_JSON));

    final ListPage page =
        fixture.client.list(
            ListQuery.builder()
                .namespace("todos")
                .relation("owner")
                .subjectId("user:a+b&c=d")
                .build());

    assertThat(page.tuples()).isEmpty();
    fixture.server.verify();
  }

  @Test
  void listTreatsBracesInSubjectIdAsLiteralText() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(
            requestTo(
                READ + "/relation-tuples?namespace=todos&relation=owner"
                    + "&subject_id=user%3A%7Bx%7D"))
        .andRespond(withSuccess("{\"relation_tuples\":[]}", MediaType.APPLICATION_JSON));

    final ListPage page =
        fixture.client.list(
            ListQuery.builder().namespace("todos").relation("owner").subjectId("user:{x}").build());

    assertThat(page.tuples()).isEmpty();
    fixture.server.verify();
  }

  @Test
  void fallbackCheckEncodesPlusInSubjectId() {
    final ClientFixture fixture = newFixture();
    expectAllCandidatesNotFound(fixture);
    fixture
        .server
        .expect(
            requestTo(
                READ + "/relation-tuples?namespace=todos&object=7&relation=owner"
                    + "&subject_id=user%3Aa%2Bb&page_size=1"))
        .andRespond(
            withSuccess(
                """
                {"relation_tuples":[
                  {"namespace":"todos","object":"7","relation":"owner","subject_id":"user:a+b"}
                ]}
                """,
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.check(CheckQuery.of("todos", "7", "owner", "user:a+b"))).isTrue();
    fixture.server.verify();
  }

  @Test
  void deleteTupleEncodesBracesAndPlusInSubjectId() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(
            requestTo(
                WRITE + "/relation-tuples?namespace=todos&object=9&relation=owner"
                    + "&subject_id=user%3A%7Ba%2Bb%7D"))
        .andExpect(method(DELETE))
        .andRespond(withStatus(HttpStatus.NO_CONTENT));

    fixture.client.deleteTuple("todos", "9", "owner", "user:{a+b}");

    fixture.server.verify();
  }

  @Test
  void deleteTupleWrapsUnexpectedFailureAsInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(method(DELETE))
        .andRespond(
            request -> {
              throw new IllegalStateException("connection pool closed");
            });

    assertThatThrownBy(() -> fixture.client.deleteTuple("todos", "9", "owner", "user:u1"))
        .isInstanceOf(TupleStoreIntegrationException.class)
        .extracting(ex -> ((TupleStoreIntegrationException) ex).reason())
        .isEqualTo(TupleStoreIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void createTupleWrapsUnexpectedFailureAsInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(method(PUT))
        .andRespond(
            request -> {
              throw new IllegalStateException("connection pool closed");
            });

    assertThatThrownBy(() -> fixture.client.createTuple("todos", "9", "owner", "user:u1"))
        .isInstanceOf(TupleStoreIntegrationException.class)
        .extracting(ex -> ((TupleStoreIntegrationException) ex).reason())
        .isEqualTo(TupleStoreIntegrationException.Reason.INVALID_RESPONSE);
  }

  private CheckQuery ownerCheck() {
    return CheckQuery.of("todos", "7", "owner", "user:u1");
  }

  private void expectAllCandidatesNotFound(ClientFixture fixture) {
    for (CheckEndpoint endpoint : TupleStoreClientProperties.DEFAULT_CHECK_ENDPOINTS) {
      fixture
          .server
          .expect(requestTo(READ + endpoint.path()))
          .andRespond(withStatus(HttpStatus.NOT_FOUND));
    }
  }

  private ClientFixture newFixture() {
    return newFixture(null);
  }

  private ClientFixture newFixture(List<CheckEndpoint> checkEndpoints) {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient readClient = builder.baseUrl(READ).build();
    final RestClient writeClient = builder.baseUrl(WRITE).build();
    final TupleStoreClientProperties properties =
        new TupleStoreClientProperties(READ, WRITE, checkEndpoints, null, null, null);
    final OwnershipMetrics metrics = mock(OwnershipMetrics.class);
    return new ClientFixture(
        new TupleStoreClient(readClient, writeClient, properties, metrics), server, metrics);
  }

  private record ClientFixture(
      TupleStoreClient client, MockRestServiceServer server, OwnershipMetrics metrics) {}
}
