package com.example.todo_authz.model;

import java.util.List;

public record ListPage(List<RelationTuple> tuples, String nextPageToken) {

  public ListPage {
    tuples = tuples == null ? List.of() : List.copyOf(tuples);
    nextPageToken = nextPageToken == null || nextPageToken.isBlank() ? null : nextPageToken;
  }

  public boolean hasNextPage() {
    return nextPageToken != null;
  }
}
