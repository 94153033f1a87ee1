/*
 * どこで: todo-authz API DTO
 * 何を: expand の結果ツリーを管理者向けに返す
 * なぜ: 誰がどの経路で所有者になっているかを運用時に確認できるようにするため
 */
package com.example.todo_authz.api.response;

import com.example.todo_authz.model.SubjectRef;
import com.example.todo_authz.model.SubjectTree;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "JSON DTO record はシリアライズ用途であり、防御的コピーよりも契約互換性を優先するため")
public record SubjectTreeResponse(
    String type, String subjectId, String subjectSet, List<SubjectTreeResponse> children) {

  public static SubjectTreeResponse from(SubjectTree tree) {
    final SubjectRef subject = tree.subject();
    final String subjectId = subject == null || subject.isSet() ? null : subject.subjectId();
    final String subjectSet =
        subject == null || !subject.isSet() ? null : subject.subjectSet().toFilterValue();
    return new SubjectTreeResponse(
        tree.type(),
        subjectId,
        subjectSet,
        tree.children().stream().map(SubjectTreeResponse::from).toList());
  }
}
