package com.example.todo_authz.service;

import com.example.todo_authz.model.Todo;
import com.example.todo_authz.model.TodoPatch;
import java.util.Collection;
import java.util.List;

/**
 * todo 行の保存先。所有関係は保持せず、行データだけを扱う。
 *
 * <p>一覧はいずれも作成日時の降順で返す。
 */
public interface TodoRecordStore {

  List<Todo> findByIds(Collection<Long> ids);

  List<Todo> findAll();

  Todo create(String title);

  /** 対象行が無い場合は {@link TodoNotFoundException}。 */
  Todo update(long id, TodoPatch patch);

  /** 対象行が無い場合は {@link TodoNotFoundException}。 */
  void delete(long id);
}
