package com.tasknest.todoservice.service;

import com.tasknest.todoservice.dto.TodoCreateRequest;
import com.tasknest.todoservice.dto.TodoResponse;
import com.tasknest.todoservice.dto.TodoUpdateRequest;
import com.tasknest.todoservice.entity.User;

import java.util.List;

/**
 * Todo CRUD restricted to the owner's own items. An item owned by somebody
 * else is reported exactly like a missing one.
 */
public interface TodoService {

    TodoResponse create(User owner, TodoCreateRequest request);

    List<TodoResponse> list(User owner);

    TodoResponse get(User owner, Long id);

    List<TodoResponse> findByTitle(User owner, String title);

    TodoResponse update(User owner, Long id, TodoUpdateRequest request);

    void delete(User owner, Long id);
}
