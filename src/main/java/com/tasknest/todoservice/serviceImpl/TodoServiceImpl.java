package com.tasknest.todoservice.serviceImpl;

import com.tasknest.todoservice.dto.TodoCreateRequest;
import com.tasknest.todoservice.dto.TodoResponse;
import com.tasknest.todoservice.dto.TodoUpdateRequest;
import com.tasknest.todoservice.entity.Todo;
import com.tasknest.todoservice.entity.User;
import com.tasknest.todoservice.exception.RequestExceptions;
import com.tasknest.todoservice.exception.ResourceExceptions;
import com.tasknest.todoservice.repository.TodoRepository;
import com.tasknest.todoservice.service.TodoService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class TodoServiceImpl implements TodoService {

    private final TodoRepository todoRepository;

    @Override
    @Transactional
    public TodoResponse create(User owner, TodoCreateRequest request) {
        Todo todo = Todo.builder()
                .title(request.getTitle())
                .description(request.getDescription())
                .completed(request.isCompleted())
                .owner(owner)
                .build();
        return TodoResponse.from(todoRepository.save(todo));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TodoResponse> list(User owner) {
        return todoRepository.findAllByOwnerOrderByCreatedAtAsc(owner).stream()
                .map(TodoResponse::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public TodoResponse get(User owner, Long id) {
        return TodoResponse.from(owned(owner, id));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TodoResponse> findByTitle(User owner, String title) {
        if (title == null || title.isBlank()) {
            throw new RequestExceptions.InvalidParameter("title must not be blank");
        }
        return todoRepository.findAllByOwnerAndTitle(owner, title).stream()
                .map(TodoResponse::from)
                .toList();
    }

    @Override
    @Transactional
    public TodoResponse update(User owner, Long id, TodoUpdateRequest request) {
        Todo todo = owned(owner, id);
        if (request.getTitle() != null) todo.setTitle(request.getTitle());
        if (request.getDescription() != null) todo.setDescription(request.getDescription());
        if (request.getCompleted() != null) todo.setCompleted(request.getCompleted());
        return TodoResponse.from(todoRepository.save(todo));
    }

    @Override
    @Transactional
    public void delete(User owner, Long id) {
        todoRepository.delete(owned(owner, id));
    }

    private Todo owned(User owner, Long id) {
        return todoRepository.findByIdAndOwner(id, owner)
                .orElseThrow(() -> new ResourceExceptions.NotFound("Todo " + id + " not found."));
    }
}
