package com.tasknest.todoservice.controller;

import com.tasknest.todoservice.dto.MessageResponse;
import com.tasknest.todoservice.dto.TodoCreateRequest;
import com.tasknest.todoservice.dto.TodoResponse;
import com.tasknest.todoservice.dto.TodoUpdateRequest;
import com.tasknest.todoservice.entity.User;
import com.tasknest.todoservice.service.TodoService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/todos")
@RequiredArgsConstructor
@Tag(name = "todos", description = "The caller's own todo items")
public class TodoController {

    private final TodoService todoService;

    @PostMapping
    public ResponseEntity<TodoResponse> create(@AuthenticationPrincipal User current,
                                               @Valid @RequestBody TodoCreateRequest request) {
        TodoResponse created = todoService.create(current, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .location(URI.create("/todos/" + created.getId()))
                .body(created);
    }

    @GetMapping
    public ResponseEntity<List<TodoResponse>> list(@AuthenticationPrincipal User current) {
        return ResponseEntity.ok(todoService.list(current));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TodoResponse> get(@AuthenticationPrincipal User current,
                                            @PathVariable("id") Long id) {
        return ResponseEntity.ok(todoService.get(current, id));
    }

    @GetMapping("/search")
    public ResponseEntity<List<TodoResponse>> search(@AuthenticationPrincipal User current,
                                                     @RequestParam("title") String title) {
        return ResponseEntity.ok(todoService.findByTitle(current, title));
    }

    @PutMapping("/{id}")
    public ResponseEntity<TodoResponse> update(@AuthenticationPrincipal User current,
                                               @PathVariable("id") Long id,
                                               @Valid @RequestBody TodoUpdateRequest request) {
        return ResponseEntity.ok(todoService.update(current, id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> delete(@AuthenticationPrincipal User current,
                                                  @PathVariable("id") Long id) {
        todoService.delete(current, id);
        return ResponseEntity.ok(new MessageResponse("Todo deleted"));
    }
}
