package com.tasknest.todoservice.controller;

import com.tasknest.todoservice.dto.TodoResponse;
import com.tasknest.todoservice.dto.TodoUpdateRequest;
import com.tasknest.todoservice.entity.User;
import com.tasknest.todoservice.exception.GlobalExceptionHandler;
import com.tasknest.todoservice.exception.ResourceExceptions;
import com.tasknest.todoservice.service.TodoService;
import com.tasknest.todoservice.utils.ErrorResponseWriter;
import com.tasknest.todoservice.utils.SuccessEnvelopeAdvice;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class TodoControllerTest {

    @Mock
    private TodoService todoService;

    private MockMvc mockMvc;

    private final User alice = User.builder().id(UUID.randomUUID()).username("alice").email("alice@x.com").password("h").build();

    @BeforeEach
    void setUp() {
        ErrorResponseWriter writer = new ErrorResponseWriter(Jackson2ObjectMapperBuilder.json().build());
        mockMvc = MockMvcBuilders.standaloneSetup(new TodoController(todoService))
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .setControllerAdvice(new GlobalExceptionHandler(writer), new SuccessEnvelopeAdvice())
                .build();
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(alice, null, alice.getAuthorities()));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private static TodoResponse todo(long id, String title, boolean completed) {
        return TodoResponse.builder().id(id).title(title).description("d").completed(completed).build();
    }

    @Test
    @DisplayName("POST /todos creates a todo for the caller")
    void create() throws Exception {
        when(todoService.create(same(alice), any())).thenReturn(todo(7, "milk", false));

        mockMvc.perform(post("/todos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"milk\",\"description\":\"2 litres\"}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/todos/7"))
                .andExpect(jsonPath("$.data.id").value(7))
                .andExpect(jsonPath("$.data.completed").value(false));
    }

    @Test
    @DisplayName("POST /todos without a title is a 422")
    void createWithoutTitle() throws Exception {
        mockMvc.perform(post("/todos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"no title\"}"))
                .andExpect(status().isUnprocessableEntity());

        verifyNoInteractions(todoService);
    }

    @Test
    @DisplayName("GET /todos lists the caller's todos")
    void list() throws Exception {
        when(todoService.list(alice)).thenReturn(List.of(todo(1, "a", false), todo(2, "b", true)));

        mockMvc.perform(get("/todos"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[1].title").value("b"));
    }

    @Test
    @DisplayName("GET /todos/{id} of a missing or foreign todo is a 404")
    void notFound() throws Exception {
        when(todoService.get(alice, 42L)).thenThrow(new ResourceExceptions.NotFound("Todo 42 not found."));

        mockMvc.perform(get("/todos/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Resource Not Found"));
    }

    @Test
    @DisplayName("GET /todos/{id} with a non-numeric id is a 400")
    void badId() throws Exception {
        mockMvc.perform(get("/todos/abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /todos/search matches by title")
    void search() throws Exception {
        when(todoService.findByTitle(alice, "milk")).thenReturn(List.of(todo(5, "milk", false)));

        mockMvc.perform(get("/todos/search").param("title", "milk"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value(5));
    }

    @Test
    @DisplayName("PUT /todos/{id} forwards only the sent fields")
    void update() throws Exception {
        when(todoService.update(same(alice), eq(3L), any())).thenReturn(todo(3, "old", true));

        mockMvc.perform(put("/todos/3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"completed\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.completed").value(true));

        ArgumentCaptor<TodoUpdateRequest> sent = ArgumentCaptor.forClass(TodoUpdateRequest.class);
        verify(todoService).update(same(alice), eq(3L), sent.capture());
        assertThat(sent.getValue().getTitle()).isNull();
        assertThat(sent.getValue().getCompleted()).isTrue();
    }

    @Test
    @DisplayName("DELETE /todos/{id} removes the todo")
    void remove() throws Exception {
        mockMvc.perform(delete("/todos/4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.message").value("Todo deleted"));

        verify(todoService).delete(alice, 4L);
    }
}
