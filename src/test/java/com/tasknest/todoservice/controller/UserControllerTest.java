package com.tasknest.todoservice.controller;

import com.tasknest.todoservice.dto.UserSummary;
import com.tasknest.todoservice.entity.User;
import com.tasknest.todoservice.exception.GlobalExceptionHandler;
import com.tasknest.todoservice.service.UserService;
import com.tasknest.todoservice.utils.ErrorResponseWriter;
import com.tasknest.todoservice.utils.SuccessEnvelopeAdvice;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class UserControllerTest {

    @Mock
    private UserService userService;

    private MockMvc mockMvc;

    private final User alice = User.builder().id(UUID.randomUUID()).username("alice").email("alice@x.com").password("h").build();

    @BeforeEach
    void setUp() {
        ErrorResponseWriter writer = new ErrorResponseWriter(Jackson2ObjectMapperBuilder.json().build());
        mockMvc = MockMvcBuilders.standaloneSetup(new UserController(userService))
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

    @Test
    @DisplayName("GET /users/me returns the caller's account")
    void me() throws Exception {
        when(userService.whoAmI(alice)).thenReturn(UserSummary.from(alice));

        mockMvc.perform(MockMvcRequestBuilders.get("/users/me"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.username").value("alice"))
                .andExpect(jsonPath("$.data.password").doesNotExist());
    }

    @Test
    @DisplayName("DELETE /users/me deletes the caller's account")
    void deleteMe() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.delete("/users/me"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.message").value("User deleted"));

        verify(userService).deleteAccount(alice);
    }
}
