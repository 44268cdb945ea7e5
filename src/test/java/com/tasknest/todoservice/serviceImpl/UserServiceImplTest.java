package com.tasknest.todoservice.serviceImpl;

import com.tasknest.todoservice.entity.User;
import com.tasknest.todoservice.entity.UserRole;
import com.tasknest.todoservice.exception.UserExceptions;
import com.tasknest.todoservice.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceImplTest {

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private UserServiceImpl userService;

    private final User alice = User.builder()
            .id(UUID.randomUUID())
            .username("alice")
            .email("alice@x.com")
            .password("digest")
            .role(UserRole.ROLE_USER)
            .build();

    @Test
    @DisplayName("whoAmI exposes the account without its password")
    void whoAmI() {
        var summary = userService.whoAmI(alice);

        assertThat(summary.getUsername()).isEqualTo("alice");
        assertThat(summary.getEmail()).isEqualTo("alice@x.com");
        assertThat(summary.getRole()).isEqualTo("ROLE_USER");
        assertThat(summary.toString()).doesNotContain("digest");
    }

    @Test
    @DisplayName("deleteAccount removes the managed account")
    void delete() {
        when(userRepository.findById(alice.getId())).thenReturn(Optional.of(alice));

        userService.deleteAccount(alice);

        verify(userRepository).delete(alice);
    }

    @Test
    @DisplayName("deleting an account that is already gone is not found")
    void alreadyGone() {
        when(userRepository.findById(alice.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.deleteAccount(alice)).isInstanceOf(UserExceptions.UserNotFound.class);
        verify(userRepository, never()).delete(any());
    }
}
