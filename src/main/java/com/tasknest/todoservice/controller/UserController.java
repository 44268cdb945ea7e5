package com.tasknest.todoservice.controller;

import com.tasknest.todoservice.dto.MessageResponse;
import com.tasknest.todoservice.dto.UserSummary;
import com.tasknest.todoservice.entity.User;
import com.tasknest.todoservice.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
@Tag(name = "users")
public class UserController {

    private final UserService userService;

    @GetMapping("/me")
    @Operation(summary = "The account behind the access token")
    public ResponseEntity<UserSummary> me(@AuthenticationPrincipal User current) {
        return ResponseEntity.ok(userService.whoAmI(current));
    }

    @DeleteMapping("/me")
    @Operation(summary = "Delete the account and all of its todos")
    public ResponseEntity<MessageResponse> delete(@AuthenticationPrincipal User current) {
        userService.deleteAccount(current);
        return ResponseEntity.ok(new MessageResponse("User deleted"));
    }
}
