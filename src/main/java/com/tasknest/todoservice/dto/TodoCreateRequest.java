package com.tasknest.todoservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TodoCreateRequest {

    @NotBlank(message = "title is required")
    @Size(max = 255, message = "title must be <= 255 characters")
    private String title;

    @Size(max = 2000, message = "description must be <= 2000 characters")
    private String description;

    @Builder.Default
    private boolean completed = false;
}
