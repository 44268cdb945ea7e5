package com.tasknest.todoservice.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial update: null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TodoUpdateRequest {

    @Size(min = 1, max = 255, message = "title must be 1 to 255 characters")
    private String title;

    @Size(max = 2000, message = "description must be <= 2000 characters")
    private String description;

    private Boolean completed;
}
