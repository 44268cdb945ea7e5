package com.tasknest.todoservice.entity;

public enum UserRole {
    ROLE_USER,
    ROLE_ADMIN
}
