package com.tasknest.todoservice.repository;

import com.tasknest.todoservice.entity.Todo;
import com.tasknest.todoservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/** Every finder is scoped to an owner; there is no cross-account lookup. */
public interface TodoRepository extends JpaRepository<Todo, Long> {

    List<Todo> findAllByOwnerOrderByCreatedAtAsc(User owner);

    Optional<Todo> findByIdAndOwner(Long id, User owner);

    List<Todo> findAllByOwnerAndTitle(User owner, String title);
}
