package com.tasknest.todoservice.serviceImpl;

import com.tasknest.todoservice.dto.UserSummary;
import com.tasknest.todoservice.entity.User;
import com.tasknest.todoservice.exception.UserExceptions;
import com.tasknest.todoservice.repository.UserRepository;
import com.tasknest.todoservice.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private final UserRepository userRepository;

    @Override
    public UserSummary whoAmI(User current) {
        return UserSummary.from(current);
    }

    @Override
    @Transactional
    public void deleteAccount(User current) {
        // re-read inside the transaction so the todos cascade is managed
        User managed = userRepository.findById(current.getId())
                .orElseThrow(() -> new UserExceptions.UserNotFound("Account no longer exists."));
        userRepository.delete(managed);
        log.info("Deleted account username={}", managed.getUsername());
    }
}
