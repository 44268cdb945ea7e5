package com.tasknest.todoservice.service;

import com.tasknest.todoservice.dto.UserSummary;
import com.tasknest.todoservice.entity.User;

public interface UserService {

    UserSummary whoAmI(User current);

    /** Delete the account together with every todo it owns. */
    void deleteAccount(User current);
}
