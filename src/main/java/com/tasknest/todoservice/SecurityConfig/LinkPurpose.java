package com.tasknest.todoservice.SecurityConfig;

/** What an emailed link authorises. Each purpose signs with its own key. */
public enum LinkPurpose {
    EMAIL_VERIFICATION("verify-email"),
    PASSWORD_RESET("reset-password");

    private final String namespace;

    LinkPurpose(String namespace) {
        this.namespace = namespace;
    }

    public String namespace() {
        return namespace;
    }
}
