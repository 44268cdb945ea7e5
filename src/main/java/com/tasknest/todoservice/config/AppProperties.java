package com.tasknest.todoservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /** Base URL used when building verification and reset links. */
    private String publicBaseUrl = "http://localhost:8080";

    private Mail mail = new Mail();

    @Getter
    @Setter
    public static class Mail {
        private String from = "no-reply@tasknest.dev";
    }
}
