package com.tasknest.todoservice.utils;

import java.lang.annotation.*;

/** Message placed in the success envelope for a handler method or controller. */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResponseMessage {
    String value() default "OK";
}
