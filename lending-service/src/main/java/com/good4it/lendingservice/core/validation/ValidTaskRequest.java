package com.good4it.lendingservice.core.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = TaskRequestValidator.class)
@Documented
public @interface ValidTaskRequest {

    String message() default "Invalid task for the selected repayment mode";
    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};

}
