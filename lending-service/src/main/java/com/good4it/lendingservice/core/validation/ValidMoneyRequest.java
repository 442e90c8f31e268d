package com.good4it.lendingservice.core.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = MoneyRequestValidator.class)
@Documented
public @interface ValidMoneyRequest {

    String message() default "EMI details must be given for EMI requests and only for them";
    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};

}
