package com.good4it.lendingservice.core.validation;

import com.good4it.lendingservice.dto.CreateTaskRequest;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class TaskRequestValidator implements ConstraintValidator<ValidTaskRequest, CreateTaskRequest> {

    @Override
    public boolean isValid(CreateTaskRequest request, ConstraintValidatorContext context) {
        if (request == null) {
            return true;
        }

        if (request.emiTask()) {
            if (request.emiForgiveness() == null) {
                return buildError(context, "emiForgiveness", "EMI tasks must say how many EMIs they forgive");
            }
            return true;
        }

        if (request.monetaryValue() == null || request.monetaryValue().signum() <= 0) {
            return buildError(context, "monetaryValue", "Tasks that are not EMI tasks need a monetary value above zero");
        }

        return true;
    }

    private boolean buildError(ConstraintValidatorContext context, String node, String message) {
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(message)
                .addPropertyNode(node)
                .addConstraintViolation();
        return false;
    }
}
