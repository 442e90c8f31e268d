package com.good4it.lendingservice.core.validation;

import com.good4it.lendingservice.dto.CreateMoneyRequest;
import com.good4it.lendingservice.model.PaymentType;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class MoneyRequestValidator implements ConstraintValidator<ValidMoneyRequest, CreateMoneyRequest> {

    @Override
    public boolean isValid(CreateMoneyRequest request, ConstraintValidatorContext context) {
        if (request == null) {
            return true;
        }

        boolean emi = request.paymentTypeOrDefault() == PaymentType.EMI;

        if (emi && request.emiDetails() == null) {
            return buildError(context, "emiDetails", "EMI details are required for EMI requests");
        }

        if (!emi && request.emiDetails() != null) {
            return buildError(context, "emiDetails", "EMI details are only allowed for EMI requests");
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
