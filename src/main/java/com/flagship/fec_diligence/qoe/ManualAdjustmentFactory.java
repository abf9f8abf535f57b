package com.flagship.fec_diligence.qoe;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Validates and creates manual QoE adjustments.
 *
 * Manual adjustments are entered by an analyst: they are HIGH confidence and
 * validated on creation.
 */
@Slf4j
@Component
public class ManualAdjustmentFactory {

    private final Validator validator;

    @Autowired
    public ManualAdjustmentFactory(Validator validator) {
        this.validator = validator;
    }

    public ManualAdjustmentFactory() {
        this(defaultValidator());
    }

    /**
     * Constraint violations keyed by field name, empty when the request is valid.
     */
    public Map<String, String> validate(ManualAdjustmentRequest request) {
        Map<String, String> errors = new TreeMap<>();
        if (request == null) {
            errors.put("request", "Request is required");
            return errors;
        }
        Set<ConstraintViolation<ManualAdjustmentRequest>> violations = validator.validate(request);
        for (ConstraintViolation<ManualAdjustmentRequest> violation : violations) {
            errors.merge(violation.getPropertyPath().toString(), violation.getMessage(), (a, b) -> a + "; " + b);
        }
        return errors;
    }

    /**
     * @throws IllegalArgumentException if the request violates a constraint
     */
    public QoeAdjustment create(ManualAdjustmentRequest request) {
        Map<String, String> errors = validate(request);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid manual adjustment: " + errors);
        }
        log.debug("Manual {} adjustment for {}: {}", request.getType(), request.getFiscalYear(), request.getImpactEbitda());
        return QoeAdjustment.builder()
            .id(UUID.randomUUID())
            .type(request.getType())
            .label(request.getLabel().trim())
            .description(request.getDescription())
            .fiscalYear(request.getFiscalYear())
            .impactEbitda(request.getImpactEbitda())
            .impactResultatNet(request.getImpactResultatNet())
            .confidence(ConfidenceTier.HIGH)
            .source(AdjustmentSource.MANUAL)
            .validated(true)
            .validatedAt(Instant.now())
            .build();
    }

    private static Validator defaultValidator() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        return factory.getValidator();
    }
}
