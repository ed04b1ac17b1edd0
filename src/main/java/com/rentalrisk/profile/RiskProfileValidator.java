package com.rentalrisk.profile;

import com.rentalrisk.error.ValidationException;
import com.rentalrisk.error.ValidationException.FieldError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class RiskProfileValidator {

    public void validate(RiskProfileDraft draft) {
        if (draft == null) {
            throw new ValidationException("risk profile is required");
        }
        List<FieldError> errors = new ArrayList<>();
        requireString(draft.productId(), "productId", errors);
        requireString(draft.categoryId(), "categoryId", errors);
        if (draft.riskLevel() == null) {
            errors.add(new FieldError("riskLevel", "riskLevel is required"));
        }
        validateRequirements(draft.mandatoryRequirements(), errors);
        validateEntries(draft.riskFactors(), "riskFactors", errors);
        validateEntries(draft.mitigationStrategies(), "mitigationStrategies", errors);
        validateGracePeriod(draft.gracePeriodHours(), errors);
        throwIfAny(errors);
    }

    public void validate(RiskProfilePatch patch) {
        if (patch == null) {
            throw new ValidationException("risk profile update is required");
        }
        List<FieldError> errors = new ArrayList<>();
        validateRequirements(patch.mandatoryRequirements(), errors);
        validateEntries(patch.riskFactors(), "riskFactors", errors);
        validateEntries(patch.mitigationStrategies(), "mitigationStrategies", errors);
        validateGracePeriod(patch.gracePeriodHours(), errors);
        throwIfAny(errors);
    }

    private void validateRequirements(MandatoryRequirements requirements, List<FieldError> errors) {
        if (requirements == null) {
            return;
        }
        if (requirements.minCoverage().signum() < 0) {
            errors.add(new FieldError("mandatoryRequirements.minCoverage", "minCoverage must be >= 0"));
        }
        if (requirements.complianceDeadlineHours() < 1) {
            errors.add(new FieldError("mandatoryRequirements.complianceDeadlineHours",
                "complianceDeadlineHours must be >= 1"));
        }
        if (requirements.inspectionTypes().stream().anyMatch(t -> t == null || t.isBlank())) {
            errors.add(new FieldError("mandatoryRequirements.inspectionTypes",
                "inspectionTypes must not contain blank entries"));
        }
    }

    private void validateEntries(List<String> entries, String field, List<FieldError> errors) {
        if (entries != null && entries.stream().anyMatch(e -> e == null || e.isBlank())) {
            errors.add(new FieldError(field, field + " must not contain blank entries"));
        }
    }

    private void validateGracePeriod(Integer gracePeriodHours, List<FieldError> errors) {
        if (gracePeriodHours != null && gracePeriodHours < 0) {
            errors.add(new FieldError("gracePeriodHours", "gracePeriodHours must be >= 0"));
        }
    }

    private void requireString(String value, String field, List<FieldError> errors) {
        if (value == null || value.isBlank()) {
            errors.add(new FieldError(field, field + " is required"));
        }
    }

    private void throwIfAny(List<FieldError> errors) {
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
