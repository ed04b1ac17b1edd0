package com.rentalrisk.scoring;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

public interface AssessmentHistory {

    void record(RiskAssessment assessment);

    Optional<RiskAssessment> findById(String id);

    List<RiskAssessment> findAll();

    OptionalDouble averageScore();
}
