package com.rentalrisk.scoring;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryAssessmentHistory implements AssessmentHistory {

    private final CopyOnWriteArrayList<RiskAssessment> assessments = new CopyOnWriteArrayList<>();

    @Override
    public void record(RiskAssessment assessment) {
        assessments.add(assessment);
    }

    @Override
    public Optional<RiskAssessment> findById(String id) {
        return assessments.stream()
            .filter(a -> a.id().equals(id))
            .findFirst();
    }

    @Override
    public List<RiskAssessment> findAll() {
        return List.copyOf(assessments);
    }

    @Override
    public OptionalDouble averageScore() {
        return assessments.stream()
            .mapToInt(RiskAssessment::overallRiskScore)
            .average();
    }
}
