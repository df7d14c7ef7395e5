package com.makeithappen.backend.goals.service;

import com.makeithappen.backend.goals.dto.GoalDtos;
import com.makeithappen.backend.goals.model.FocusArea;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Goal dump flow. The model call runs before the transaction opens so no connection
 * is held while waiting on the provider.
 */
@RequiredArgsConstructor
@Service
public class GoalIntakeService {

    private final FocusAreaAnalyzer analyzer;
    private final PlanService plans;

    public GoalDtos.GoalDumpResponse dump(String userId, GoalDtos.GoalDumpRequest req) {
        List<FocusArea> areas = analyzer.analyze(req.text(), req.timeline());
        if (areas.isEmpty()) areas = FocusAreaAnalyzer.fallbackFocusAreas();

        return plans.createPlan(userId, req.text(), req.images(), req.timeline(), areas);
    }
}
