package com.mainframe.analyzer.impact;

import lombok.Value;

import java.util.List;

@Value
public class ImpactMetrics {

    static final ImpactMetrics NONE = of(List.of());

    int totalImpacted;
    int highRiskChanges;
    int estimatedTestingEffortHours;
    String recommendedApproach;

    public static ImpactMetrics of(List<ImpactedItem> items) {
        int highRisk = 0;
        double weight = 0;
        for (ImpactedItem item : items) {
            if (item.getSeverity().isHighRisk()) {
                highRisk++;
            }
            weight += item.getSeverity().getTestingWeight();
        }
        int effort = (int) Math.ceil(2 * (1 + weight));
        return new ImpactMetrics(items.size(), highRisk, effort, recommend(items.size(), highRisk));
    }

    static String recommend(int total, int highRisk) {
        if (highRisk > 5) {
            return "Phased rollout with extensive testing";
        }
        if (total > 10) {
            return "Coordinated deployment with regression testing";
        }
        if (total > 3) {
            return "Standard testing with impact verification";
        }
        return "Standard deployment process";
    }
}
