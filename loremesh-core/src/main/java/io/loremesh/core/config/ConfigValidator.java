package io.loremesh.core.config;

import io.loremesh.core.config.model.AdvisorConfig;
import io.loremesh.core.config.model.AgentConfig;
import io.loremesh.core.config.model.FederationConfig;
import io.loremesh.core.config.model.LoremeshConfig;
import io.loremesh.core.config.model.RoutingConfig;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

final class ConfigValidator {

    List<String> problems(LoremeshConfig config) {
        List<String> problems = new ArrayList<>();
        if (config.federation() == null || config.routing() == null || config.advisor() == null) {
            problems.add("federation, routing and advisor sections must not be null");
            return problems;
        }
        checkFederation(config.federation(), problems);
        checkRouting(config.routing(), problems);
        checkAdvisor(config.advisor(), problems);
        return problems;
    }

    private void checkFederation(FederationConfig federation, List<String> problems) {
        if (federation.retention() <= 0) {
            problems.add("federation.retention must be positive, was " + federation.retention());
        }
        double margin = federation.confidenceMargin();
        if (Double.isNaN(margin) || margin < 0.0 || margin > 1.0) {
            problems.add("federation.confidenceMargin must be within [0, 1], was " + margin);
        }
    }

    private void checkRouting(RoutingConfig routing, List<String> problems) {
        if (routing.retention() <= 0) {
            problems.add("routing.retention must be positive, was " + routing.retention());
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < routing.agents().size(); i++) {
            AgentConfig agent = routing.agents().get(i);
            String at = "routing.agents[" + i + "]";
            if (agent == null || agent.name() == null || agent.name().isBlank()) {
                problems.add(at + " has no name");
                continue;
            }
            if (!seen.add(agent.name().trim().toLowerCase(Locale.ROOT))) {
                problems.add(at + " repeats agent name " + agent.name().trim());
            }
            if (agent.load() < 0) {
                problems.add(at + " (" + agent.name().trim() + ") has negative load " + agent.load());
            }
        }
    }

    private void checkAdvisor(AdvisorConfig advisor, List<String> problems) {
        if (advisor.timeoutSeconds() <= 0) {
            problems.add("advisor.timeoutSeconds must be positive, was " + advisor.timeoutSeconds());
        }
        if (advisor.queueCapacity() <= 0) {
            problems.add("advisor.queueCapacity must be positive, was " + advisor.queueCapacity());
        }
    }
}
