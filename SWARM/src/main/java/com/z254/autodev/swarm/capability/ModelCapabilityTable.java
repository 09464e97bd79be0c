package com.z254.autodev.swarm.capability;

import com.z254.autodev.swarm.domain.model.ModelCapabilities;
import com.z254.autodev.swarm.error.UnknownProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only table of upstream model providers and their capability scores.
 * Iteration order is table order, which is also the tie-break order for provider ranking.
 */
@Component
@Slf4j
public class ModelCapabilityTable {

    private final Map<String, ModelCapabilities> models;

    public ModelCapabilityTable() {
        this(defaultModels());
    }

    public ModelCapabilityTable(List<ModelCapabilities> modelList) {
        Map<String, ModelCapabilities> table = new LinkedHashMap<>();
        for (ModelCapabilities model : modelList) {
            table.put(model.getProvider(), model);
        }
        this.models = Collections.unmodifiableMap(table);
        log.info("Registered {} model providers", table.size());
    }

    /**
     * @throws UnknownProviderException if the provider is not in the table
     */
    public ModelCapabilities get(String provider) {
        ModelCapabilities model = provider != null ? models.get(provider) : null;
        if (model == null) {
            throw new UnknownProviderException(provider);
        }
        return model;
    }

    public boolean contains(String provider) {
        return provider != null && models.containsKey(provider);
    }

    public List<ModelCapabilities> all() {
        return List.copyOf(models.values());
    }

    static List<ModelCapabilities> defaultModels() {
        return List.of(
                model("anthropic/claude-3.5-sonnet", 9.5, 9.8, 9.6, 8.8, 7.5, 3.0),
                model("anthropic/claude-3-haiku", 8.5, 8.7, 8.8, 7.5, 9.5, 9.0),
                model("openai/gpt-4-turbo", 9.2, 9.0, 9.3, 9.0, 8.0, 4.0),
                model("openai/gpt-3.5-turbo", 7.8, 8.2, 8.0, 7.5, 9.8, 9.5),
                model("google/palm-2-codechat-bison", 8.0, 9.5, 7.8, 6.5, 8.5, 7.0),
                model("meta-llama/codellama-34b-instruct", 7.5, 9.8, 7.2, 6.0, 8.8, 8.0)
        );
    }

    private static ModelCapabilities model(String provider, double reasoning, double coding, double analysis,
                                           double creativity, double speed, double cost) {
        return ModelCapabilities.builder()
                .provider(provider)
                .reasoning(reasoning)
                .coding(coding)
                .analysis(analysis)
                .creativity(creativity)
                .speed(speed)
                .cost(cost)
                .build();
    }
}
