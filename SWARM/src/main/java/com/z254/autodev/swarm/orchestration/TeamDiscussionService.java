package com.z254.autodev.swarm.orchestration;

import com.z254.autodev.swarm.config.SwarmProperties;
import com.z254.autodev.swarm.domain.model.ComplexityVector;
import com.z254.autodev.swarm.llm.ChatMessage;
import com.z254.autodev.swarm.memory.CoordinationHooks;
import com.z254.autodev.swarm.resilience.InvocationRequest;
import com.z254.autodev.swarm.resilience.ResilientInvocationClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs a moderated multi-round discussion between participant roles.
 * Each participant speaks once per round and sees everything said before it.
 */
@Slf4j
@Service
public class TeamDiscussionService {

    static final ComplexityVector DISCUSSION_COMPLEXITY = ComplexityVector.of(0.3, 0.7, 0.6, 0.5);

    private final ResilientInvocationClient invocationClient;
    private final CoordinationHooks hooks;
    private final int defaultRounds;

    public TeamDiscussionService(ResilientInvocationClient invocationClient,
                                 CoordinationHooks hooks,
                                 SwarmProperties properties) {
        this.invocationClient = invocationClient;
        this.hooks = hooks;
        this.defaultRounds = properties.getOrchestration().getDiscussionRounds();
    }

    public Mono<String> discuss(String topic, List<String> participants) {
        return discuss(topic, participants, defaultRounds);
    }

    /**
     * @return Markdown transcript of the discussion
     */
    public Mono<String> discuss(String topic, List<String> participants, int rounds) {
        if (topic == null || topic.isBlank()) {
            return Mono.error(new IllegalArgumentException("Discussion topic must not be blank"));
        }
        if (participants == null || participants.isEmpty()) {
            return Mono.error(new IllegalArgumentException("A discussion needs at least one participant"));
        }
        if (rounds < 1) {
            return Mono.error(new IllegalArgumentException("rounds must be at least 1: " + rounds));
        }
        return Mono.defer(() -> {
            String discussionId = "discussion_" + UUID.randomUUID();
            hooks.preTask(discussionId, "Team discussion on: " + topic);
            StringBuilder transcript = new StringBuilder("# Team Discussion: ").append(topic).append("\n\n");
            List<String> context = new ArrayList<>();

            return Flux.range(1, rounds)
                    .concatMap(round -> {
                        transcript.append("## Round ").append(round).append("\n\n");
                        return Flux.fromIterable(participants)
                                .concatMap(participant -> speak(topic, participant, context)
                                        .doOnNext(contribution -> {
                                            transcript.append("**").append(participant).append("**: ")
                                                    .append(contribution).append("\n\n");
                                            context.add(participant + " said: " + contribution);
                                        }));
                    })
                    .then(Mono.fromCallable(() -> {
                        hooks.postTask(discussionId, "completed");
                        log.info("Discussion {} on '{}' finished after {} rounds", discussionId, topic, rounds);
                        return transcript.toString();
                    }))
                    .doOnError(error -> hooks.postTask(discussionId, "failed"));
        });
    }

    private Mono<String> speak(String topic, String participant, List<String> context) {
        return Mono.defer(() -> invocationClient.invoke(InvocationRequest.builder()
                        .messages(List.of(
                                ChatMessage.system("You are a " + participant
                                        + " participating in a team discussion. Previous context: "
                                        + String.join(". ", context)),
                                ChatMessage.user("Discuss: " + topic
                                        + ". Keep your response concise and relevant to your role.")))
                        .taskDescription("Team discussion participation as " + participant)
                        .complexity(DISCUSSION_COMPLEXITY)
                        .build()))
                .map(response -> response.getContent() != null ? response.getContent() : "");
    }
}
