package com.z254.autodev.swarm.orchestration;

import com.z254.autodev.swarm.config.SwarmProperties;
import com.z254.autodev.swarm.domain.model.Agent;
import com.z254.autodev.swarm.domain.model.AgentResult;
import com.z254.autodev.swarm.domain.model.ComplexityVector;
import com.z254.autodev.swarm.domain.model.ExecutionStrategy;
import com.z254.autodev.swarm.domain.model.SwarmTask;
import com.z254.autodev.swarm.domain.model.TaskOutcome;
import com.z254.autodev.swarm.domain.model.TaskPriority;
import com.z254.autodev.swarm.domain.model.TaskStatus;
import com.z254.autodev.swarm.domain.repository.TaskRepository;
import com.z254.autodev.swarm.error.InvocationTimeoutException;
import com.z254.autodev.swarm.error.ResourceExhaustedException;
import com.z254.autodev.swarm.error.SwarmException;
import com.z254.autodev.swarm.error.TaskExecutionFailedException;
import com.z254.autodev.swarm.error.TaskNotFoundException;
import com.z254.autodev.swarm.error.UnknownSwarmException;
import com.z254.autodev.swarm.memory.CoordinationHooks;
import com.z254.autodev.swarm.metrics.MetricsCollector;
import com.z254.autodev.swarm.observability.StructuredLogger;
import com.z254.autodev.swarm.orchestration.strategy.ExecutionPlan;
import com.z254.autodev.swarm.orchestration.strategy.StrategyExecutor;
import com.z254.autodev.swarm.swarm.SwarmManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Orchestrates tasks across the agents of a swarm.
 * <p>
 * A task moves {@code PENDING -> EXECUTING -> COMPLETED | FAILED}. Agents are selected by capability
 * score, the execution strategy is resolved, and every agent call goes through the resilient
 * invocation client. Configuration errors (unknown swarm, swarm not accepting work) propagate to the
 * caller without creating a task; every other failure leaves the task FAILED with its cause and any
 * partial results recorded.
 */
@Slf4j
@Service
public class TaskOrchestrator {

    private final SwarmManager swarmManager;
    private final TaskRepository taskRepository;
    private final AgentCallExecutor agentCallExecutor;
    private final Map<ExecutionStrategy, StrategyExecutor> executors = new EnumMap<>(ExecutionStrategy.class);
    private final CoordinationHooks hooks;
    private final MetricsCollector metricsCollector;
    private final StructuredLogger structuredLogger;
    private final SwarmProperties.OrchestrationProperties config;
    private final Clock clock;

    public TaskOrchestrator(SwarmManager swarmManager,
                            TaskRepository taskRepository,
                            AgentCallExecutor agentCallExecutor,
                            List<StrategyExecutor> strategyExecutors,
                            CoordinationHooks hooks,
                            MetricsCollector metricsCollector,
                            StructuredLogger structuredLogger,
                            SwarmProperties properties,
                            Clock clock) {
        this.swarmManager = swarmManager;
        this.taskRepository = taskRepository;
        this.agentCallExecutor = agentCallExecutor;
        for (StrategyExecutor executor : strategyExecutors) {
            executors.put(executor.getStrategy(), executor);
        }
        this.hooks = hooks;
        this.metricsCollector = metricsCollector;
        this.structuredLogger = structuredLogger;
        this.config = properties.getOrchestration();
        this.clock = clock;
    }

    /**
     * Orchestrate a task and wait for it to reach a terminal state.
     *
     * @return the task id; the task is COMPLETED or FAILED when the mono completes
     */
    public Mono<String> orchestrate(OrchestrationRequest request) {
        return Mono.defer(() -> {
            SwarmTask task = createTask(request);
            return taskRepository.save(task)
                    .flatMap(this::execute)
                    .thenReturn(task.getId());
        });
    }

    /**
     * Snapshot of a task.
     */
    public Mono<SwarmTask> getTaskStatus(String taskId) {
        return taskRepository.findById(taskId)
                .map(SwarmTask::copy)
                .switchIfEmpty(Mono.error(() -> new TaskNotFoundException(taskId)));
    }

    public Flux<SwarmTask> getSwarmTasks(String swarmId) {
        return taskRepository.findBySwarmId(swarmId).map(SwarmTask::copy);
    }

    private SwarmTask createTask(OrchestrationRequest request) {
        if (request.getDescription() == null || request.getDescription().isBlank()) {
            throw new IllegalArgumentException("Task description must not be blank");
        }
        int maxAgents = request.getMaxAgents() != null ? request.getMaxAgents() : config.getDefaultMaxAgents();
        if (maxAgents < 1) {
            throw new IllegalArgumentException("maxAgents must be at least 1: " + maxAgents);
        }
        if (!swarmManager.exists(request.getSwarmId())) {
            throw new UnknownSwarmException(request.getSwarmId());
        }
        if (!swarmManager.getStatus(request.getSwarmId()).isActive()) {
            throw new ResourceExhaustedException(
                    "Swarm " + request.getSwarmId() + " does not accept new tasks");
        }

        SwarmTask task = SwarmTask.builder()
                .id("task_" + UUID.randomUUID())
                .swarmId(request.getSwarmId())
                .description(request.getDescription())
                .priority(request.getPriority() != null ? request.getPriority() : new TaskPriority())
                .complexity(request.getComplexity() != null ? request.getComplexity() : ComplexityVector.neutral())
                .maxAgents(maxAgents)
                .requestedStrategy(request.getStrategy() != null ? request.getStrategy() : ExecutionStrategy.ADAPTIVE)
                .provider(request.getProvider())
                .status(TaskStatus.PENDING)
                .createdAt(clock.instant())
                .build();
        task.audit("submitted");
        swarmManager.attachTask(task.getSwarmId(), task.getId());
        hooks.preTask(task.getId(), task.getDescription());
        return task;
    }

    private Mono<Void> execute(SwarmTask task) {
        Instant started = clock.instant();
        return checkDependencies(task)
                .then(Mono.defer(() -> run(task)))
                .onErrorResume(error -> Mono.just(failure(task, error, List.of())))
                .flatMap(outcome -> finish(task, outcome, started)
                        .then(isConfigurationError(outcome.getCause())
                                ? Mono.<Void>error(rootCause(outcome.getCause()))
                                : Mono.<Void>empty()));
    }

    private static boolean isConfigurationError(Throwable error) {
        Throwable root = rootCause(error);
        return root instanceof SwarmException swarmException && swarmException.isConfigurationError();
    }

    private static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while (current instanceof TaskExecutionFailedException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private Mono<Void> checkDependencies(SwarmTask task) {
        List<String> dependencies = task.getPriority().getDependencies();
        if (dependencies == null || dependencies.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(dependencies)
                .concatMap(dependencyId -> taskRepository.findById(dependencyId)
                        .filter(dependency -> dependency.getStatus() == TaskStatus.COMPLETED)
                        .switchIfEmpty(Mono.error(() -> new TaskExecutionFailedException(task.getId(),
                                "dependency " + dependencyId + " is not completed"))))
                .then();
    }

    private Mono<TaskOutcome> run(SwarmTask task) {
        Duration timeout = effectiveTimeout(task);
        if (timeout.isZero() || timeout.isNegative()) {
            InvocationTimeoutException expired = new InvocationTimeoutException("Task " + task.getId()
                    + " deadline has passed");
            return Mono.just(TaskOutcome.failed(expired.getErrorCode(), expired.getMessage(), List.of(), expired));
        }

        List<Agent> agents = swarmManager.reserveAgents(task.getSwarmId(), task.getId(), task.getDescription(),
                task.getComplexity(), task.getMaxAgents());
        if (agents.isEmpty()) {
            return Mono.error(new TaskExecutionFailedException(task.getId(), "no idle agent available"));
        }
        List<String> agentIds = agents.stream().map(Agent::getId).toList();

        ExecutionStrategy strategy = StrategyResolver.resolve(task.getRequestedStrategy(), task.getComplexity(),
                agents.size(), config.getAdaptiveThreshold());
        task.markExecuting(agentIds, strategy, clock.instant());
        task.audit("executing " + strategy + " with " + agentIds);
        log.info("Task {} executing with {} strategy on agents {}", task.getId(), strategy, agentIds);
        structuredLogger.logTaskStarted(task.getId(), task.getSwarmId(), strategy.name(), agents.size());

        ExecutionPlan plan = new ExecutionPlan(task, agents);
        return executors.get(strategy)
                .execute(plan, (agent, step, prior) -> agentCallExecutor.execute(task, agent, step, prior))
                .timeout(timeout)
                .map(TaskOutcome::completed)
                .onErrorResume(error -> Mono.just(failure(task, error, plan.completedResults())))
                .doOnCancel(() -> {
                    if (task.finish(TaskOutcome.failed("CANCELLED", "Task cancelled", plan.completedResults(), null),
                            clock.instant())) {
                        log.warn("Task {} cancelled", task.getId());
                        hooks.postTask(task.getId(), TaskStatus.FAILED.name().toLowerCase());
                    }
                })
                .doFinally(signal -> swarmManager.releaseAgents(task.getSwarmId(), agentIds));
    }

    private Duration effectiveTimeout(SwarmTask task) {
        Duration timeout = config.getTaskTimeout();
        Instant deadline = task.getPriority().getDeadline();
        if (deadline != null) {
            Duration untilDeadline = Duration.between(clock.instant(), deadline);
            if (untilDeadline.compareTo(timeout) < 0) {
                return untilDeadline;
            }
        }
        return timeout;
    }

    private TaskOutcome failure(SwarmTask task, Throwable error, List<AgentResult> partial) {
        SwarmException cause;
        if (error instanceof TimeoutException) {
            cause = new InvocationTimeoutException("Task " + task.getId() + " timed out");
        } else if (error instanceof TaskExecutionFailedException failed) {
            cause = failed;
        } else {
            cause = new TaskExecutionFailedException(task.getId(), error.getMessage(), error, partial);
        }
        return TaskOutcome.failed(cause.getErrorCode(), cause.getMessage(), partial, error);
    }

    private Mono<Void> finish(SwarmTask task, TaskOutcome outcome, Instant started) {
        return Mono.fromRunnable(() -> {
            if (!task.finish(outcome, clock.instant())) {
                return;
            }
            long duration = Duration.between(started, clock.instant()).toMillis();
            String strategy = task.getEffectiveStrategy() != null ? task.getEffectiveStrategy().name() : "NONE";
            metricsCollector.recordTaskOutcome(strategy, outcome.isCompleted(), duration);
            swarmManager.recordTaskOutcome(task.getSwarmId(), duration, outcome.isCompleted());
            hooks.postTask(task.getId(), task.getStatus().name().toLowerCase());
            if (outcome.isCompleted()) {
                task.audit("completed");
                log.info("Task {} completed in {}ms with {} results", task.getId(), duration,
                        outcome.getResults().size());
                structuredLogger.logTaskCompleted(task.getId(), task.getSwarmId(), duration,
                        outcome.getResults().size());
            } else {
                task.audit("failed: " + outcome.getErrorType());
                log.warn("Task {} failed: {}", task.getId(), outcome.getErrorMessage());
                structuredLogger.logTaskFailed(task.getId(), task.getSwarmId(), outcome.getErrorType(),
                        outcome.getErrorMessage(), outcome.getResults().size());
            }
        });
    }
}
