package com.taskengine.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskengine.core.codec.PlanCodec;
import com.taskengine.core.condition.ConditionEvaluator;
import com.taskengine.core.repository.PlanSnapshotStore;
import com.taskengine.core.repository.StepRepository;
import com.taskengine.core.repository.TaskEventRepository;
import com.taskengine.core.repository.TaskRepository;
import com.taskengine.engine.executor.AgentExecutor;
import com.taskengine.engine.kernel.TaskManager;
import com.taskengine.engine.metrics.TaskMetrics;
import com.taskengine.engine.persistence.*;
import com.taskengine.engine.persistence.jdbc.JdbcStepRepository;
import com.taskengine.engine.persistence.jdbc.JdbcTaskEventRepository;
import com.taskengine.engine.persistence.jdbc.JdbcTaskRepository;
import com.taskengine.engine.planning.PlanManager;
import com.taskengine.engine.step.ActionHandlerRegistry;
import com.taskengine.engine.step.StepExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;

/**
 * Wires the engine. {@code taskengine.store} selects in-memory or PostgreSQL repositories.
 */
@Configuration
@EnableConfigurationProperties(TaskEngineProperties.class)
public class TaskEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TaskEngineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config().commonTags("application", "task-engine");
    }

    @Bean
    public PlanCodec planCodec(ObjectMapper objectMapper) {
        return new PlanCodec(objectMapper);
    }

    @Bean
    public TaskMetrics taskMetrics(TaskRepository taskRepository) {
        return new TaskMetrics(taskRepository);
    }

    @Bean
    public TaskManager taskManager(
            TaskRepository taskRepository,
            TaskEventRepository eventRepository,
            TransactionOperations transactions,
            TaskEngineProperties properties,
            ObjectMapper objectMapper,
            TaskMetrics metrics,
            Clock clock) {
        return new TaskManager(taskRepository, eventRepository, properties.toTaskLimits(),
            transactions, objectMapper, metrics, clock);
    }

    @Bean
    public PlanManager planManager() {
        return new PlanManager();
    }

    @Bean
    public ConditionEvaluator conditionEvaluator() {
        return new ConditionEvaluator();
    }

    @Bean
    public ActionHandlerRegistry actionHandlerRegistry(
            ConditionEvaluator conditionEvaluator,
            ObjectProvider<ActionHandlerBinding> bindings) {
        ActionHandlerRegistry registry = ActionHandlerRegistry.withBuiltins(conditionEvaluator);
        bindings.orderedStream().forEach(binding -> registry.register(binding.action(), binding.handler()));
        log.info("Registered step actions: {}", registry.getRegisteredActions());
        return registry;
    }

    @Bean
    public StepExecutor stepExecutor(
            ActionHandlerRegistry registry,
            TaskManager taskManager,
            ObjectMapper objectMapper,
            TaskMetrics metrics,
            TaskEngineProperties properties,
            Clock clock) {
        return new StepExecutor(registry, taskManager, objectMapper, metrics, properties.getHandlerTimeout(), clock);
    }

    @Bean
    public PlanSnapshotStore planSnapshotStore(TaskEngineProperties properties) {
        if (properties.getSnapshotDir() == null) {
            return new InMemoryPlanSnapshotStore();
        }
        log.info("Writing plan snapshots under {}", properties.getSnapshotDir().toAbsolutePath());
        return new FilePlanSnapshotStore(properties.getSnapshotDir());
    }

    @Bean
    public PlanStore planStore(PlanSnapshotStore snapshotStore, StepRepository stepRepository, PlanCodec codec) {
        return new PlanStore(snapshotStore, stepRepository, codec);
    }

    @Bean
    public AgentExecutor agentExecutor(
            TaskManager taskManager,
            PlanManager planManager,
            StepExecutor stepExecutor,
            PlanStore planStore,
            ObjectMapper objectMapper,
            TaskMetrics metrics,
            TaskEngineProperties properties,
            Clock clock) {
        return new AgentExecutor(taskManager, planManager, stepExecutor, planStore,
            objectMapper, metrics, properties.toExecutionLimits(), clock);
    }

    @Configuration
    @ConditionalOnProperty(name = "taskengine.store", havingValue = "memory", matchIfMissing = true)
    static class MemoryStoreConfiguration {

        @Bean
        public TaskRepository taskRepository() {
            return new InMemoryTaskRepository();
        }

        @Bean
        public TaskEventRepository taskEventRepository() {
            return new InMemoryTaskEventRepository();
        }

        @Bean
        public StepRepository stepRepository(PlanCodec codec) {
            return new InMemoryStepRepository(codec);
        }

        @Bean
        public TransactionOperations transactionOperations() {
            return TransactionOperations.withoutTransaction();
        }
    }

    /**
     * PostgreSQL repositories. The DataSource, JdbcTemplate and TransactionTemplate
     * come from Spring Boot auto-configuration.
     */
    @Configuration
    @ConditionalOnProperty(name = "taskengine.store", havingValue = "jdbc")
    static class JdbcStoreConfiguration {

        @Bean
        public TaskRepository taskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcTaskRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public TaskEventRepository taskEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcTaskEventRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public StepRepository stepRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, PlanCodec codec) {
            return new JdbcStepRepository(jdbcTemplate, objectMapper, codec);
        }
    }
}
