package com.taskengine.engine.step;

import com.taskengine.actions.ActionHandler;
import com.taskengine.core.condition.ConditionEvaluator;
import com.taskengine.core.exception.UnknownActionException;
import com.taskengine.core.model.StepAction;
import com.taskengine.engine.step.handlers.AggregateActionHandler;
import com.taskengine.engine.step.handlers.ApprovalActionHandler;
import com.taskengine.engine.step.handlers.ConditionActionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Handlers by action kind. Populated at startup, read-only afterwards.
 */
public class ActionHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionHandlerRegistry.class);

    private final Map<StepAction, ActionHandler> handlers = new EnumMap<>(StepAction.class);

    /**
     * Registry with the approval, condition and aggregate handlers. Model and tool calls are
     * application-specific and must be registered by the caller.
     */
    public static ActionHandlerRegistry withBuiltins(ConditionEvaluator conditionEvaluator) {
        return new ActionHandlerRegistry()
            .register(StepAction.APPROVAL, new ApprovalActionHandler())
            .register(StepAction.CONDITION, new ConditionActionHandler(conditionEvaluator))
            .register(StepAction.AGGREGATE, new AggregateActionHandler());
    }

    public ActionHandlerRegistry register(StepAction action, ActionHandler handler) {
        ActionHandler previous = handlers.put(action, handler);
        if (previous != null) {
            log.info("Replaced handler for action {}", action.wireName());
        } else {
            log.debug("Registered handler for action {}", action.wireName());
        }
        return this;
    }

    /**
     * @throws UnknownActionException if nothing is registered for the action
     */
    public ActionHandler get(StepAction action) {
        ActionHandler handler = handlers.get(action);
        if (handler == null) {
            throw new UnknownActionException(action);
        }
        return handler;
    }

    public boolean has(StepAction action) {
        return handlers.containsKey(action);
    }

    public Set<StepAction> getRegisteredActions() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
