package com.taskengine.app.config;

import com.taskengine.actions.ActionHandler;
import com.taskengine.core.model.StepAction;

/**
 * Declares a handler for one step action. Every binding bean in the context
 * is added to the registry on startup, replacing any built-in for the same action.
 */
public record ActionHandlerBinding(StepAction action, ActionHandler handler) {
}
