package com.taskengine.engine.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskengine.core.model.Step;

import java.util.List;

/**
 * Produces the steps for one kind of task. Implementations must not perform I/O.
 */
@FunctionalInterface
public interface PlanStrategy {

    /**
     * @param inputText The task's input text
     * @param inputData The task's structured input, never null
     * @return Steps in plan order
     */
    List<Step> steps(String inputText, JsonNode inputData);
}
