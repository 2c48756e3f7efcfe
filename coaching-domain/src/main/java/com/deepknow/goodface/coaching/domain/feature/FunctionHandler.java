package com.deepknow.goodface.coaching.domain.feature;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface FunctionHandler {
    FunctionResult handle(JsonNode input) throws Exception;
}
