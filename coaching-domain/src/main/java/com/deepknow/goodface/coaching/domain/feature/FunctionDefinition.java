package com.deepknow.goodface.coaching.domain.feature;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 向对话代理声明的函数：名称、说明与 JSON Schema 形式的参数定义。
 */
public final class FunctionDefinition {
    private final String name;
    private final String description;
    private final JsonNode parameters;

    public FunctionDefinition(String name, String description, JsonNode parameters) {
        this.name = name;
        this.description = description;
        this.parameters = parameters;
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public JsonNode getParameters() { return parameters; }
}
