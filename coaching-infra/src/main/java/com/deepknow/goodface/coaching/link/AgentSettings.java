package com.deepknow.goodface.coaching.link;

import com.deepknow.goodface.coaching.domain.feature.FunctionDefinition;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * 组装对话代理握手用的 Settings 消息。
 */
final class AgentSettings {
    private AgentSettings() {}

    static ObjectNode build(ObjectMapper mapper, CoachingSessionConfig config, List<FunctionDefinition> functions) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "Settings");

        ObjectNode audio = root.putObject("audio");
        ObjectNode input = audio.putObject("input");
        input.put("encoding", config.getAgentEncoding());
        input.put("sample_rate", config.getAgentSampleRate());
        ObjectNode output = audio.putObject("output");
        output.put("encoding", config.getAgentEncoding());
        output.put("sample_rate", config.getAgentSampleRate());
        output.put("container", "none");

        ObjectNode agent = root.putObject("agent");
        agent.put("language", config.getLanguage());

        ObjectNode listenProvider = agent.putObject("listen").putObject("provider");
        listenProvider.put("type", "deepgram");
        listenProvider.put("model", config.getSttModel());
        ArrayNode keyterms = listenProvider.putArray("keyterms");
        config.getKeyterms().forEach(keyterms::add);

        ObjectNode think = agent.putObject("think");
        ObjectNode thinkProvider = think.putObject("provider");
        thinkProvider.put("type", config.getLlmProvider());
        thinkProvider.put("model", config.getLlmModel());
        thinkProvider.put("temperature", config.getTemperature());
        think.put("prompt", config.getPrompt());
        if (functions != null && !functions.isEmpty()) {
            ArrayNode fns = think.putArray("functions");
            for (FunctionDefinition def : functions) {
                ObjectNode fn = fns.addObject();
                fn.put("name", def.getName());
                fn.put("description", def.getDescription());
                if (def.getParameters() != null) {
                    fn.set("parameters", def.getParameters());
                }
            }
        }

        ObjectNode speakProvider = agent.putObject("speak").putObject("provider");
        speakProvider.put("type", "deepgram");
        speakProvider.put("model", config.getVoiceModel());

        if (config.hasGreeting()) {
            agent.put("greeting", config.getGreeting());
        }
        return root;
    }
}
