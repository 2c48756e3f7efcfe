package com.deepknow.goodface.coaching.feature;

import com.deepknow.goodface.coaching.domain.feature.FunctionDefinition;
import com.deepknow.goodface.coaching.domain.feature.FunctionResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CoachingFunctionsTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final CoachingFunctions functions = new CoachingFunctions("s1", mapper);

    @Test
    void logsInsightWithCategory() {
        ObjectNode input = mapper.createObjectNode().put("insight", "Sleeps better after breathwork").put("category", "breakthrough");

        FunctionResult result = functions.logSessionInsight(input);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutput()).isEqualTo("Insight logged: [breakthrough] Sleeps better after breathwork");
        assertThat(functions.insights()).containsExactly("[breakthrough] Sleeps better after breathwork");
    }

    @Test
    void rejectsUnknownCategory() {
        FunctionResult result = functions.logSessionInsight(mapper.createObjectNode().put("insight", "x").put("category", "gossip"));
        assertThat(result.isSuccess()).isFalse();
        assertThat(functions.insights()).isEmpty();
    }

    @Test
    void exercisesAreDeduplicatedAndCapped() throws Exception {
        ObjectNode input = mapper.createObjectNode();
        input.putArray("symptoms").add("Anxiety").add("work stress").add("anxiety");

        JsonNode out = mapper.readTree(functions.getVagusExercises(input).getOutput());

        assertThat(out.path("exercises").size()).isEqualTo(CoachingFunctions.MAX_EXERCISES);
        assertThat(out.path("exercises").get(0).asText()).startsWith("4-7-8 breathing");
        assertThat(out.path("targetSymptoms").size()).isEqualTo(3);
    }

    @Test
    void unknownSymptomsGetGeneralExercises() throws Exception {
        ObjectNode input = mapper.createObjectNode();
        input.putArray("symptoms").add("headache");

        JsonNode out = mapper.readTree(functions.getVagusExercises(input).getOutput());

        assertThat(out.path("exercises").size()).isEqualTo(CoachingFunctions.GENERAL_EXERCISES.size());
        assertThat(out.path("note").asText()).isNotEmpty();
    }

    @Test
    void registersBothFunctions() {
        FunctionBridge bridge = new FunctionBridge("s1", null, Runnable::run, e -> { }, mapper);
        functions.registerAll(bridge);

        assertThat(bridge.definitions()).extracting(FunctionDefinition::getName)
                .containsExactly(CoachingFunctions.LOG_SESSION_INSIGHT, CoachingFunctions.GET_VAGUS_EXERCISES);
    }
}
