package com.deepknow.goodface.coaching.link;

import com.deepknow.goodface.coaching.domain.event.ErrorEvent;
import com.deepknow.goodface.coaching.domain.event.SessionEventPublisher;
import com.deepknow.goodface.coaching.domain.event.SessionEventType;
import com.deepknow.goodface.coaching.domain.event.SignalEvent;
import com.deepknow.goodface.coaching.domain.event.TranscriptEvent;
import com.deepknow.goodface.coaching.domain.link.TranscriptResult;
import com.deepknow.goodface.coaching.domain.link.TranscriptionLink;
import com.deepknow.goodface.coaching.domain.session.CoachingSessionConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 转写链路：Deepgram 流式识别，无握手，打开即就绪。
 */
public class DeepgramListenLink extends AbstractUpstreamLink implements TranscriptionLink {
    private static final Logger log = LoggerFactory.getLogger(DeepgramListenLink.class);
    public static final String NAME = "transcription";

    private final CoachingSessionConfig config;
    private final List<TranscriptResult> finals = Collections.synchronizedList(new ArrayList<>());

    public DeepgramListenLink(String sessionId, CoachingSessionConfig config, LinkConnector connector,
                              ScheduledExecutorService scheduler, SessionEventPublisher publisher,
                              ObjectMapper objectMapper) {
        super(NAME, sessionId, connector, scheduler, publisher, objectMapper,
                config.getMaxReconnectAttempts(), config.getReconnectBaseDelayMs());
        this.config = config;
    }

    @Override
    protected URI endpoint() {
        String query = "encoding=" + config.getListenEncoding()
                + "&sample_rate=" + config.getListenSampleRate()
                + "&channels=" + config.getListenChannels()
                + "&model=" + config.getListenModel()
                + "&punctuate=" + config.isPunctuate()
                + "&interim_results=" + config.isInterimResults()
                + "&utterance_end_ms=" + config.getUtteranceEndMs()
                + "&vad_events=" + config.isVadEvents();
        return URI.create(config.getListenUrl() + "?" + query);
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of("Authorization", "Token " + config.getApiKey());
    }

    @Override
    protected void onSocketOpen(LinkSocket socket) {
        markReady();
    }

    @Override
    protected void handleMessage(String type, JsonNode msg) {
        switch (type) {
            case "Results":
                handleResults(msg);
                break;
            case "SpeechStarted":
                publisher.publish(new SignalEvent(SessionEventType.SPEECH_STARTED, NAME));
                break;
            case "UtteranceEnd":
                publisher.publish(new SignalEvent(SessionEventType.UTTERANCE_END, NAME));
                break;
            case "Metadata":
                log.debug("Transcription metadata: sessionId={}, requestId={}", sessionId, msg.path("request_id").asText());
                break;
            case "Error": {
                String code = msg.path("code").asText("TRANSCRIPTION_ERROR");
                String message = msg.path("description").asText(msg.path("message").asText(""));
                log.warn("Transcription error: sessionId={}, code={}, message={}", sessionId, code, message);
                publisher.publish(new ErrorEvent(NAME, code, message, false));
                break;
            }
            default:
                log.debug("Unhandled transcription message: sessionId={}, type={}", sessionId, type);
        }
    }

    private void handleResults(JsonNode msg) {
        JsonNode alt = msg.path("channel").path("alternatives").path(0);
        String transcript = alt.path("transcript").asText("");
        if (transcript.isBlank()) {
            return;
        }
        List<TranscriptResult.Word> words = new ArrayList<>();
        for (JsonNode w : alt.path("words")) {
            words.add(new TranscriptResult.Word(
                    w.path("punctuated_word").asText(w.path("word").asText("")),
                    w.path("start").asDouble(),
                    w.path("end").asDouble(),
                    w.path("confidence").asDouble()));
        }
        TranscriptResult result = new TranscriptResult(transcript,
                alt.path("confidence").asDouble(),
                msg.path("is_final").asBoolean(false),
                words,
                msg.path("start").asDouble(),
                msg.path("duration").asDouble());
        if (result.isFinal()) {
            finals.add(result);
            log.debug("Final transcript: sessionId={}, len={}", sessionId, transcript.length());
        }
        publisher.publish(new TranscriptEvent(NAME, result));
    }

    @Override
    public void closeStream() {
        if (!sendControl("CloseStream")) {
            close();
            return;
        }
        try {
            scheduler.schedule(this::close, config.getCloseGraceMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler unavailable, closing immediately: sessionId={}", sessionId);
            close();
        }
    }

    @Override
    public List<TranscriptResult> finalTranscripts() {
        synchronized (finals) {
            return List.copyOf(finals);
        }
    }
}
