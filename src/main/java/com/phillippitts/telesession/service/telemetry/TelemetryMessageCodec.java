package com.phillippitts.telesession.service.telemetry;

import com.phillippitts.telesession.domain.AnalysisResult;
import com.phillippitts.telesession.domain.Keypoint;
import com.phillippitts.telesession.domain.PoseFrame;
import com.phillippitts.telesession.exception.AnalysisFailureException;
import com.phillippitts.telesession.exception.ErrorCode;
import com.phillippitts.telesession.exception.MalformedMessageException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JSON forms used on the telemetry socket and towards the analysis collaborator.
 *
 * <p>Inbound frame:
 * <pre>
 * {"sequenceNumber": 5, "capturedAt": "2026-01-01T10:00:00Z",
 *  "keypoints": [{"name": "left_knee", "x": 0.41, "y": 0.77, "z": 0.0, "confidence": 0.93}]}
 * </pre>
 * Outbound messages carry a {@code type} of {@code frame-ack}, {@code analysis-result},
 * {@code analysis-pending} or {@code error}.
 */
@Component
public class TelemetryMessageCodec {

    static final int MAX_FRAME_CHARS = 65_536;

    public static final String TYPE_ACK = "frame-ack";
    public static final String TYPE_RESULT = "analysis-result";
    public static final String TYPE_PENDING = "analysis-pending";
    public static final String TYPE_ERROR = "error";

    /**
     * Parses a frame sent by the capture loop.
     *
     * @param receivedAt used when the frame carries no {@code capturedAt}
     * @throws MalformedMessageException if the text is not a valid frame
     */
    public PoseFrame decodeFrame(String sessionId, String json, Instant receivedAt) {
        if (json == null || json.isBlank()) {
            throw new MalformedMessageException("empty frame");
        }
        if (json.length() > MAX_FRAME_CHARS) {
            throw new MalformedMessageException("frame exceeds " + MAX_FRAME_CHARS + " characters");
        }
        try {
            JSONObject root = new JSONObject(json);
            Object seq = root.opt("sequenceNumber");
            if (!(seq instanceof Number n) || n.doubleValue() != n.longValue() || n.longValue() < 0) {
                throw new MalformedMessageException("'sequenceNumber' must be a non-negative integer");
            }

            List<Keypoint> keypoints = new ArrayList<>();
            JSONArray array = root.optJSONArray("keypoints");
            if (array != null) {
                for (int i = 0; i < array.length(); i++) {
                    JSONObject kp = array.getJSONObject(i);
                    keypoints.add(new Keypoint(
                            kp.getString("name"),
                            kp.getDouble("x"),
                            kp.getDouble("y"),
                            kp.optDouble("z", 0.0),
                            kp.optDouble("confidence", 1.0)));
                }
            }
            return new PoseFrame(sessionId, n.longValue(), parseInstant(root.opt("capturedAt"), receivedAt), keypoints);
        } catch (JSONException | IllegalArgumentException | DateTimeParseException e) {
            throw new MalformedMessageException("invalid frame: " + e.getMessage(), e);
        }
    }

    /**
     * Request body for the analysis collaborator.
     */
    public String encodeFrame(PoseFrame frame) {
        JSONArray keypoints = new JSONArray();
        for (Keypoint kp : frame.keypoints()) {
            keypoints.put(new JSONObject()
                    .put("name", kp.name())
                    .put("x", kp.x())
                    .put("y", kp.y())
                    .put("z", kp.z())
                    .put("confidence", kp.confidence()));
        }
        return new JSONObject()
                .put("sessionId", frame.sessionId())
                .put("sequenceNumber", frame.sequenceNumber())
                .put("capturedAt", frame.capturedAt().toString())
                .put("keypoints", keypoints)
                .toString();
    }

    /**
     * Parses the analysis collaborator's response: {@code {"score": 87.5, "feedback": "..."}}.
     *
     * @throws AnalysisFailureException if the body is not usable
     */
    public Analysis decodeAnalysis(String json) {
        if (json == null || json.isBlank()) {
            throw new AnalysisFailureException("Empty analysis response");
        }
        try {
            JSONObject root = new JSONObject(json);
            if (!root.has("score")) {
                throw new AnalysisFailureException("Analysis response has no score");
            }
            return new Analysis(root.getDouble("score"), root.optString("feedback", ""));
        } catch (JSONException | IllegalArgumentException e) {
            throw new AnalysisFailureException("Unparseable analysis response: " + e.getMessage(), e);
        }
    }

    public String encodeAck(SubmitOutcome outcome) {
        JSONObject ack = new JSONObject()
                .put("type", TYPE_ACK)
                .put("sequenceNumber", outcome.sequenceNumber())
                .put("status", outcome.status().name().toLowerCase(Locale.ROOT));
        if (outcome.reason() != SubmitOutcome.Reason.NONE) {
            ack.put("reason", outcome.reason().name().toLowerCase(Locale.ROOT).replace('_', '-'));
        }
        return ack.toString();
    }

    public String encodeUpdate(TelemetryUpdate update) {
        JSONObject out = new JSONObject()
                .put("sessionId", update.sessionId())
                .put("sequenceNumber", update.sequenceNumber());
        if (update.kind() == TelemetryUpdate.Kind.FRESH) {
            out.put("type", TYPE_RESULT);
            putResult(out, update.result());
        } else {
            out.put("type", TYPE_PENDING);
            out.put("reason", update.reason() == null ? ErrorCode.ANALYSIS_FAILURE.wireName() : update.reason().wireName());
            if (update.result() != null) {
                JSONObject previous = new JSONObject().put("sequenceNumber", update.result().frameSequenceNumber());
                putResult(previous, update.result());
                out.put("previous", previous);
            }
        }
        return out.toString();
    }

    public String encodeError(ErrorCode code, String message) {
        return new JSONObject()
                .put("type", TYPE_ERROR)
                .put("code", code.wireName())
                .put("message", message == null ? "" : message)
                .toString();
    }

    private static void putResult(JSONObject out, AnalysisResult result) {
        out.put("score", result.score());
        out.put("feedback", result.feedback());
        out.put("computedAt", result.computedAt().toString());
    }

    private static Instant parseInstant(Object raw, Instant fallback) {
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return fallback;
        }
        if (raw instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue());
        }
        return Instant.parse(raw.toString());
    }
}
