package com.cvjudge.engine.orchestrator;

import com.cvjudge.engine.client.RawJudgePayload;
import com.cvjudge.engine.model.JudgeResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates a judge's raw answer and coerces it into a {@link JudgeResult}.
 *
 * Models do not always return a bare JSON object even when asked to, so the
 * parser first locates the object (inside a markdown fence, or between the
 * first '{' and the last '}') and only then validates its structure.
 *
 * Expected shape:
 * <pre>
 *   { "score": 0..100,
 *     "matching_skills": [..], "missing_requirements": [..],
 *     "red_flags": [..], "strengths": [..],
 *     "rationale": "..." }
 * </pre>
 * List fields may be absent (treated as empty) but must be arrays of strings
 * when present.
 */
@Component
public class JudgePayloadParser {

    // ```json ... ``` or ``` ... ```
    private static final Pattern FENCED_JSON = Pattern.compile(
            "```(?:json)?\\s*(.*?)```",
            Pattern.DOTALL
    );

    static final String SCORE                = "score";
    static final String MATCHING_SKILLS      = "matching_skills";
    static final String MISSING_REQUIREMENTS = "missing_requirements";
    static final String RED_FLAGS            = "red_flags";
    static final String STRENGTHS            = "strengths";
    static final String RATIONALE            = "rationale";

    private final ObjectMapper json;

    public JudgePayloadParser(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    /**
     * @throws JudgePayloadException if the payload is not a valid evaluation
     */
    public JudgeResult parse(String judgeId, RawJudgePayload payload) {
        JsonNode root = readObject(extractJson(payload.content()));

        return new JudgeResult(
                judgeId,
                readScore(root),
                readList(root, MATCHING_SKILLS),
                readList(root, MISSING_REQUIREMENTS),
                readList(root, RED_FLAGS),
                readList(root, STRENGTHS),
                readRationale(root),
                0
        );
    }

    /** Locate the JSON object inside the answer text. */
    static String extractJson(String content) {
        String text = content == null ? "" : content.strip();
        Matcher fenced = FENCED_JSON.matcher(text);
        if (fenced.find()) {
            text = fenced.group(1).strip();
        }
        int start = text.indexOf('{');
        int end   = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new JudgePayloadException("no JSON object in response");
        }
        return text.substring(start, end + 1);
    }

    private JsonNode readObject(String text) {
        JsonNode root;
        try {
            root = json.readTree(text);
        } catch (JsonProcessingException e) {
            throw new JudgePayloadException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new JudgePayloadException("response is not a JSON object");
        }
        return root;
    }

    private static int readScore(JsonNode root) {
        JsonNode node = root.get(SCORE);
        if (node == null || node.isNull()) {
            throw new JudgePayloadException("missing score");
        }

        long score;
        if (node.isIntegralNumber() && !node.canConvertToLong()) {
            // longValue() would wrap silently
            throw new JudgePayloadException("score out of range 0..100: " + node);
        } else if (node.isIntegralNumber()) {
            score = node.longValue();
        } else if (node.isNumber() && node.doubleValue() == Math.rint(node.doubleValue())) {
            // 85.0 is an integer in every sense that matters here
            score = (long) node.doubleValue();
        } else if (node.isTextual() && node.asText().strip().matches("\\d{1,3}")) {
            score = Long.parseLong(node.asText().strip());
        } else {
            throw new JudgePayloadException("score is not an integer: " + node);
        }

        if (score < 0 || score > 100) {
            throw new JudgePayloadException("score out of range 0..100: " + score);
        }
        return (int) score;
    }

    private static List<String> readList(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new JudgePayloadException(field + " is not an array");
        }
        List<String> items = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new JudgePayloadException(field + " contains a non-string element: " + item);
            }
            String text = item.asText().strip();
            if (!text.isEmpty()) {
                items.add(text);
            }
        }
        return items;
    }

    private static String readRationale(JsonNode root) {
        JsonNode node = root.get(RATIONALE);
        if (node == null || node.isNull()) {
            return "";
        }
        if (!node.isTextual()) {
            throw new JudgePayloadException("rationale is not a string");
        }
        return node.asText().strip();
    }
}
