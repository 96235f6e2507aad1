package com.cvjudge.engine.client;

/**
 * Whatever text a provider returned as the judge's answer, before validation.
 * Usually a JSON object, sometimes wrapped in prose or a markdown fence.
 */
public record RawJudgePayload(String content) {

    public RawJudgePayload {
        if (content == null) content = "";
    }
}
