package com.reconengine.api.dto;

import lombok.Value;

@Value
public class MatchResultResponse {
    boolean success;
    String matchGroupId;
    Integer appliedCount;

    public static MatchResultResponse of(boolean success) {
        return new MatchResultResponse(success, null, null);
    }

    public static MatchResultResponse group(String matchGroupId) {
        return new MatchResultResponse(true, matchGroupId, null);
    }

    public static MatchResultResponse applied(int appliedCount) {
        return new MatchResultResponse(true, null, appliedCount);
    }
}
