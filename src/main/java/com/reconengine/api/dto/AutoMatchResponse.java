package com.reconengine.api.dto;

import com.reconengine.matching.ProposedMatch;
import lombok.Value;

import java.util.List;

@Value
public class AutoMatchResponse {
    List<ProposedMatch> matches;
    boolean applied;
    int appliedCount;
}
