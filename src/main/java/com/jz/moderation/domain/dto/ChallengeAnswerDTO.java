package com.jz.moderation.domain.dto;

import lombok.Data;

@Data
public class ChallengeAnswerDTO {
    private String answer;
    private String displayName;
}
