package com.jz.moderation.domain.dto;

import lombok.Data;

@Data
public class WarnRequestDTO {
    private String reason;
}
