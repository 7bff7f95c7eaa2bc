package com.jz.moderation.service;

import com.jz.moderation.domain.dto.JoinEventDTO;
import com.jz.moderation.domain.entity.PolicySettings;

public interface WelcomeService {

    /**
     * 给新成员发欢迎语（可能延迟发送）。
     *
     * @return false 表示未开启或在去重窗口内已欢迎过
     */
    boolean welcome(PolicySettings settings, JoinEventDTO member);
}
