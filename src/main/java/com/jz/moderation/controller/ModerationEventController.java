package com.jz.moderation.controller;

import com.jz.moderation.common.Result;
import com.jz.moderation.domain.dto.ChallengeAnswerDTO;
import com.jz.moderation.domain.dto.JoinEventDTO;
import com.jz.moderation.domain.dto.JoinOutcome;
import com.jz.moderation.domain.dto.MessageEventDTO;
import com.jz.moderation.domain.dto.ModerationResult;
import com.jz.moderation.domain.entity.ChallengeState;
import com.jz.moderation.service.EnforcementService;
import com.jz.moderation.service.ModerationEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 平台事件入口：消息、入群、验证答案。
 */
@RestController
@RequestMapping("api/moderation/{chatId}")
@RequiredArgsConstructor
public class ModerationEventController {

    private final ModerationEngine engine;
    private final EnforcementService enforcement;

    /** 审核一条消息并立即执行结论 */
    @PostMapping("/messages")
    public Result<ModerationResult> onMessage(@PathVariable long chatId, @RequestBody MessageEventDTO body) {
        body.setChatId(chatId);
        ModerationResult result = engine.onMessage(body);
        enforcement.enforce(engine.settings(chatId), body, result);
        return Result.success(result);
    }

    @PostMapping("/joins")
    public Result<JoinOutcome> onJoin(@PathVariable long chatId, @RequestBody JoinEventDTO body) {
        body.setChatId(chatId);
        return Result.success(engine.onJoin(body));
    }

    @PostMapping("/challenges/{userId}/answer")
    public Result<ChallengeState> answer(@PathVariable long chatId,
                                         @PathVariable long userId,
                                         @RequestBody ChallengeAnswerDTO body) {
        return Result.success(engine.verifyChallenge(chatId, userId, body.getAnswer(), body.getDisplayName()));
    }
}
