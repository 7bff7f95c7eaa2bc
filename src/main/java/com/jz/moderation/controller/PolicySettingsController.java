package com.jz.moderation.controller;

import com.jz.moderation.common.Result;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.service.ModerationEngine;
import com.jz.moderation.service.PermissionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("api/moderation/{chatId}/settings")
@RequiredArgsConstructor
public class PolicySettingsController {

    static final String ADMIN_HEADER = "X-Admin-Id";

    private final ModerationEngine engine;
    private final PermissionService permissions;

    @GetMapping
    public Result<PolicySettings> get(@PathVariable long chatId) {
        return Result.success(engine.settings(chatId));
    }

    @PutMapping
    public Result<PolicySettings> put(@PathVariable long chatId,
                                      @RequestHeader(ADMIN_HEADER) long adminId,
                                      @RequestBody PolicySettings body) {
        permissions.requireAdmin(chatId, adminId);
        return Result.success(engine.updateSettings(chatId, body));
    }

    @DeleteMapping
    public Result<PolicySettings> reset(@PathVariable long chatId, @RequestHeader(ADMIN_HEADER) long adminId) {
        permissions.requireAdmin(chatId, adminId);
        engine.resetSettings(chatId);
        return Result.success(engine.settings(chatId));
    }

    /** 原样返回 JSON 文本，便于直接保存为文件 */
    @GetMapping(value = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public String export(@PathVariable long chatId, @RequestHeader(ADMIN_HEADER) long adminId) {
        permissions.requireAdmin(chatId, adminId);
        return engine.exportSettings(chatId);
    }

    @PostMapping(value = "/import", consumes = {MediaType.APPLICATION_JSON_VALUE, MediaType.TEXT_PLAIN_VALUE})
    public Result<PolicySettings> importSettings(@PathVariable long chatId,
                                                 @RequestHeader(ADMIN_HEADER) long adminId,
                                                 @RequestBody String json) {
        permissions.requireAdmin(chatId, adminId);
        return Result.success(engine.importSettings(chatId, json));
    }
}
