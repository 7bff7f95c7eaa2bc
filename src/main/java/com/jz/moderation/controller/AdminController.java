package com.jz.moderation.controller;

import com.jz.moderation.common.Result;
import com.jz.moderation.domain.dto.AdminActionDTO;
import com.jz.moderation.domain.dto.WarnRequestDTO;
import com.jz.moderation.domain.dto.WarnResult;
import com.jz.moderation.domain.dto.WordListChange;
import com.jz.moderation.domain.entity.ModAction;
import com.jz.moderation.domain.entity.Warning;
import com.jz.moderation.service.EnforcementService;
import com.jz.moderation.service.ModerationEngine;
import com.jz.moderation.service.PermissionService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 管理员操作：警告、关键词、手动处置、审计查询。全部要求 X-Admin-Id 是该群管理员。
 */
@RestController
@RequestMapping("api/moderation/{chatId}")
@RequiredArgsConstructor
public class AdminController {

    private static final String ADMIN_HEADER = PolicySettingsController.ADMIN_HEADER;
    private static final int DEFAULT_MUTE_MINUTES = 60;
    private static final int MAX_MODLOG_LIMIT = 100;

    private final ModerationEngine engine;
    private final EnforcementService enforcement;
    private final PermissionService permissions;

    // ---------- warns ----------

    @PostMapping("/warns/{userId}")
    public Result<WarnResult> warn(@PathVariable long chatId,
                                   @PathVariable long userId,
                                   @RequestHeader(ADMIN_HEADER) long adminId,
                                   @RequestBody(required = false) WarnRequestDTO body) {
        permissions.requireAdmin(chatId, adminId);
        String reason = body == null ? null : body.getReason();
        WarnResult result = engine.addWarning(chatId, userId, adminId, reason);
        enforcement.applyEscalation(engine.settings(chatId), userId, result);
        return Result.success(result);
    }

    @GetMapping("/warns/{userId}")
    public Result<List<Warning>> warns(@PathVariable long chatId,
                                       @PathVariable long userId,
                                       @RequestHeader(ADMIN_HEADER) long adminId) {
        permissions.requireAdmin(chatId, adminId);
        return Result.success(engine.listWarnings(chatId, userId));
    }

    @DeleteMapping("/warns/{userId}")
    public Result<Long> clearWarns(@PathVariable long chatId,
                                   @PathVariable long userId,
                                   @RequestHeader(ADMIN_HEADER) long adminId) {
        permissions.requireAdmin(chatId, adminId);
        return Result.success(engine.clearWarnings(chatId, userId, adminId));
    }

    // ---------- filter words ----------

    @GetMapping("/filters")
    public Result<List<String>> filters(@PathVariable long chatId, @RequestHeader(ADMIN_HEADER) long adminId) {
        permissions.requireAdmin(chatId, adminId);
        return Result.success(engine.filterWords(chatId));
    }

    @PostMapping("/filters/{word}")
    public Result<WordListChange> addFilter(@PathVariable long chatId,
                                            @PathVariable String word,
                                            @RequestHeader(ADMIN_HEADER) long adminId) {
        permissions.requireAdmin(chatId, adminId);
        return Result.success(engine.addFilterWord(chatId, word));
    }

    @DeleteMapping("/filters/{word}")
    public Result<WordListChange> removeFilter(@PathVariable long chatId,
                                               @PathVariable String word,
                                               @RequestHeader(ADMIN_HEADER) long adminId) {
        permissions.requireAdmin(chatId, adminId);
        return Result.success(engine.removeFilterWord(chatId, word));
    }

    @DeleteMapping("/filters")
    public Result<Integer> clearFilters(@PathVariable long chatId, @RequestHeader(ADMIN_HEADER) long adminId) {
        permissions.requireAdmin(chatId, adminId);
        return Result.success(engine.clearFilterWords(chatId));
    }

    // ---------- manual actions ----------

    @PostMapping("/admin/ban")
    public Result<Boolean> ban(@PathVariable long chatId, @RequestBody AdminActionDTO body) {
        permissions.requireAdmin(chatId, body.getAdminId());
        return done(enforcement.ban(chatId, body.getUserId(), body.getAdminId(), body.getReason()));
    }

    @PostMapping("/admin/kick")
    public Result<Boolean> kick(@PathVariable long chatId, @RequestBody AdminActionDTO body) {
        permissions.requireAdmin(chatId, body.getAdminId());
        return done(enforcement.kick(chatId, body.getUserId(), body.getAdminId(), body.getReason()));
    }

    @PostMapping("/admin/mute")
    public Result<Boolean> mute(@PathVariable long chatId, @RequestBody AdminActionDTO body) {
        permissions.requireAdmin(chatId, body.getAdminId());
        int minutes = body.getMinutes() == null ? DEFAULT_MUTE_MINUTES : body.getMinutes();
        if (minutes <= 0) throw new IllegalArgumentException("minutes must be positive");
        return done(enforcement.mute(chatId, body.getUserId(), body.getAdminId(), minutes, body.getReason()));
    }

    @PostMapping("/admin/unmute")
    public Result<Boolean> unmute(@PathVariable long chatId, @RequestBody AdminActionDTO body) {
        permissions.requireAdmin(chatId, body.getAdminId());
        return done(enforcement.unmute(chatId, body.getUserId(), body.getAdminId()));
    }

    // ---------- audit ----------

    @GetMapping("/modlog")
    public Result<List<ModAction>> modlog(@PathVariable long chatId,
                                          @RequestHeader(ADMIN_HEADER) long adminId,
                                          @RequestParam(defaultValue = "20") int limit,
                                          @RequestParam(required = false) Long userId) {
        permissions.requireAdmin(chatId, adminId);
        return Result.success(engine.modLog(chatId, Math.min(Math.max(limit, 1), MAX_MODLOG_LIMIT), userId));
    }

    private static Result<Boolean> done(boolean ok) {
        return ok ? Result.success(true) : Result.of(502, "chat platform rejected the action", false);
    }
}
