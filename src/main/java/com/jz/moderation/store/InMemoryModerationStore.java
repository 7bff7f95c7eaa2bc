package com.jz.moderation.store;

import com.jz.moderation.domain.entity.Challenge;
import com.jz.moderation.domain.entity.ModAction;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.domain.entity.Warning;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 单进程实现（moderation.store.type=memory），用于本地调试和测试。
 * 所有方法 synchronized，TTL 按注入的 Clock 惰性判断。
 */
public class InMemoryModerationStore implements ModerationStore {

    private final Clock clock;

    private final Map<Long, PolicySettings> settings = new HashMap<>();
    private final Map<String, Expiring<TreeMap<String, Long>>> floods = new HashMap<>();
    private final Map<String, Expiring<Instant>> joins = new HashMap<>();
    private final Map<String, Expiring<Boolean>> welcomed = new HashMap<>();
    private final Map<String, List<Warning>> warnings = new HashMap<>();
    private final Map<Long, LinkedList<ModAction>> modlog = new HashMap<>();
    private final Map<String, Expiring<Challenge>> challenges = new HashMap<>();

    public InMemoryModerationStore(Clock clock) {
        this.clock = clock;
    }

    private record Expiring<T>(T value, Instant expiresAt) {
        boolean alive(Instant now) {
            return expiresAt == null || now.isBefore(expiresAt);
        }
    }

    private static String k(long chatId, long userId) {
        return chatId + ":" + userId;
    }

    private <T> T live(Map<String, Expiring<T>> map, String key) {
        Expiring<T> e = map.get(key);
        if (e == null) return null;
        if (!e.alive(clock.instant())) {
            map.remove(key);
            return null;
        }
        return e.value();
    }

    // ---------- settings ----------

    @Override
    public synchronized Optional<PolicySettings> findSettings(long chatId) {
        return Optional.ofNullable(settings.get(chatId));
    }

    @Override
    public synchronized void saveSettings(PolicySettings s) {
        settings.put(s.getChatId(), s);
    }

    @Override
    public synchronized void deleteSettings(long chatId) {
        settings.remove(chatId);
    }

    // ---------- flood ----------

    @Override
    public synchronized FloodWindowSnapshot recordFlood(long chatId, long userId, FloodEntry entry,
                                                        Instant pruneBefore, Instant windowStart, Duration ttl) {
        String key = k(chatId, userId);
        TreeMap<String, Long> zset = live(floods, key);
        boolean existed = zset != null;
        if (zset == null) zset = new TreeMap<>();

        zset.put(entry.encode(), entry.sentAt().toEpochMilli());
        long prune = pruneBefore.toEpochMilli();
        zset.values().removeIf(score -> score < prune);
        floods.put(key, new Expiring<>(zset, clock.instant().plus(ttl)));

        long from = windowStart.toEpochMilli();
        long to = entry.sentAt().toEpochMilli();
        List<FloodEntry> inWindow = new ArrayList<>();
        zset.forEach((member, score) -> {
            if (score >= from && score <= to) inWindow.add(FloodEntry.decode(member));
        });
        return new FloodWindowSnapshot(existed, inWindow);
    }

    @Override
    public synchronized void clearFlood(long chatId, long userId) {
        floods.remove(k(chatId, userId));
    }

    // ---------- join ----------

    @Override
    public synchronized void saveJoin(long chatId, long userId, Instant joinedAt, Duration ttl) {
        joins.put(k(chatId, userId), new Expiring<>(joinedAt, clock.instant().plus(ttl)));
    }

    @Override
    public synchronized Optional<Instant> findJoin(long chatId, long userId) {
        return Optional.ofNullable(live(joins, k(chatId, userId)));
    }

    @Override
    public synchronized boolean markWelcomed(long chatId, long userId, Duration ttl) {
        String key = k(chatId, userId);
        if (live(welcomed, key) != null) return false;
        welcomed.put(key, new Expiring<>(Boolean.TRUE, clock.instant().plus(ttl)));
        return true;
    }

    // ---------- warnings ----------

    @Override
    public synchronized long appendWarning(Warning warning) {
        List<Warning> list = warnings.computeIfAbsent(k(warning.getChatId(), warning.getUserId()), x -> new ArrayList<>());
        list.add(warning);
        return list.size();
    }

    @Override
    public synchronized List<Warning> findWarnings(long chatId, long userId) {
        return List.copyOf(warnings.getOrDefault(k(chatId, userId), List.of()));
    }

    @Override
    public synchronized long countWarnings(long chatId, long userId) {
        return warnings.getOrDefault(k(chatId, userId), List.of()).size();
    }

    @Override
    public synchronized long clearWarnings(long chatId, long userId) {
        List<Warning> removed = warnings.remove(k(chatId, userId));
        return removed == null ? 0 : removed.size();
    }

    // ---------- audit ----------

    @Override
    public synchronized void appendModAction(ModAction action, int maxEntries) {
        LinkedList<ModAction> list = modlog.computeIfAbsent(action.getChatId(), x -> new LinkedList<>());
        list.addFirst(action);
        while (list.size() > maxEntries) list.removeLast();
    }

    @Override
    public synchronized List<ModAction> findModActions(long chatId, int limit) {
        List<ModAction> list = modlog.getOrDefault(chatId, new LinkedList<>());
        return List.copyOf(list.subList(0, Math.min(Math.max(limit, 0), list.size())));
    }

    // ---------- challenge ----------

    @Override
    public synchronized void saveChallenge(Challenge challenge, Duration ttl) {
        challenges.put(k(challenge.getChatId(), challenge.getUserId()),
                new Expiring<>(challenge, clock.instant().plus(ttl)));
    }

    @Override
    public synchronized Optional<Challenge> findChallenge(long chatId, long userId) {
        return Optional.ofNullable(live(challenges, k(chatId, userId)));
    }

    @Override
    public synchronized boolean deleteChallenge(long chatId, long userId, String challengeId) {
        String key = k(chatId, userId);
        Challenge current = live(challenges, key);
        if (current == null || !current.getId().equals(challengeId)) return false;
        challenges.remove(key);
        return true;
    }
}
