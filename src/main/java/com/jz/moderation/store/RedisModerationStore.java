package com.jz.moderation.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.moderation.common.StoreException;
import com.jz.moderation.domain.entity.Challenge;
import com.jz.moderation.domain.entity.ModAction;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.domain.entity.Warning;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Redis 实现：String(JSON) / LIST(JSON) / ZSET，多步修改一律走 Lua 保证原子。
 */
@Slf4j
@RequiredArgsConstructor
public class RedisModerationStore implements ModerationStore {

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final ModerationRedisKeys keys;
    @SuppressWarnings("rawtypes")
    private final DefaultRedisScript<List> floodWindowScript;
    private final DefaultRedisScript<Long> modlogAppendScript;
    private final DefaultRedisScript<Long> clearListScript;
    private final DefaultRedisScript<Long> challengeDeleteScript;

    // ---------- settings ----------

    @Override
    public Optional<PolicySettings> findSettings(long chatId) {
        String json = call("findSettings", () -> redis.opsForValue().get(keys.settings(chatId)));
        if (json == null) return Optional.empty();
        return Optional.of(read(json, PolicySettings.class).withChatId(chatId));
    }

    @Override
    public void saveSettings(PolicySettings settings) {
        String json = write(settings);
        call("saveSettings", () -> {
            redis.opsForValue().set(keys.settings(settings.getChatId()), json);
            return null;
        });
    }

    @Override
    public void deleteSettings(long chatId) {
        call("deleteSettings", () -> redis.delete(keys.settings(chatId)));
    }

    // ---------- flood ----------

    @Override
    @SuppressWarnings("unchecked")
    public FloodWindowSnapshot recordFlood(long chatId, long userId, FloodEntry entry,
                                           Instant pruneBefore, Instant windowStart, Duration ttl) {
        List<Object> raw = call("recordFlood", () -> redis.execute(floodWindowScript,
                List.of(keys.flood(chatId, userId)),
                entry.encode(),
                String.valueOf(entry.sentAt().toEpochMilli()),
                String.valueOf(pruneBefore.toEpochMilli()),
                String.valueOf(windowStart.toEpochMilli()),
                String.valueOf(ttl.toMillis())));
        if (raw == null || raw.isEmpty()) {
            throw new StoreException("flood script returned no result");
        }
        boolean existed = "1".equals(String.valueOf(raw.get(0)));
        List<FloodEntry> entries = new ArrayList<>(raw.size() - 1);
        for (Object member : raw.subList(1, raw.size())) {
            try {
                entries.add(FloodEntry.decode(String.valueOf(member)));
            } catch (IllegalArgumentException e) {
                log.warn("[ModStore] bad flood member ignored: {}", e.getMessage());
            }
        }
        return new FloodWindowSnapshot(existed, entries);
    }

    @Override
    public void clearFlood(long chatId, long userId) {
        call("clearFlood", () -> redis.delete(keys.flood(chatId, userId)));
    }

    // ---------- join ----------

    @Override
    public void saveJoin(long chatId, long userId, Instant joinedAt, Duration ttl) {
        call("saveJoin", () -> {
            redis.opsForValue().set(keys.join(chatId, userId), String.valueOf(joinedAt.toEpochMilli()), ttl);
            return null;
        });
    }

    @Override
    public Optional<Instant> findJoin(long chatId, long userId) {
        String v = call("findJoin", () -> redis.opsForValue().get(keys.join(chatId, userId)));
        if (v == null) return Optional.empty();
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(v)));
        } catch (NumberFormatException e) {
            throw new StoreException("corrupt join record: " + v, e);
        }
    }

    @Override
    public boolean markWelcomed(long chatId, long userId, Duration ttl) {
        Boolean ok = call("markWelcomed",
                () -> redis.opsForValue().setIfAbsent(keys.welcomed(chatId, userId), "1", ttl));
        return Boolean.TRUE.equals(ok);
    }

    // ---------- warnings ----------

    @Override
    public long appendWarning(Warning warning) {
        String json = write(warning);
        Long size = call("appendWarning",
                () -> redis.opsForList().rightPush(keys.warns(warning.getChatId(), warning.getUserId()), json));
        return size == null ? 0 : size;
    }

    @Override
    public List<Warning> findWarnings(long chatId, long userId) {
        List<String> rows = call("findWarnings", () -> redis.opsForList().range(keys.warns(chatId, userId), 0, -1));
        return parseAll(rows, Warning.class);
    }

    @Override
    public long countWarnings(long chatId, long userId) {
        Long size = call("countWarnings", () -> redis.opsForList().size(keys.warns(chatId, userId)));
        return size == null ? 0 : size;
    }

    @Override
    public long clearWarnings(long chatId, long userId) {
        Long n = call("clearWarnings",
                () -> redis.execute(clearListScript, List.of(keys.warns(chatId, userId))));
        return n == null ? 0 : n;
    }

    // ---------- audit ----------

    @Override
    public void appendModAction(ModAction action, int maxEntries) {
        String json = write(action);
        call("appendModAction", () -> redis.execute(modlogAppendScript,
                List.of(keys.modlog(action.getChatId())), json, String.valueOf(maxEntries)));
    }

    @Override
    public List<ModAction> findModActions(long chatId, int limit) {
        if (limit <= 0) return List.of();
        List<String> rows = call("findModActions", () -> redis.opsForList().range(keys.modlog(chatId), 0, limit - 1));
        return parseAll(rows, ModAction.class);
    }

    // ---------- challenge ----------

    @Override
    public void saveChallenge(Challenge challenge, Duration ttl) {
        String json = write(challenge);
        call("saveChallenge", () -> {
            redis.opsForValue().set(keys.challenge(challenge.getChatId(), challenge.getUserId()), json, ttl);
            return null;
        });
    }

    @Override
    public Optional<Challenge> findChallenge(long chatId, long userId) {
        String json = call("findChallenge", () -> redis.opsForValue().get(keys.challenge(chatId, userId)));
        return json == null ? Optional.empty() : Optional.of(read(json, Challenge.class));
    }

    @Override
    public boolean deleteChallenge(long chatId, long userId, String challengeId) {
        Long n = call("deleteChallenge",
                () -> redis.execute(challengeDeleteScript, List.of(keys.challenge(chatId, userId)), challengeId));
        return n != null && n > 0;
    }

    // ---------- helpers ----------

    private <T> T call(String op, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreException("redis " + op + " failed: " + e.getMessage(), e);
        }
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("serialize " + value.getClass().getSimpleName() + " failed", e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("corrupt " + type.getSimpleName() + " json: " + e.getOriginalMessage(), e);
        }
    }

    private <T> List<T> parseAll(List<String> rows, Class<T> type) {
        if (rows == null || rows.isEmpty()) return List.of();
        List<T> out = new ArrayList<>(rows.size());
        for (String row : rows) {
            try {
                out.add(mapper.readValue(row, type));
            } catch (JsonProcessingException e) {
                log.warn("[ModStore] bad {} json ignored: {}", type.getSimpleName(), e.getOriginalMessage());
            }
        }
        return out;
    }
}
