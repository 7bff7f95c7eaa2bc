package com.jz.moderation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jz.moderation.common.ValidationException;
import com.jz.moderation.common.Violation;
import com.jz.moderation.common.StoreException;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.guard.PolicyValidator;
import com.jz.moderation.security.IdMasker;
import com.jz.moderation.store.ModerationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * 群设置的读写入口。读永不失败（缺失/损坏/存储不可用 → 默认值），写前必校验。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyStore {

    private final ModerationStore store;
    private final ObjectMapper mapper;
    private final ApplicationEventPublisher events;
    private final IdMasker masker;

    private final ConcurrentMap<Long, Object> locks = new ConcurrentHashMap<>();

    /** 读取设置；任何存储异常都降级为默认值 */
    public PolicySettings get(long chatId) {
        try {
            return loadOrDefaults(chatId);
        } catch (StoreException e) {
            log.warn("[PolicyStore] load failed, using defaults. chat={}, err={}", masker.chat(chatId), e.getMessage());
            return PolicySettings.defaults(chatId);
        }
    }

    /** 与 {@link #get} 相同，但存储异常直接抛出（缓存加载、读改写用） */
    public PolicySettings loadOrDefaults(long chatId) {
        return store.findSettings(chatId).orElseGet(() -> PolicySettings.defaults(chatId));
    }

    public List<Violation> validate(PolicySettings settings) {
        return PolicyValidator.validate(settings);
    }

    /**
     * 校验后整体替换。
     *
     * @throws ValidationException 携带全部违规项，此时不做任何写入
     * @throws StoreException      写入失败
     */
    public PolicySettings save(PolicySettings settings) {
        List<Violation> violations = validate(settings);
        if (!violations.isEmpty()) throw new ValidationException(violations);

        store.saveSettings(settings);
        events.publishEvent(new PolicyChangedEvent(settings.getChatId()));
        log.info("[PolicyStore] settings saved chat={}", masker.chat(settings.getChatId()));
        return settings;
    }

    /** 读-改-写的唯一入口；同一个群串行 */
    public PolicySettings update(long chatId, UnaryOperator<PolicySettings> mutator) {
        synchronized (locks.computeIfAbsent(chatId, id -> new Object())) {
            PolicySettings current = loadOrDefaults(chatId);
            return save(mutator.apply(current).withChatId(chatId));
        }
    }

    public void reset(long chatId) {
        store.deleteSettings(chatId);
        events.publishEvent(new PolicyChangedEvent(chatId));
        log.info("[PolicyStore] settings reset chat={}", masker.chat(chatId));
    }

    public String exportJson(long chatId) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(get(chatId));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("settings export failed", e);
        }
    }

    /**
     * 导入 JSON 设置。chatId 以参数为准，payload 里的 chat_id 被忽略；
     * 未知字段、类型错误、越界都会以列表形式整体拒绝。
     */
    public PolicySettings importJson(long chatId, String json) {
        JsonNode node;
        try {
            node = json == null ? null : mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw ValidationException.of("json", "malformed JSON: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw ValidationException.of("json", "payload must be a JSON object");
        }
        ObjectNode obj = (ObjectNode) node;
        obj.remove("chat_id");

        List<Violation> unknown = new ArrayList<>();
        Set<String> known = knownFields();
        for (Iterator<String> it = obj.fieldNames(); it.hasNext(); ) {
            String name = it.next();
            if (!known.contains(name)) unknown.add(new Violation(name, "unknown setting"));
        }
        if (!unknown.isEmpty()) throw new ValidationException(unknown);

        PolicySettings parsed;
        try {
            parsed = mapper.readerFor(PolicySettings.class)
                    .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .with(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                    .readValue(obj);
        } catch (JsonMappingException e) {
            throw ValidationException.of(fieldOf(e), "invalid value: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw ValidationException.of("json", "unreadable payload: " + e.getMessage());
        }
        return save(parsed.withChatId(chatId));
    }

    private Set<String> knownFields() {
        Set<String> names = new HashSet<>();
        mapper.valueToTree(PolicySettings.defaults(0)).fieldNames().forEachRemaining(names::add);
        return names;
    }

    private static String fieldOf(JsonMappingException e) {
        String path = e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."));
        return path.isEmpty() ? "json" : path;
    }
}
