package com.jz.moderation.guard;

import com.jz.moderation.domain.dto.FilterCheckResult;
import com.jz.moderation.domain.dto.WordListChange;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.service.PolicyChangedEvent;
import com.jz.moderation.service.PolicyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * 关键词黑名单。大小写不敏感，按“字母/数字边界”匹配，
 * 所以 "spam" 不会命中 "spammer"，但会命中 "spam!"。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentFilter {

    private final PolicyStore policyStore;

    /** chatId -> 已编译的词表（连同编译时的源词表，源变了就重编） */
    private final ConcurrentMap<Long, CompiledWords> compiled = new ConcurrentHashMap<>();

    private record CompiledWords(List<String> source, List<String> words, List<Pattern> patterns) {
    }

    public FilterCheckResult check(PolicySettings settings, String text) {
        List<String> source = settings.getFilterWords();
        if (text == null || text.isEmpty() || source == null || source.isEmpty()) {
            return FilterCheckResult.clean();
        }
        CompiledWords cw = compiled.compute(settings.getChatId(),
                (id, old) -> old != null && old.source().equals(source) ? old : compile(source));
        for (int i = 0; i < cw.patterns().size(); i++) {
            if (cw.patterns().get(i).matcher(text).find()) {
                return FilterCheckResult.matched(cw.words().get(i));
            }
        }
        return FilterCheckResult.clean();
    }

    public WordListChange addWord(long chatId, String raw) {
        String word = normalize(raw);
        if (word.isEmpty()) return WordListChange.BLANK;
        if (word.length() > PolicyValidator.MAX_WORD_LENGTH) return WordListChange.TOO_LONG;

        AtomicReference<WordListChange> result = new AtomicReference<>();
        policyStore.update(chatId, s -> {
            List<String> words = s.getFilterWords();
            if (words.stream().anyMatch(w -> normalize(w).equals(word))) {
                result.set(WordListChange.DUPLICATE);
                return s;
            }
            if (words.size() >= PolicyValidator.MAX_FILTER_WORDS) {
                log.warn("[ContentFilter] word list full, size={}", words.size());
                result.set(WordListChange.LIST_FULL);
                return s;
            }
            List<String> next = new ArrayList<>(words);
            next.add(word);
            result.set(WordListChange.ADDED);
            return s.withFilterWords(next);
        });
        invalidate(chatId);
        return result.get();
    }

    public WordListChange removeWord(long chatId, String raw) {
        String word = normalize(raw);
        if (word.isEmpty()) return WordListChange.BLANK;

        AtomicReference<WordListChange> result = new AtomicReference<>(WordListChange.NOT_FOUND);
        policyStore.update(chatId, s -> {
            List<String> next = new ArrayList<>(s.getFilterWords());
            if (!next.removeIf(w -> normalize(w).equals(word))) return s;
            result.set(WordListChange.REMOVED);
            return s.withFilterWords(next);
        });
        invalidate(chatId);
        return result.get();
    }

    public List<String> words(long chatId) {
        return List.copyOf(policyStore.get(chatId).getFilterWords());
    }

    /** @return 清掉的词数 */
    public int clear(long chatId) {
        AtomicReference<Integer> removed = new AtomicReference<>(0);
        policyStore.update(chatId, s -> {
            removed.set(s.getFilterWords().size());
            return s.withFilterWords(List.of());
        });
        invalidate(chatId);
        return removed.get();
    }

    public void invalidate(long chatId) {
        compiled.remove(chatId);
    }

    @EventListener
    public void onPolicyChanged(PolicyChangedEvent event) {
        invalidate(event.chatId());
    }

    static Pattern compileWord(String word) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(word) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static CompiledWords compile(List<String> source) {
        List<String> words = new ArrayList<>(source.size());
        List<Pattern> patterns = new ArrayList<>(source.size());
        for (String w : source) {
            String t = w == null ? "" : w.trim();
            if (t.isEmpty()) continue;
            words.add(t);
            patterns.add(compileWord(t));
        }
        return new CompiledWords(List.copyOf(source), words, patterns);
    }

    private static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }
}
