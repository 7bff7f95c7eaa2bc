package com.jz.moderation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.util.List;

@Configuration
public class RedisScriptsConfig {

    /**
     * 刷屏窗口：记录 + 裁剪 + 续期 + 取窗口，一次往返原子完成。
     * KEYS[1]=zset；ARGV: member, nowMs, pruneBeforeMs, windowStartMs, ttlMs
     * 返回: [existedBefore(0/1), member...]
     */
    @Bean
    @SuppressWarnings("rawtypes")
    public DefaultRedisScript<List> floodWindowScript() {
        var s = new DefaultRedisScript<List>();
        s.setResultType(List.class);
        s.setScriptText(
                "local existed = redis.call('exists', KEYS[1]) " +
                        "redis.call('zadd', KEYS[1], ARGV[2], ARGV[1]) " +
                        "redis.call('zremrangebyscore', KEYS[1], '-inf', '(' .. ARGV[3]) " +
                        "redis.call('pexpire', KEYS[1], ARGV[5]) " +
                        "local members = redis.call('zrangebyscore', KEYS[1], ARGV[4], ARGV[2]) " +
                        "table.insert(members, 1, tostring(existed)) " +
                        "return members"
        );
        return s;
    }

    /** 审计追加并按上限裁剪（新的在表头）。ARGV: json, maxEntries */
    @Bean
    public DefaultRedisScript<Long> modlogAppendScript() {
        var s = new DefaultRedisScript<Long>();
        s.setResultType(Long.class);
        s.setScriptText(
                "redis.call('lpush', KEYS[1], ARGV[1]) " +
                        "redis.call('ltrim', KEYS[1], 0, tonumber(ARGV[2]) - 1) " +
                        "return redis.call('llen', KEYS[1])"
        );
        return s;
    }

    /** 清空警告并返回清掉的条数 */
    @Bean
    public DefaultRedisScript<Long> clearListScript() {
        var s = new DefaultRedisScript<Long>();
        s.setResultType(Long.class);
        s.setScriptText(
                "local n = redis.call('llen', KEYS[1]) " +
                        "redis.call('del', KEYS[1]) " +
                        "return n"
        );
        return s;
    }

    /** 只有存活题目的 id 匹配才 DEL；验证与超时之间的仲裁点 */
    @Bean
    public DefaultRedisScript<Long> challengeDeleteScript() {
        var s = new DefaultRedisScript<Long>();
        s.setResultType(Long.class);
        s.setScriptText(
                "local v = redis.call('get', KEYS[1]) " +
                        "if not v then return 0 end " +
                        "if cjson.decode(v)['id'] == ARGV[1] then " +
                        "  return redis.call('del', KEYS[1]) " +
                        "else return 0 end"
        );
        return s;
    }
}
