package com.jz.moderation.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ModerationRedisKeysTest {

    private final ModerationRedisKeys keys = new ModerationRedisKeys("mod:");

    @Test
    void keys_are_namespaced_per_entity() {
        assertThat(keys.settings(-1L)).isEqualTo("mod:settings:-1");
        assertThat(keys.flood(-1L, 2L)).isEqualTo("mod:flood:-1:2");
        assertThat(keys.join(-1L, 2L)).isEqualTo("mod:join:-1:2");
        assertThat(keys.warns(-1L, 2L)).isEqualTo("mod:warns:-1:2");
        assertThat(keys.modlog(-1L)).isEqualTo("mod:modlog:-1");
        assertThat(keys.challenge(-1L, 2L)).isEqualTo("mod:captcha:-1:2");
        assertThat(keys.welcomed(-1L, 2L)).isEqualTo("mod:welcomed:-1:2");
    }

    @Test
    void null_prefix_means_no_prefix() {
        assertThat(new ModerationRedisKeys(null).settings(3L)).isEqualTo("settings:3");
    }
}
