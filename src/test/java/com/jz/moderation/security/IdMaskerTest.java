package com.jz.moderation.security;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdMaskerTest {

    @Test
    void stable_for_the_same_salt() {
        IdMasker a = new IdMasker("salt-1");
        IdMasker b = new IdMasker("salt-1");

        assertThat(a.user(42)).isEqualTo(b.user(42)).matches("u_[0-9a-f]{16}");
        assertThat(a.chat(-100123)).isEqualTo(b.chat(-100123)).matches("c_[0-9a-f]{16}");
    }

    @Test
    void salt_and_context_change_the_token() {
        IdMasker a = new IdMasker("salt-1");
        IdMasker b = new IdMasker("salt-2");

        assertThat(a.user(42)).isNotEqualTo(b.user(42));
        assertThat(a.user(42).substring(2)).isNotEqualTo(a.chat(42).substring(2));
        assertThat(a.user(42)).doesNotContain("42");
    }

    @Test
    void missing_salt_still_masks() {
        assertThat(new IdMasker(" ").user(42)).matches("u_[0-9a-f]{16}");
    }
}
