package com.jz.moderation.config;

import com.jz.moderation.admission.ChallengeGenerator;
import com.jz.moderation.security.IdMasker;
import com.jz.moderation.transport.ChatTransport;
import com.jz.moderation.transport.LoggingChatTransport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;

@Configuration
public class TransportConfig {

    @Bean
    public IdMasker idMasker(ModerationProperties props) {
        return new IdMasker(props.getMasking().getSalt());
    }

    /** 没有真实平台客户端时，只打日志 */
    @Bean
    @ConditionalOnMissingBean(ChatTransport.class)
    public ChatTransport loggingChatTransport(IdMasker masker) {
        return new LoggingChatTransport(masker);
    }

    @Bean
    public ChallengeGenerator challengeGenerator(ModerationProperties props) {
        return new ChallengeGenerator(new SecureRandom(), props.getChallenge().getOptionCount());
    }
}
