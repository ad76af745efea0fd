package com.roomchat.config;

import com.roomchat.contentpolicy.CompiledDenylist;
import com.roomchat.contentpolicy.ContentPolicy;
import com.roomchat.contentpolicy.ContentPolicyLanguage;
import com.roomchat.contentpolicy.PresetDenylists;
import com.roomchat.protocol.GithubUserIds;
import com.roomchat.ratelimit.FixedWindowRateLimiter;
import com.roomchat.room.RoomConstants;
import com.roomchat.room.core.RoomGuardrails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * @class ChatRoomConfig
 * @brief 방 엔진 공용 인프라 빈: 시계, 타이머 스케줄러, 송신 executor, 금칙어, 연결 빈도 제한기, 제한값 묶음.
 */
@Configuration
public class ChatRoomConfig {

    private static final Logger logger = LoggerFactory.getLogger(ChatRoomConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /* presence 병합 타이머 + @Scheduled 작업 공용. 이름이 taskScheduler 여야 @EnableScheduling 이 이 빈을 쓴다. */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("room-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /* 연결별 송신 대기열 drain 전용. 방 lock 밖에서 소켓 쓰기를 한다. 포화 시 거절 → 호출 스레드에서 처리 */
    @Bean(name = "outboundExecutor")
    public ThreadPoolTaskExecutor outboundExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("room-outbound-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }

    @Bean
    public CompiledDenylist compiledDenylist(ChatRoomProperties properties) {
        ChatRoomProperties.ContentPolicy contentPolicy = properties.getContentPolicy();
        Set<ContentPolicyLanguage> languages = parseLanguages(contentPolicy.getLanguages());

        CompiledDenylist compiled = ContentPolicy.buildCompiledDenylist(
                PresetDenylists.load(languages),
                splitEntries(contentPolicy.getDenylist()),
                splitEntries(contentPolicy.getAllowlist()));
        logger.info("[content-policy] mode={}, languages={}, terms={}",
                contentPolicy.getMode(), languages, compiled.size());
        return compiled;
    }

    @Bean
    public FixedWindowRateLimiter connectRateLimiter(ChatRoomProperties properties) {
        ChatRoomProperties.RateLimit connectRate = properties.getConnectRate();
        return new FixedWindowRateLimiter("connect", connectRate.getWindow(), connectRate.getMaxCount(),
                RoomConstants.ROOM_RATE_LIMIT_MAX_TRACKED_KEYS);
    }

    @Bean
    public RoomGuardrails roomGuardrails(ChatRoomProperties properties, CompiledDenylist compiledDenylist) {
        Set<String> operatorDenied;
        try {
            operatorDenied = GithubUserIds.parseList(
                    properties.getModeration().getDeniedGithubUserIds(), "chat.moderation.denied-github-user-ids");
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("잘못된 설정: " + e.getMessage(), e);
        }

        RoomGuardrails guardrails = RoomGuardrails.builder()
                .messageRateWindow(properties.getMessageRate().getWindow())
                .messageRateMaxCount(properties.getMessageRate().getMaxCount())
                .maxConnectionsPerUser(properties.getMaxConnectionsPerUser())
                .maxConnectionsPerRoom(properties.getMaxConnectionsPerRoom())
                .historyLimit(properties.getHistory().getLimit())
                .historyPersistEveryNMessages(properties.getHistory().getPersistEveryNMessages())
                .contentPolicyMode(properties.getContentPolicy().getMode())
                .compiledDenylist(compiledDenylist)
                .operatorDeniedGithubUserIds(operatorDenied)
                .build();
        logger.info("[설정] {}", guardrails);
        return guardrails;
    }

    // "all" → 지원 언어 전체. 모르는 코드는 기동 실패.
    static Set<ContentPolicyLanguage> parseLanguages(Collection<String> codes) {
        Set<ContentPolicyLanguage> languages = new LinkedHashSet<>();
        if (codes == null) {
            return languages;
        }
        for (String code : splitEntries(codes)) {
            if ("all".equals(code)) {
                languages.addAll(Arrays.asList(ContentPolicyLanguage.values()));
                continue;
            }
            try {
                languages.add(ContentPolicyLanguage.fromCode(code));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("잘못된 설정 chat.content-policy.languages: " + code, e);
            }
        }
        return languages;
    }

    // 항목 안의 쉼표/줄바꿈도 나눈다. trim + 소문자 + 중복 제거.
    static List<String> splitEntries(Collection<String> values) {
        Set<String> entries = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value == null) {
                    continue;
                }
                for (String part : value.split("[,\\n]")) {
                    String trimmed = part.trim().toLowerCase(Locale.ROOT);
                    if (!trimmed.isEmpty()) {
                        entries.add(trimmed);
                    }
                }
            }
        }
        return new ArrayList<>(entries);
    }
}
