package com.roomchat.config;

import com.roomchat.contentpolicy.ContentPolicyMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * @class ChatRoomProperties
 * @brief application.yml 의 chat.* 설정. 범위를 벗어난 값은 기동 시점에 검증 실패로 멈춘다.
 */
@Configuration
@ConfigurationProperties(prefix = "chat")
@Data
@Validated
public class ChatRoomProperties {

    @Valid
    @NotNull
    private RateLimit messageRate = new RateLimit(Duration.ofSeconds(10), 5);

    @Valid
    @NotNull
    private RateLimit connectRate = new RateLimit(Duration.ofSeconds(10), 20);

    @Positive
    private int maxConnectionsPerUser = 3;

    /** 비어 있으면 방 인원 제한 없음 */
    @Positive
    private Integer maxConnectionsPerRoom;

    @Valid
    @NotNull
    private History history = new History();

    @Valid
    @NotNull
    private ContentPolicy contentPolicy = new ContentPolicy();

    @Valid
    @NotNull
    private Moderation moderation = new Moderation();

    @Valid
    @NotNull
    private Session session = new Session();

    @Valid
    @NotNull
    private Outbound outbound = new Outbound();

    /** 연결 0 인 방을 이 시간 이상 유지하면 메모리에서 내린다 */
    @NotNull
    private Duration roomIdleTtl = Duration.ofMinutes(5);

    @NotNull
    private StorageType storage = StorageType.REDIS;

    public enum StorageType {
        REDIS,
        MEMORY
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RateLimit {
        @NotNull
        private Duration window;
        @Positive
        private int maxCount;
    }

    @Data
    public static class History {
        @PositiveOrZero
        private int limit = 200;
        @Positive
        private int persistEveryNMessages = 1;
    }

    @Data
    public static class ContentPolicy {
        @NotNull
        private ContentPolicyMode mode = ContentPolicyMode.OFF;
        /** 언어 코드 목록. "all" 이면 지원 언어 전체 */
        private List<String> languages = new ArrayList<>(List.of("en", "ko"));
        private List<String> denylist = new ArrayList<>();
        private List<String> allowlist = new ArrayList<>();
    }

    @Data
    public static class Moderation {
        /** 운영자 차단 (모더레이터가 해제 불가) */
        private List<String> deniedGithubUserIds = new ArrayList<>();
        private List<String> moderatorGithubUserIds = new ArrayList<>();
    }

    @Data
    public static class Session {
        /** HS256 서명 키. 32자 미만이면 기동 실패 */
        @NotBlank
        @Size(min = 32)
        private String secret;
    }

    @Data
    public static class Outbound {
        /** 연결 1개에 대한 단일 send 최대 대기 */
        @NotNull
        private Duration sendTimeLimit = Duration.ofSeconds(5);
        /** 연결 1개에 쌓일 수 있는 미전송 버퍼 (bytes) */
        @Positive
        private int bufferSizeLimit = 512 * 1024;
    }
}
