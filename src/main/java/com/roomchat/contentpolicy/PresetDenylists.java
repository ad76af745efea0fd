package com.roomchat.contentpolicy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * @class PresetDenylists
 * @brief 언어별 프리셋 금칙어를 classpath 의 content-policy/{lang}.txt 에서 읽는다.
 *
 * @details
 * - 한 줄에 한 항목, '#' 으로 시작하는 줄과 빈 줄은 무시
 * - 리소스가 없는 언어는 경고만 남기고 건너뛴다
 */
public final class PresetDenylists {

    private static final Logger logger = LoggerFactory.getLogger(PresetDenylists.class);
    private static final String RESOURCE_PATTERN = "content-policy/%s.txt";

    private PresetDenylists() {
    }

    public static List<String> load(Collection<ContentPolicyLanguage> languages) {
        List<String> terms = new ArrayList<>();
        for (ContentPolicyLanguage language : languages) {
            terms.addAll(load(language));
        }
        return terms;
    }

    public static List<String> load(ContentPolicyLanguage language) {
        ClassPathResource resource = new ClassPathResource(String.format(RESOURCE_PATTERN, language.code()));
        if (!resource.exists()) {
            logger.warn("[content-policy] 프리셋 금칙어 리소스 없음: language={}", language.code());
            return List.of();
        }

        List<String> terms = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                terms.add(trimmed);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("프리셋 금칙어 로딩 실패: " + resource.getPath(), e);
        }
        logger.info("[content-policy] 프리셋 금칙어 로딩: language={}, count={}", language.code(), terms.size());
        return terms;
    }
}
