package com.ryuqq.milestone.core.spi;

import java.util.Locale;

/**
 * 저장소의 Discussion 카테고리.
 *
 * @param id 원격 식별자
 * @param name 표시 이름
 * @param slug URL slug (예: "q-a")
 * @param answerable 댓글을 답변으로 채택할 수 있는 카테고리인지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DiscussionCategory(String id, String name, String slug, boolean answerable) {

    public DiscussionCategory {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null) {
            name = "";
        }
        if (slug == null) {
            slug = name.toLowerCase(Locale.ROOT).replace(' ', '-');
        }
    }
}
